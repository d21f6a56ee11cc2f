package com.openforge.plantmate.repository;

import com.openforge.plantmate.domain.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    List<ChatMessage> findBySessionIdOrderBySequenceNoAsc(String sessionId);

    @Query("select coalesce(max(m.sequenceNo), 0) from ChatMessage m where m.sessionId = :sessionId")
    int findMaxSequenceNo(@Param("sessionId") String sessionId);
}
