package com.openforge.plantmate.domain;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.LastModifiedDate;

import java.time.LocalDateTime;

/**
 * One conversation. The orchestrator only reads and touches it; creating,
 * renaming and deleting sessions is the business of the outer application, so
 * a row is created lazily the first time a message arrives for an unknown id.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chat_sessions",
    uniqueConstraints = @UniqueConstraint(name = "uq_chat_session_id", columnNames = "session_id")
)
public class ChatSession extends BaseEntity {

    /** External id from the URL path. */
    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "title", length = 255)
    private String title;

    /** Moved forward by every message, so session lists can sort by recency. */
    @Column(name = "last_activity_time")
    private LocalDateTime lastActivityTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    /** Optimistic lock: two turns must never touch the same session row at once. */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
