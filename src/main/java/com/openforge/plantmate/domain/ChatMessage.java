package com.openforge.plantmate.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * One message of a session, strictly ordered by {@code sequenceNo}.
 *
 * A TOOL message records one invocation: what the model asked for
 * ({@code toolInput}), what came back ({@code toolResult}, or the failure
 * description) and, in {@code content}, the short summary the client saw.
 *
 * Rows are written once and never updated.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Immutable
@Table(
    name = "chat_messages",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_chat_message_id", columnNames = "message_id"),
        @UniqueConstraint(name = "uq_chat_message_seq", columnNames = {"session_id", "sequence_no"})
    },
    indexes = @Index(name = "idx_chat_message_session", columnList = "session_id")
)
public class ChatMessage extends BaseEntity {

    public enum Role {
        USER,
        ASSISTANT,
        TOOL
    }

    @Column(name = "message_id", nullable = false, length = 36)
    private String messageId;

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "sequence_no", nullable = false)
    private Integer sequenceNo;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;

    @Column(name = "content", columnDefinition = "LONGTEXT")
    private String content;

    @Column(name = "tool_name", length = 64)
    private String toolName;

    /** Id linking the replayed tool call to its result when the context is rebuilt. */
    @Column(name = "tool_call_id", length = 64)
    private String toolCallId;

    /** JSON object the model passed to the tool. */
    @Column(name = "tool_input", columnDefinition = "TEXT")
    private String toolInput;

    /** JSON the tool returned, or the failure object handed to the model. */
    @Column(name = "tool_result", columnDefinition = "LONGTEXT")
    private String toolResult;

    @PrePersist
    void checkRoleInvariants() {
        if (role == null) {
            throw new IllegalStateException("Message role is required");
        }
        if (role == Role.TOOL && (toolName == null || toolName.isBlank())) {
            throw new IllegalStateException("Tool message without tool_name");
        }
        if (role != Role.TOOL && content == null) {
            throw new IllegalStateException(role + " message without content");
        }
    }
}
