package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "conversations", indexes = {
    @Index(name = "idx_conversations_session", columnList = "session_id,created_at")
})
@Data
@NoArgsConstructor
public class ConversationTurn {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @JsonProperty("session_id")
    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Column(name = "role", nullable = false, length = 16)
    private String role;  // user | assistant

    @Column(name = "content", nullable = false, length = MetadataRecord.MAX_DOCUMENT_LENGTH)
    private String content;

    @JsonProperty("created_at")
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public ConversationTurn(String sessionId, String role, String content) {
        this.sessionId = sessionId;
        this.role = role;
        this.content = content;
        this.createdAt = LocalDateTime.now();
    }
}
