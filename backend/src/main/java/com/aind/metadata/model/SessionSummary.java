package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummary {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("last_active")
    private LocalDateTime lastActive;

    @JsonProperty("message_count")
    private long messageCount;

    @JsonProperty("first_message")
    private String firstMessage;

    /** Projection constructor for the grouped conversation query. */
    public SessionSummary(String sessionId, LocalDateTime createdAt, LocalDateTime lastActive, Long messageCount) {
        this(sessionId, createdAt, lastActive, messageCount == null ? 0L : messageCount, null);
    }
}
