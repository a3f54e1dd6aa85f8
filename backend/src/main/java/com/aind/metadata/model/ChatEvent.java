package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One server-sent event of a chat turn. Exactly one field is set per event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEvent {

    @JsonProperty("session_id")
    private String sessionId;

    private String content;

    private String thinking;

    @JsonProperty("thinking_start")
    private Boolean thinkingStart;

    @JsonProperty("tool_use_start")
    private ToolUseStart toolUseStart;

    @JsonProperty("tool_use_input")
    private String toolUseInput;

    @JsonProperty("block_stop")
    private Boolean blockStop;

    @JsonProperty("tool_result")
    private ToolResultEvent toolResult;

    private Boolean done;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolUseStart {
        private String name;
        private String id;
    }

    public static ChatEvent session(String sessionId) {
        return ChatEvent.builder().sessionId(sessionId).build();
    }

    public static ChatEvent content(String text) {
        return ChatEvent.builder().content(text).build();
    }

    public static ChatEvent thinking(String text) {
        return ChatEvent.builder().thinking(text).build();
    }

    public static ChatEvent thinkingStart() {
        return ChatEvent.builder().thinkingStart(true).build();
    }

    public static ChatEvent toolUseStart(String name, String id) {
        return ChatEvent.builder().toolUseStart(new ToolUseStart(name, id)).build();
    }

    public static ChatEvent toolUseInput(String partialJson) {
        return ChatEvent.builder().toolUseInput(partialJson).build();
    }

    public static ChatEvent blockStop() {
        return ChatEvent.builder().blockStop(true).build();
    }

    public static ChatEvent toolResult(String toolUseId, ValidationResult validation) {
        return ChatEvent.builder().toolResult(new ToolResultEvent(toolUseId, validation)).build();
    }

    public static ChatEvent done() {
        return ChatEvent.builder().done(true).build();
    }
}
