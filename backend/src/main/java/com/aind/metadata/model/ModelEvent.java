package com.aind.metadata.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stream event emitted by a conversation model while it answers one turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelEvent {

    public enum Type {
        THINKING_START,
        THINKING_DELTA,
        TEXT_DELTA,
        TOOL_USE_START,
        TOOL_INPUT_DELTA,
        BLOCK_STOP,
        /** A complete assistant message; its text may not have been streamed as deltas. */
        ASSISTANT_MESSAGE,
        RESULT
    }

    private Type type;

    private String text;

    private String toolName;

    private String toolUseId;

    private Integer numTurns;

    private Long durationMs;

    public static ModelEvent textDelta(String text) {
        return ModelEvent.builder().type(Type.TEXT_DELTA).text(text).build();
    }

    public static ModelEvent thinkingStart() {
        return ModelEvent.builder().type(Type.THINKING_START).build();
    }

    public static ModelEvent thinkingDelta(String text) {
        return ModelEvent.builder().type(Type.THINKING_DELTA).text(text).build();
    }

    public static ModelEvent toolUseStart(String toolName, String toolUseId) {
        return ModelEvent.builder().type(Type.TOOL_USE_START).toolName(toolName).toolUseId(toolUseId).build();
    }

    public static ModelEvent toolInputDelta(String partialJson) {
        return ModelEvent.builder().type(Type.TOOL_INPUT_DELTA).text(partialJson).build();
    }

    public static ModelEvent blockStop() {
        return ModelEvent.builder().type(Type.BLOCK_STOP).build();
    }

    public static ModelEvent assistantMessage(String text) {
        return ModelEvent.builder().type(Type.ASSISTANT_MESSAGE).text(text).build();
    }

    public static ModelEvent result(int numTurns, long durationMs) {
        return ModelEvent.builder().type(Type.RESULT).numTurns(numTurns).durationMs(durationMs).build();
    }
}
