package com.aind.metadata.service;

import com.aind.metadata.model.ChatEvent;
import com.aind.metadata.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Attributes validation results to the capture tool call that produced them.
 * Only the most recent capture tool-use id is remembered, and each id takes one result.
 * Call {@link #drain()} before handling every stream event.
 */
@Slf4j
public class ToolResultCorrelator {

    private final ValidationEventChannel channel;
    private String pendingToolUseId;

    public ToolResultCorrelator(ValidationEventChannel channel) {
        this.channel = channel;
    }

    public void observeToolUse(String toolName, String toolUseId) {
        if (CaptureTools.isCaptureTool(toolName)) {
            pendingToolUseId = toolUseId;
        }
    }

    public List<ChatEvent> drain() {
        List<ChatEvent> events = new ArrayList<>();
        ValidationResult result;
        while ((result = channel.poll()) != null) {
            if (pendingToolUseId != null) {
                events.add(ChatEvent.toolResult(pendingToolUseId, result));
                pendingToolUseId = null;
            } else {
                log.debug("No pending capture call for {} validation, discarding", result.getRecordType());
            }
        }
        return events;
    }

    public String getPendingToolUseId() {
        return pendingToolUseId;
    }
}
