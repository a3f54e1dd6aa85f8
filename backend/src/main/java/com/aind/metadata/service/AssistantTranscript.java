package com.aind.metadata.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Text of the assistant's answer as it is streamed. Complete assistant messages are compared
 * with what was streamed since the previous one, so text the model never streamed is recovered.
 */
class AssistantTranscript {

    private final List<String> chunks = new ArrayList<>();
    private int streamedBeforeMessage;

    void streamed(String text) {
        if (text != null) {
            chunks.add(text);
        }
    }

    /**
     * @return the part of {@code messageText} that was not streamed, already added to the transcript
     */
    Optional<String> completeMessage(String messageText) {
        String streamedSince = String.join("", chunks.subList(streamedBeforeMessage, chunks.size()));
        String unstreamed = null;

        if (messageText != null && !messageText.isEmpty() && !messageText.equals(streamedSince)) {
            unstreamed = messageText;
            if (!streamedSince.isEmpty() && messageText.startsWith(streamedSince)) {
                unstreamed = messageText.substring(streamedSince.length());
            }
            if (unstreamed.isEmpty()) {
                unstreamed = null;
            } else {
                chunks.add(unstreamed);
            }
        }

        streamedBeforeMessage = chunks.size();
        return Optional.ofNullable(unstreamed);
    }

    String text() {
        return String.join("", chunks);
    }
}
