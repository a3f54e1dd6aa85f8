package com.aind.metadata.service;

import com.aind.metadata.model.ConversationTurn;
import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.MetadataRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the prompt for one chat turn: fixed instructions, prior turns, the session's
 * records and the session id the capture tools must use.
 */
@Service
@Slf4j
public class ChatPromptBuilder {

    static final String SYSTEM_PROMPT =
        "You are a metadata capture assistant for neuroscience experiments.\n" +
        "Extract metadata from what the scientist tells you and save it with capture_metadata,\n" +
        "one record type per call. Use find_records to reuse shared records (subjects, procedures,\n" +
        "instruments, rigs) and link_records to connect related records.\n" +
        "Relay every validation issue and registry result the tools report back to the user.";

    public String buildPrompt(String sessionId, List<ConversationTurn> priorTurns, String userMessage,
                              List<MetadataRecord> records) {
        if (userMessage == null || userMessage.trim().isEmpty()) {
            throw new IllegalArgumentException("Message cannot be empty");
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append(SYSTEM_PROMPT);
        prompt.append("\n\n");

        if (priorTurns != null && !priorTurns.isEmpty()) {
            prompt.append("Previous conversation:\n");
            for (ConversationTurn turn : priorTurns) {
                prompt.append(turn.getRole().toUpperCase())
                        .append(": ")
                        .append(turn.getContent())
                        .append("\n");
            }
            prompt.append("\n");
        }

        prompt.append("USER: ").append(userMessage);

        if (records != null && !records.isEmpty()) {
            prompt.append("\n\nExisting metadata records for this session:");
            for (MetadataRecord record : records) {
                prompt.append("\n- [").append(record.getRecordType().getValue()).append("]")
                        .append(" id=").append(record.getId())
                        .append(" name=\"").append(record.getName() != null ? record.getName() : "unnamed").append("\"")
                        .append(" data=").append(JsonDocuments.write(record.getData()));
            }
        }

        prompt.append("\n\nIMPORTANT: When calling capture_metadata, always use session_id=\"")
                .append(sessionId)
                .append("\"");

        log.debug("Prompt for session {}: {} chars, {} prior turns, {} records", sessionId, prompt.length(),
                priorTurns == null ? 0 : priorTurns.size(), records == null ? 0 : records.size());
        return prompt.toString();
    }
}
