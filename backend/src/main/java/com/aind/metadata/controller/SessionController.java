package com.aind.metadata.controller;

import com.aind.metadata.exception.RecordNotFoundException;
import com.aind.metadata.model.ConversationTurn;
import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.SessionSummary;
import com.aind.metadata.service.ConversationService;
import com.aind.metadata.service.RecordStoreService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/sessions")
@CrossOrigin(origins = "*")
@Slf4j
public class SessionController {

    private final ConversationService conversationService;
    private final RecordStoreService storeService;

    public SessionController(ConversationService conversationService, RecordStoreService storeService) {
        this.conversationService = conversationService;
        this.storeService = storeService;
    }

    @GetMapping
    public ResponseEntity<List<SessionSummary>> listSessions() {
        return ResponseEntity.ok(conversationService.sessions());
    }

    @GetMapping("/{sessionId}/messages")
    public ResponseEntity<List<ConversationTurn>> getMessages(@PathVariable("sessionId") String sessionId) {
        return ResponseEntity.ok(conversationService.history(sessionId));
    }

    @GetMapping("/{sessionId}/records")
    public ResponseEntity<List<MetadataRecord>> getRecords(@PathVariable("sessionId") String sessionId) {
        return ResponseEntity.ok(storeService.listBySession(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, String>> deleteSession(@PathVariable("sessionId") String sessionId) {
        if (!storeService.deleteSession(sessionId)) {
            throw new RecordNotFoundException(sessionId, "No data found for session " + sessionId);
        }
        log.info("Session {} deleted", sessionId);
        return ResponseEntity.ok(Map.of("status", "deleted", "session_id", sessionId));
    }
}
