package com.aind.metadata.controller;

import com.aind.metadata.config.VocabularyConfigLoader;
import com.aind.metadata.model.ChatEvent;
import com.aind.metadata.model.ChatRequest;
import com.aind.metadata.service.ChatService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
@Slf4j
public class ChatController {

    private final ChatService chatService;
    private final VocabularyConfigLoader vocabularyLoader;

    public ChatController(ChatService chatService, VocabularyConfigLoader vocabularyLoader) {
        this.chatService = chatService;
        this.vocabularyLoader = vocabularyLoader;
    }

    /**
     * One chat turn as server-sent events: session id first, then content, thinking,
     * tool and tool_result events, and finally done.
     */
    @PostMapping(value = "/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ChatEvent> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat request: session={}, message length={}", request.getSessionId(), request.getMessage().length());
        return chatService.chat(request.getSessionId(), request.getMessage());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", vocabularyLoader.isLoaded() ? "ok" : "degraded");
        health.put("vocabulary_loaded", vocabularyLoader.isLoaded());
        health.put("model_configured", chatService.isModelConfigured());
        return ResponseEntity.ok(health);
    }
}
