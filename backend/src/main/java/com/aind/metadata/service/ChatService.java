package com.aind.metadata.service;

import com.aind.metadata.model.ChatEvent;
import com.aind.metadata.model.ConversationTurn;
import com.aind.metadata.model.ModelEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one chat turn against the configured {@link ConversationModel} and turns its stream
 * into {@link ChatEvent}s, attaching each capture's validation to its tool call.
 */
@Service
@Slf4j
public class ChatService {

    static final String APOLOGY = "I encountered an error processing your request. Please try again.";

    private final ObjectProvider<ConversationModel> modelProvider;
    private final ConversationService conversationService;
    private final RecordStoreService storeService;
    private final CaptureService captureService;
    private final ChatPromptBuilder promptBuilder;
    private final int historyTurns;
    private final int channelCapacity;

    public ChatService(ObjectProvider<ConversationModel> modelProvider,
                       ConversationService conversationService,
                       RecordStoreService storeService,
                       CaptureService captureService,
                       ChatPromptBuilder promptBuilder,
                       @Value("${chat.history-turns:10}") int historyTurns,
                       @Value("${chat.channel-capacity:64}") int channelCapacity) {
        this.modelProvider = modelProvider;
        this.conversationService = conversationService;
        this.storeService = storeService;
        this.captureService = captureService;
        this.promptBuilder = promptBuilder;
        this.historyTurns = historyTurns;
        this.channelCapacity = channelCapacity;
    }

    public boolean isModelConfigured() {
        return modelProvider.getIfAvailable() != null;
    }

    /**
     * Stream one turn. The first event carries the session id and the last one is {@code done};
     * a model failure becomes an apology message rather than an error signal.
     *
     * @param sessionId existing session, or null to start a new one
     * @throws IllegalStateException when no conversation model is configured
     */
    public Flux<ChatEvent> chat(String sessionId, String message) {
        ConversationModel model = modelProvider.getIfAvailable();
        if (model == null) {
            throw new IllegalStateException("No conversation model is configured");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Message cannot be empty");
        }
        String session = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;

        // store writes and registry lookups block, so keep them off the event loop
        return Flux.defer(() -> runTurn(model, session, message))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Flux<ChatEvent> runTurn(ConversationModel model, String sessionId, String message) {
        List<ConversationTurn> priorTurns = conversationService.recentHistory(sessionId, historyTurns);
        conversationService.saveTurn(sessionId, ConversationTurn.USER, message);
        String prompt = promptBuilder.buildPrompt(sessionId, priorTurns, message, storeService.listBySession(sessionId));

        ValidationEventChannel channel = new ValidationEventChannel(channelCapacity);
        ToolResultCorrelator correlator = new ToolResultCorrelator(channel);
        CaptureTools tools = new CaptureTools(captureService, storeService, channel);
        AssistantTranscript transcript = new AssistantTranscript();
        long started = System.currentTimeMillis();

        log.info("🔵 Chat turn started for session {} ({} prior turns, prompt {} chars)",
                sessionId, priorTurns.size(), prompt.length());

        Flux<ChatEvent> answer = Flux.defer(() -> model.respond(prompt, tools))
                .concatMap(event -> Flux.fromIterable(handle(event, correlator, transcript)))
                .onErrorResume(e -> {
                    log.error("Model query failed for session {}: {}", sessionId, e.getMessage(), e);
                    transcript.streamed(APOLOGY);
                    return Flux.just(ChatEvent.content(APOLOGY));
                });

        Flux<ChatEvent> finish = Flux.defer(() -> {
            String assistantText = transcript.text();
            if (!assistantText.isBlank()) {
                conversationService.saveTurn(sessionId, ConversationTurn.ASSISTANT, assistantText);
            }
            log.info("✅ Chat turn completed for session {} in {}ms ({} chars)",
                    sessionId, System.currentTimeMillis() - started, assistantText.length());
            return Flux.just(ChatEvent.done());
        });

        return Flux.concat(Flux.just(ChatEvent.session(sessionId)), answer, finish);
    }

    List<ChatEvent> handle(ModelEvent event, ToolResultCorrelator correlator, AssistantTranscript transcript) {
        List<ChatEvent> events = new ArrayList<>(correlator.drain());

        switch (event.getType()) {
            case THINKING_START:
                events.add(ChatEvent.thinkingStart());
                break;
            case THINKING_DELTA:
                events.add(ChatEvent.thinking(event.getText() == null ? "" : event.getText()));
                break;
            case TEXT_DELTA:
                if (event.getText() != null) {
                    transcript.streamed(event.getText());
                    events.add(ChatEvent.content(event.getText()));
                }
                break;
            case TOOL_USE_START:
                correlator.observeToolUse(event.getToolName(), event.getToolUseId());
                events.add(ChatEvent.toolUseStart(event.getToolName(), event.getToolUseId()));
                break;
            case TOOL_INPUT_DELTA:
                events.add(ChatEvent.toolUseInput(event.getText() == null ? "" : event.getText()));
                break;
            case BLOCK_STOP:
                events.add(ChatEvent.blockStop());
                break;
            case ASSISTANT_MESSAGE:
                transcript.completeMessage(event.getText()).ifPresent(unstreamed -> {
                    log.info("Emitting {} chars of unstreamed assistant text", unstreamed.length());
                    events.add(ChatEvent.content(unstreamed));
                });
                break;
            case RESULT:
                log.info("Model query complete: {} turns, {} ms", event.getNumTurns(), event.getDurationMs());
                break;
            default:
                log.debug("Ignoring model event {}", event.getType());
        }
        return events;
    }
}
