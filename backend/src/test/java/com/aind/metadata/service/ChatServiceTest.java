package com.aind.metadata.service;

import com.aind.metadata.model.CaptureRequest;
import com.aind.metadata.model.CaptureResponse;
import com.aind.metadata.model.ChatEvent;
import com.aind.metadata.model.ConversationTurn;
import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.ModelEvent;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.ValidationResult;
import com.aind.metadata.model.ValidationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.beans.factory.ObjectProvider;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChatServiceTest {

    @Mock
    private ObjectProvider<ConversationModel> modelProvider;

    @Mock
    private ConversationService conversationService;

    @Mock
    private RecordStoreService storeService;

    @Mock
    private CaptureService captureService;

    @Mock
    private ChatPromptBuilder promptBuilder;

    private ChatService chatService;

    @BeforeEach
    void setUp() {
        chatService = new ChatService(modelProvider, conversationService, storeService, captureService,
                promptBuilder, 10, 64);
        when(conversationService.recentHistory(anyString(), anyInt())).thenReturn(List.of());
        when(storeService.listBySession(anyString())).thenReturn(List.of());
        when(promptBuilder.buildPrompt(anyString(), anyList(), anyString(), anyList())).thenReturn("prompt");
    }

    private List<ChatEvent> run(String sessionId, ConversationModel model) {
        when(modelProvider.getIfAvailable()).thenReturn(model);
        return chatService.chat(sessionId, "The mouse is 4528").collectList().block();
    }

    private static String contentOf(List<ChatEvent> events) {
        return events.stream().map(ChatEvent::getContent).filter(c -> c != null).collect(Collectors.joining());
    }

    @Test
    void sessionComesFirstAndDoneLast() {
        List<ChatEvent> events = run("s1", (prompt, tools) -> Flux.just(
                ModelEvent.textDelta("Hello "), ModelEvent.textDelta("there"), ModelEvent.result(1, 10L)));

        assertThat(events.get(0).getSessionId()).isEqualTo("s1");
        assertThat(events.get(events.size() - 1).getDone()).isTrue();
        assertThat(contentOf(events)).isEqualTo("Hello there");
        verify(conversationService).saveTurn("s1", ConversationTurn.USER, "The mouse is 4528");
        verify(conversationService).saveTurn("s1", ConversationTurn.ASSISTANT, "Hello there");
    }

    @Test
    void newSessionGetsAnId() {
        List<ChatEvent> events = run(null, (prompt, tools) -> Flux.just(ModelEvent.textDelta("Hi")));

        assertThat(events.get(0).getSessionId()).isNotBlank();
    }

    @Test
    void validationIsAttachedToTheCaptureCallThatProducedIt() {
        ValidationResult validation = ValidationResult.builder()
                .recordType(RecordType.SUBJECT).status(ValidationStatus.VALID).completenessScore(1.0).build();
        when(captureService.capture(any(CaptureRequest.class), any(ValidationEventChannel.class))).thenAnswer(call -> {
            ValidationEventChannel channel = call.getArgument(1);
            channel.publish(validation);
            return CaptureResponse.builder().action(CaptureResponse.CREATED).recordId("r1").build();
        });

        List<ChatEvent> events = run("s1", (prompt, tools) -> Flux.concat(
                Flux.just(ModelEvent.toolUseStart("mcp__capture__capture_metadata", "tu_1"),
                        ModelEvent.toolInputDelta("{\"record_type\": \"subject\"}")),
                Flux.defer(() -> {
                    tools.invoke("mcp__capture__capture_metadata", JsonDocuments.emptyObject()
                            .put("session_id", "s1").put("record_type", "subject"));
                    return Flux.just(ModelEvent.blockStop());
                }),
                Flux.just(ModelEvent.textDelta("Saved."))));

        List<ChatEvent> toolResults = events.stream().filter(e -> e.getToolResult() != null).collect(Collectors.toList());
        assertThat(toolResults).hasSize(1);
        assertThat(toolResults.get(0).getToolResult().getToolUseId()).isEqualTo("tu_1");
        assertThat(toolResults.get(0).getToolResult().getValidation()).isEqualTo(validation);

        int toolStart = indexOf(events, e -> e.getToolUseStart() != null);
        int toolResult = indexOf(events, e -> e.getToolResult() != null);
        int saved = indexOf(events, e -> "Saved.".equals(e.getContent()));
        assertThat(toolStart).isLessThan(toolResult);
        assertThat(toolResult).isLessThan(saved);
    }

    @Test
    void unstreamedAssistantTextIsRecovered() {
        List<ChatEvent> events = run("s1", (prompt, tools) -> Flux.just(
                ModelEvent.textDelta("Saved"), ModelEvent.assistantMessage("Saved the subject.")));

        assertThat(contentOf(events)).isEqualTo("Saved the subject.");
        verify(conversationService).saveTurn("s1", ConversationTurn.ASSISTANT, "Saved the subject.");
    }

    @Test
    void modelFailureBecomesAnApology() {
        List<ChatEvent> events = run("s1", (prompt, tools) -> Flux.concat(
                Flux.just(ModelEvent.thinkingStart(), ModelEvent.thinkingDelta("hmm")),
                Flux.<ModelEvent>error(new IllegalStateException("model unavailable"))));

        assertThat(events.get(0).getSessionId()).isEqualTo("s1");
        assertThat(events.get(1).getThinkingStart()).isTrue();
        assertThat(events.get(2).getThinking()).isEqualTo("hmm");
        assertThat(events.get(3).getContent()).isEqualTo(ChatService.APOLOGY);
        assertThat(events.get(4).getDone()).isTrue();
        assertThat(events).hasSize(5);
        verify(conversationService).saveTurn("s1", ConversationTurn.ASSISTANT, ChatService.APOLOGY);
    }

    @Test
    void silentTurnSavesNoAssistantMessage() {
        List<ChatEvent> events = run("s1", (prompt, tools) -> Flux.empty());

        assertThat(events).hasSize(2);
        verify(conversationService, never()).saveTurn(eq("s1"), eq(ConversationTurn.ASSISTANT), anyString());
    }

    @Test
    void missingModelIsReportedUpFront() {
        when(modelProvider.getIfAvailable()).thenReturn(null);

        assertThat(chatService.isModelConfigured()).isFalse();
        assertThatThrownBy(() -> chatService.chat("s1", "hello")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void blankMessageIsRejected() {
        when(modelProvider.getIfAvailable()).thenReturn((prompt, tools) -> Flux.empty());

        assertThatThrownBy(() -> chatService.chat("s1", "  ")).isInstanceOf(IllegalArgumentException.class);
    }

    private static int indexOf(List<ChatEvent> events, Predicate<ChatEvent> match) {
        for (int i = 0; i < events.size(); i++) {
            if (match.test(events.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
