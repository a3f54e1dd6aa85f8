package com.aind.metadata.controller;

import com.aind.metadata.model.ConversationTurn;
import com.aind.metadata.model.SessionSummary;
import com.aind.metadata.service.ConversationService;
import com.aind.metadata.service.RecordStoreService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationService conversationService;

    @MockBean
    private RecordStoreService storeService;

    @Test
    void listsSessionSummaries() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        SessionSummary summary = new SessionSummary("s1", now.minusMinutes(5), now, 4L);
        summary.setFirstMessage("The mouse is 4528");
        when(conversationService.sessions()).thenReturn(List.of(summary));

        mockMvc.perform(get("/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].session_id").value("s1"))
                .andExpect(jsonPath("$[0].message_count").value(4))
                .andExpect(jsonPath("$[0].first_message").value("The mouse is 4528"));
    }

    @Test
    void messagesComeBackInOrder() throws Exception {
        when(conversationService.history("s1")).thenReturn(List.of(
                new ConversationTurn("s1", ConversationTurn.USER, "hello"),
                new ConversationTurn("s1", ConversationTurn.ASSISTANT, "hi")));

        mockMvc.perform(get("/sessions/{id}/messages", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].role").value("user"))
                .andExpect(jsonPath("$[1].content").value("hi"));
    }

    @Test
    void deletingUnknownSessionIs404() throws Exception {
        when(storeService.deleteSession("ghost")).thenReturn(false);

        mockMvc.perform(delete("/sessions/{id}", "ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No data found for session ghost"));
    }

    @Test
    void deletingSessionConfirms() throws Exception {
        when(storeService.deleteSession("s1")).thenReturn(true);

        mockMvc.perform(delete("/sessions/{id}", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deleted"));
    }
}
