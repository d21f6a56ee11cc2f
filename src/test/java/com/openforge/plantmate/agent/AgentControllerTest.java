package com.openforge.plantmate.agent;

import com.openforge.plantmate.domain.ChatMessage;
import com.openforge.plantmate.domain.ChatSession;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AgentController.class)
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TurnLauncher turnLauncher;

    @MockBean
    private ConversationService conversation;

    @Test
    void blankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/sessions/s1/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"   \"}"))
                .andExpect(status().isBadRequest());

        verify(turnLauncher, never()).start(anyString(), anyString());
    }

    @Test
    void concurrentTurnIsConflict() throws Exception {
        when(turnLauncher.start(any(), any()))
                .thenThrow(new ResponseStatusException(HttpStatus.CONFLICT, "busy"));

        mockMvc.perform(post("/sessions/s1/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"How much PA6?\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void unknownSessionHistoryIsNotFound() throws Exception {
        when(conversation.findSession("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/sessions/nope/messages"))
                .andExpect(status().isNotFound());
    }

    @Test
    void historyIsReturnedInOrder() throws Exception {
        when(conversation.findSession("s1")).thenReturn(Optional.of(ChatSession.builder().sessionId("s1").build()));
        when(conversation.history("s1")).thenReturn(List.of(
                ChatMessage.builder().messageId("m1").sessionId("s1").sequenceNo(1)
                        .role(ChatMessage.Role.USER).content("How much PA6?").build(),
                ChatMessage.builder().messageId("m2").sessionId("s1").sequenceNo(2)
                        .role(ChatMessage.Role.TOOL).toolName("inventory_sql_search")
                        .content("Retrieved 1 row(s) from the warehouse: 250 kg").build()));

        mockMvc.perform(get("/sessions/s1/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("m1"))
                .andExpect(jsonPath("$[0].role").value("user"))
                .andExpect(jsonPath("$[1].role").value("tool"))
                .andExpect(jsonPath("$[1].tool_name").value("inventory_sql_search"));
    }
}
