package com.polpas.orderbot.controller;

import com.polpas.orderbot.conversation.ConversationException;
import com.polpas.orderbot.conversation.model.ConversationState;
import com.polpas.orderbot.conversation.service.ConversationReply;
import com.polpas.orderbot.conversation.service.ConversationService;
import com.polpas.orderbot.conversation.service.GlobalOrdersView;
import com.polpas.orderbot.conversation.service.OrderGroupService;
import com.polpas.orderbot.conversation.service.SessionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrderBotControllerTest {

    @Mock
    private ConversationService conversationService;
    @Mock
    private OrderGroupService orderGroupService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new OrderBotController(conversationService, orderGroupService))
                .setControllerAdvice(new ConversationExceptionHandler())
                .build();
        when(conversationService.snapshot(anyString())).thenReturn(new SessionSnapshot(
                ConversationState.COLLECTING, Map.of("manga", 2), List.of(), List.of(), 0, Instant.EPOCH));
    }

    @Test
    void messageReplyCarriesTheSessionState() throws Exception {
        when(conversationService.processMessage("cliente-1", "2 mangas")).thenReturn(ConversationReply.silent());

        mockMvc.perform(post("/api/orders/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"cliente-1\",\"message\":\"  2 mangas \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.botMessage").doesNotExist())
                .andExpect(jsonPath("$.state").value("collecting"))
                .andExpect(jsonPath("$.currentOrders.manga").value(2));
    }

    @Test
    void blankMessageIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/orders/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"cliente-1\",\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(orderGroupService);
        verify(conversationService, never()).processMessage(anyString(), anyString());
    }

    @Test
    void updatesDeliverQueuedMessages() throws Exception {
        when(conversationService.fetchPendingMessage("cliente-1")).thenReturn(Optional.of("lembrete"));

        mockMvc.perform(post("/api/orders/updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"cliente-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasMessage").value(true))
                .andExpect(jsonPath("$.botMessage").value("lembrete"))
                .andExpect(jsonPath("$.lastActivity").exists());
    }

    @Test
    void globalOrdersListAutoGroups() throws Exception {
        when(orderGroupService.getGlobalOrders("cliente-1")).thenReturn(new GlobalOrdersView(
                Map.of("limão", 25), Map.of("auto_123456_abcdef", Map.of("queijo", 1)), Map.of()));

        mockMvc.perform(get("/api/orders/global").param("sessionId", "cliente-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoOrders.auto_123456_abcdef.queijo").value(1));
    }

    @Test
    void unknownAutoGroupIsABadRequest() throws Exception {
        doThrow(new ConversationException("Grupo desconhecido: auto_x"))
                .when(orderGroupService).confirmAutoGroup("cliente-1", "auto_x");

        mockMvc.perform(post("/api/orders/auto-groups/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"cliente-1\",\"orderGroup\":\"auto_x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Grupo desconhecido: auto_x"));
    }

    @Test
    void resetRestartsTheConversation() throws Exception {
        mockMvc.perform(post("/api/orders/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"cliente-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(conversationService).resetSession("cliente-1");
    }
}
