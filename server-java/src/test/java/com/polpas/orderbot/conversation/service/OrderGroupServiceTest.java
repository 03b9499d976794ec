package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.ConversationException;
import com.polpas.orderbot.conversation.model.OrderStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrderGroupServiceTest {

    @Mock
    private OrderStore orderStore;

    @InjectMocks
    private OrderGroupService service;

    @Test
    void globalViewCombinesMainAutoAndPendingOrders() {
        when(orderStore.queryAggregated("cliente-1", OrderStatus.CONFIRMED, OrderStatus.MAIN_GROUP))
                .thenReturn(Map.of("manga", 4));
        when(orderStore.findGroups("cliente-1", OrderStatus.AUTO_CONFIRMED))
                .thenReturn(Map.of("auto_123456_abcdef", Map.of("queijo", 2)));
        when(orderStore.findGroups("cliente-1", OrderStatus.PENDING)).thenReturn(Map.of());

        GlobalOrdersView view = service.getGlobalOrders("cliente-1");

        assertEquals(Map.of("manga", 4), view.mainOrders());
        assertEquals(Map.of("queijo", 2), view.autoOrders().get("auto_123456_abcdef"));
        assertTrue(view.pendingOrders().isEmpty());
    }

    @Test
    void confirmingAnAutoGroupPromotesIt() {
        when(orderStore.promoteGroup("cliente-1", "auto_123456_abcdef", OrderStatus.AUTO_CONFIRMED)).thenReturn(2);

        service.confirmAutoGroup("cliente-1", "auto_123456_abcdef");

        verify(orderStore).promoteGroup("cliente-1", "auto_123456_abcdef", OrderStatus.AUTO_CONFIRMED);
    }

    @Test
    void confirmingAMissingGroupFails() {
        when(orderStore.promoteGroup(anyString(), anyString(), any())).thenReturn(0);

        assertThrows(ConversationException.class, () -> service.confirmAutoGroup("cliente-1", "auto_000000_zzzzzz"));
    }

    @Test
    void deletingAnAutoGroupRemovesIt() {
        when(orderStore.deleteGroup("cliente-1", "auto_123456_abcdef", OrderStatus.AUTO_CONFIRMED)).thenReturn(1);

        service.deleteAutoGroup("cliente-1", "auto_123456_abcdef");

        verify(orderStore).deleteGroup("cliente-1", "auto_123456_abcdef", OrderStatus.AUTO_CONFIRMED);
    }

    @Test
    void deletingAMissingGroupFails() {
        when(orderStore.deleteGroup(anyString(), anyString(), any())).thenReturn(0);

        assertThrows(ConversationException.class, () -> service.deleteAutoGroup("cliente-1", "auto_000000_zzzzzz"));
    }

    @Test
    void mainGroupCannotBeTouchedAsAnAutoGroup() {
        assertThrows(ConversationException.class, () -> service.confirmAutoGroup("cliente-1", OrderStatus.MAIN_GROUP));
        assertThrows(ConversationException.class, () -> service.deleteAutoGroup("cliente-1", " "));
        verifyNoInteractions(orderStore);
    }
}
