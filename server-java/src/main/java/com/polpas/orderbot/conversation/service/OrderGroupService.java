package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.ConversationException;
import com.polpas.orderbot.conversation.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OrderGroupService {

    private static final Logger logger = LoggerFactory.getLogger(OrderGroupService.class);

    private final OrderStore orderStore;

    public OrderGroupService(OrderStore orderStore) {
        this.orderStore = orderStore;
    }

    public GlobalOrdersView getGlobalOrders(String userId) {
        return new GlobalOrdersView(
                orderStore.queryAggregated(userId, OrderStatus.CONFIRMED, OrderStatus.MAIN_GROUP),
                orderStore.findGroups(userId, OrderStatus.AUTO_CONFIRMED),
                orderStore.findGroups(userId, OrderStatus.PENDING));
    }

    /**
     * Moves an auto-confirmed group into the main confirmed list.
     */
    public void confirmAutoGroup(String userId, String groupId) {
        requireGroupId(groupId);
        int moved = orderStore.promoteGroup(userId, groupId, OrderStatus.AUTO_CONFIRMED);
        if (moved == 0) {
            throw new ConversationException("Pedido automático não encontrado: " + groupId);
        }
        logger.info("User {} confirmed auto group {} ({} line(s))", userId, groupId, moved);
    }

    public void deleteAutoGroup(String userId, String groupId) {
        requireGroupId(groupId);
        int deleted = orderStore.deleteGroup(userId, groupId, OrderStatus.AUTO_CONFIRMED);
        if (deleted == 0) {
            throw new ConversationException("Pedido automático não encontrado: " + groupId);
        }
        logger.info("User {} deleted auto group {} ({} line(s))", userId, groupId, deleted);
    }

    private void requireGroupId(String groupId) {
        if (groupId == null || groupId.isBlank() || OrderStatus.MAIN_GROUP.equals(groupId)) {
            throw new ConversationException("Informe o grupo do pedido automático.");
        }
    }
}
