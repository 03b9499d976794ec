package com.polpas.orderbot.service;

import com.polpas.orderbot.conversation.model.OrderStatus;
import com.polpas.orderbot.conversation.service.OrderStore;
import com.polpas.orderbot.model.ConfirmedOrderLine;
import com.polpas.orderbot.repository.order.ConfirmedOrderLineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class JpaOrderStore implements OrderStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaOrderStore.class);

    private final ConfirmedOrderLineRepository repository;

    public JpaOrderStore(ConfirmedOrderLineRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void persist(String sessionId, String userId, Map<String, Integer> lines, OrderStatus status, String groupId) {
        List<ConfirmedOrderLine> rows = new ArrayList<>();
        lines.forEach((product, quantity) -> {
            if (quantity != null && quantity > 0) {
                ConfirmedOrderLine row = new ConfirmedOrderLine();
                row.setUserId(userId);
                row.setSessionId(sessionId);
                row.setProduct(product);
                row.setQuantity(quantity);
                row.setStatus(status);
                row.setOrderGroup(groupId);
                rows.add(row);
            }
        });
        if (rows.isEmpty()) {
            return;
        }
        repository.saveAll(rows);
        logger.info("[JpaOrderStore] Stored {} line(s) for user {} as {}/{}", rows.size(), userId, status.getValue(), groupId);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Integer> queryAggregated(String userId, OrderStatus status, String groupId) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (ConfirmedOrderLineRepository.ProductTotal row : repository.sumByProduct(userId, status, groupId)) {
            if (row.getProduct() != null && row.getTotal() != null && row.getTotal() > 0) {
                totals.put(row.getProduct(), Math.toIntExact(row.getTotal()));
            }
        }
        return totals;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Map<String, Integer>> findGroups(String userId, OrderStatus status) {
        Map<String, Map<String, Integer>> groups = new LinkedHashMap<>();
        for (ConfirmedOrderLine line : repository.findByUserIdAndStatusOrderByOrderGroupAscProductAsc(userId, status)) {
            if (OrderStatus.MAIN_GROUP.equals(line.getOrderGroup())) {
                continue;
            }
            groups.computeIfAbsent(line.getOrderGroup(), group -> new LinkedHashMap<>())
                    .merge(line.getProduct(), line.getQuantity(), Integer::sum);
        }
        return groups;
    }

    @Override
    @Transactional
    public int promoteGroup(String userId, String groupId, OrderStatus fromStatus) {
        return repository.moveGroup(userId, groupId, fromStatus, OrderStatus.CONFIRMED, OrderStatus.MAIN_GROUP);
    }

    @Override
    @Transactional
    public int deleteGroup(String userId, String groupId, OrderStatus status) {
        return repository.deleteGroup(userId, groupId, status);
    }
}
