package com.polpas.orderbot.conversation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An order moved aside when the reminder cycle ran out, waiting for an explicit yes or no.
 */
public record HeldOrder(String groupId, Map<String, Integer> items) {

    public HeldOrder {
        items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }
}
