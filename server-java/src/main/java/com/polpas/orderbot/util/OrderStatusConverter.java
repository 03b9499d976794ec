package com.polpas.orderbot.util;

import com.polpas.orderbot.conversation.model.OrderStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link OrderStatus} as its lowercase wire value ("confirmed", "auto_confirmed", "pending").
 */
@Converter
public class OrderStatusConverter implements AttributeConverter<OrderStatus, String> {

    @Override
    public String convertToDatabaseColumn(OrderStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public OrderStatus convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        return OrderStatus.fromValue(dbData.trim());
    }
}
