package com.polpas.orderbot.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * SQLite has no timestamp type; order timestamps are kept as "yyyy-MM-dd HH:mm:ss" text.
 */
@Converter(autoApply = true)
public class LocalDateTimeConverter implements AttributeConverter<LocalDateTime, String> {

    private static final Logger logger = LoggerFactory.getLogger(LocalDateTimeConverter.class);
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public String convertToDatabaseColumn(LocalDateTime value) {
        return value == null ? null : value.format(FORMATTER);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(dbData, FORMATTER);
        } catch (DateTimeParseException e) {
            // rows written by other tools may use the ISO separator
            try {
                return LocalDateTime.parse(dbData.trim().replace(' ', 'T'));
            } catch (DateTimeParseException iso) {
                logger.warn("Unreadable timestamp in confirmed_orders: {}", dbData);
                return null;
            }
        }
    }
}
