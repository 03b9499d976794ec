package com.polpas.orderbot.conversation.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Short identifiers for order groups, e.g. {@code auto_482913_k3x9qa}: the last six
 * digits of the epoch second plus six random characters.
 */
@Component
public class OrderGroupIdGenerator {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int RANDOM_LENGTH = 6;
    private static final int TIMESTAMP_DIGITS = 6;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public OrderGroupIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next(String prefix) {
        String seconds = Long.toString(clock.instant().getEpochSecond());
        String timestamp = seconds.length() > TIMESTAMP_DIGITS
                ? seconds.substring(seconds.length() - TIMESTAMP_DIGITS)
                : seconds;
        StringBuilder suffix = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return prefix + "_" + timestamp + "_" + suffix;
    }
}
