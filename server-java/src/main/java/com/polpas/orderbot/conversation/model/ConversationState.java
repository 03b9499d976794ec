package com.polpas.orderbot.conversation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConversationState {
    WAITING_FOR_NEXT("waiting_for_next"),
    OPTION("option"),
    COLLECTING("collecting"),
    CONFIRMING("confirming"),
    PENDING_CONFIRMATION("pending_confirmation");

    private final String value;

    ConversationState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
