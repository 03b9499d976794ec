package com.polpas.orderbot.conversation.model;

public record CatalogEntry(String name, int runningQuantity) {

    public CatalogEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Product name must not be blank");
        }
        if (runningQuantity < 0) {
            throw new IllegalArgumentException("Quantity must not be negative: " + runningQuantity);
        }
    }

    /**
     * Saturates at {@link Integer#MAX_VALUE} instead of wrapping.
     */
    public CatalogEntry plus(int quantity) {
        return new CatalogEntry(name, (int) Math.min((long) runningQuantity + quantity, Integer.MAX_VALUE));
    }
}
