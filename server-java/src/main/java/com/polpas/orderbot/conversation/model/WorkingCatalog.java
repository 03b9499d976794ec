package com.polpas.orderbot.conversation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the running quantities of a conversation. Every mutation returns
 * a new snapshot, so a reader holding a reference never sees a half-applied merge.
 */
public final class WorkingCatalog {

    private final List<CatalogEntry> entries;

    private WorkingCatalog(List<CatalogEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static WorkingCatalog of(List<String> productNames) {
        List<CatalogEntry> entries = new ArrayList<>();
        for (String name : productNames) {
            entries.add(new CatalogEntry(name, 0));
        }
        return new WorkingCatalog(entries);
    }

    public List<CatalogEntry> entries() {
        return entries;
    }

    public List<String> productNames() {
        return entries.stream().map(CatalogEntry::name).toList();
    }

    public int quantityOf(String product) {
        return entries.stream()
                .filter(entry -> entry.name().equals(product))
                .mapToInt(CatalogEntry::runningQuantity)
                .findFirst()
                .orElse(0);
    }

    /**
     * Adds {@code quantity} to the first entry named {@code product}. Unknown products leave
     * the snapshot unchanged.
     */
    public WorkingCatalog merge(String product, int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Cannot merge a negative quantity: " + quantity);
        }
        List<CatalogEntry> updated = new ArrayList<>(entries);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).name().equals(product)) {
                updated.set(i, updated.get(i).plus(quantity));
                return new WorkingCatalog(updated);
            }
        }
        return this;
    }

    public WorkingCatalog merge(List<ParsedOrderLine> lines) {
        WorkingCatalog result = this;
        for (ParsedOrderLine line : lines) {
            result = result.merge(line.product(), line.quantity());
        }
        return result;
    }

    public WorkingCatalog reset() {
        return of(productNames());
    }

    public boolean hasItems() {
        return entries.stream().anyMatch(entry -> entry.runningQuantity() > 0);
    }

    /**
     * Products with a positive quantity, in catalog order.
     */
    public Map<String, Integer> currentOrders() {
        Map<String, Integer> orders = new LinkedHashMap<>();
        for (CatalogEntry entry : entries) {
            if (entry.runningQuantity() > 0) {
                orders.put(entry.name(), entry.runningQuantity());
            }
        }
        return Collections.unmodifiableMap(orders);
    }

    @Override
    public String toString() {
        return "WorkingCatalog" + currentOrders();
    }
}
