package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.WorkingCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed, ordered list of products customers can order. Read once at startup.
 */
@Service
public class ProductCatalogService {

    private final List<String> productNames;

    public ProductCatalogService(@Value("${orderbot.catalog.products}") List<String> productNames) {
        Set<String> unique = new LinkedHashSet<>();
        for (String name : productNames) {
            if (name != null && !name.isBlank()) {
                unique.add(name.trim());
            }
        }
        if (unique.isEmpty()) {
            throw new IllegalStateException("orderbot.catalog.products must list at least one product");
        }
        this.productNames = List.copyOf(unique);
    }

    public List<String> productNames() {
        return productNames;
    }

    public WorkingCatalog newWorkingCatalog() {
        return WorkingCatalog.of(productNames);
    }
}
