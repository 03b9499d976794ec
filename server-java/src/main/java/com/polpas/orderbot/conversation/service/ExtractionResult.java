package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.ParsedOrderLine;
import com.polpas.orderbot.conversation.model.WorkingCatalog;

import java.util.List;

public record ExtractionResult(List<ParsedOrderLine> lines, WorkingCatalog catalog) {

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
