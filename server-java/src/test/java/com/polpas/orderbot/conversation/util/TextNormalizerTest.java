package com.polpas.orderbot.conversation.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void foldsCaseAndDiacritics() {
        assertEquals("limao", normalizer.fold("Limão"));
        assertEquals("acai", normalizer.fold("  AÇAÍ "));
        assertEquals("maracuja", normalizer.fold("maracujá"));
    }

    @Test
    void foldsNullToEmpty() {
        assertEquals("", normalizer.fold(null));
        assertEquals("", normalizer.collapseWhitespace(null));
    }

    @Test
    void collapsesRunsOfWhitespace() {
        assertEquals("dois mangas", normalizer.collapseWhitespace("  dois \t  mangas  "));
    }

    @Test
    void singularizesCommonPluralEndings() {
        assertEquals("limao", normalizer.singularize("limoes"));
        assertEquals("manga", normalizer.singularize("mangas"));
        assertEquals("queijo", normalizer.singularize("queijos"));
        assertEquals("caixa de ovo", normalizer.singularize("caixas de ovos"));
    }

    @Test
    void keepsWordsThatWouldBecomeTooShort() {
        assertEquals("os", normalizer.singularize("os"));
        assertEquals("", normalizer.singularize("   "));
    }
}
