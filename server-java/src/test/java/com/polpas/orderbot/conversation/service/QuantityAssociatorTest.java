package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.NumberMatch;
import com.polpas.orderbot.conversation.util.NumberExtractor;
import com.polpas.orderbot.conversation.util.NumberWordLexicon;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QuantityAssociatorTest {

    private final NumberExtractor numberExtractor = new NumberExtractor(new NumberWordLexicon());
    private final QuantityAssociator associator = new QuantityAssociator(numberExtractor);

    @Test
    void prefersTheNumberRightBeforeThePhrase() {
        List<String> tokens = List.of("2", "mangas", "e", "tres", "queijos");
        List<NumberMatch> numbers = numberExtractor.extract(tokens);

        QuantityAssociator.Association mangas = associator.associate(1, 1, tokens, numbers, Set.of());
        QuantityAssociator.Association queijos = associator.associate(4, 1, tokens, numbers, Set.of(0));

        assertEquals(2, mangas.quantity());
        assertEquals(OptionalInt.of(0), mangas.numberPosition());
        assertEquals(3, queijos.quantity());
    }

    @Test
    void fallsBackToTheClosestNumberBefore() {
        List<String> tokens = List.of("3", "de", "manga");

        QuantityAssociator.Association association =
                associator.associate(2, 1, tokens, numberExtractor.extract(tokens), Set.of());

        assertEquals(3, association.quantity());
    }

    @Test
    void usesTheNumberRightAfterWhenNothingPrecedes() {
        List<String> tokens = List.of("mangas", "4");

        QuantityAssociator.Association association =
                associator.associate(0, 1, tokens, numberExtractor.extract(tokens), Set.of());

        assertEquals(4, association.quantity());
        assertEquals(OptionalInt.of(1), association.numberPosition());
    }

    @Test
    void usesTheClosestNumberAfterAsLastResort() {
        List<String> tokens = List.of("manga", "por", "favor", "sete");

        QuantityAssociator.Association association =
                associator.associate(0, 1, tokens, numberExtractor.extract(tokens), Set.of());

        assertEquals(7, association.quantity());
    }

    @Test
    void defaultsToOneWithoutNumbers() {
        List<String> tokens = List.of("manga");

        QuantityAssociator.Association association = associator.associate(0, 1, tokens, List.of(), Set.of());

        assertEquals(QuantityAssociator.DEFAULT_QUANTITY, association.quantity());
        assertTrue(association.numberPosition().isEmpty());
    }

    @Test
    void swapsAUsedNumberForTheFirstUnusedOne() {
        List<String> tokens = List.of("2", "manga", "5");
        List<NumberMatch> numbers = numberExtractor.extract(tokens);

        QuantityAssociator.Association association = associator.associate(1, 1, tokens, numbers, Set.of(0));

        assertEquals(5, association.quantity());
        assertEquals(OptionalInt.of(2), association.numberPosition());
    }

    @Test
    void neverReusesANumberOnceAllAreTaken() {
        List<String> tokens = List.of("2", "manga");
        List<NumberMatch> numbers = numberExtractor.extract(tokens);

        QuantityAssociator.Association association = associator.associate(1, 1, tokens, numbers, Set.of(0));

        assertEquals(QuantityAssociator.DEFAULT_QUANTITY, association.quantity());
        assertTrue(association.numberPosition().isEmpty());
    }
}
