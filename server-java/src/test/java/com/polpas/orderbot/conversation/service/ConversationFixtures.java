package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.WorkingCatalog;
import com.polpas.orderbot.conversation.util.FuzzyMatcher;
import com.polpas.orderbot.conversation.util.NumberExtractor;
import com.polpas.orderbot.conversation.util.NumberWordLexicon;
import com.polpas.orderbot.conversation.util.TextNormalizer;
import com.polpas.orderbot.conversation.util.TextSegmenter;

import java.util.List;

final class ConversationFixtures {

    static final List<String> PRODUCTS = List.of(
            "limão", "abacaxi", "abacaxi com hortelã", "açaí", "acerola", "ameixa", "cajá", "cajú",
            "goiaba", "graviola", "manga", "maracujá", "morango", "seriguela", "tamarindo",
            "caixa de ovos", "ovo", "queijo");

    private ConversationFixtures() {
    }

    static WorkingCatalog emptyCatalog() {
        return WorkingCatalog.of(PRODUCTS);
    }

    static OrderExtractor orderExtractor() {
        TextNormalizer normalizer = new TextNormalizer();
        NumberWordLexicon lexicon = new NumberWordLexicon();
        NumberExtractor numberExtractor = new NumberExtractor(lexicon);
        return new OrderExtractor(
                normalizer,
                new TextSegmenter(normalizer, lexicon),
                numberExtractor,
                new FuzzyMatcher(normalizer),
                new QuantityAssociator(numberExtractor),
                80,
                50);
    }
}
