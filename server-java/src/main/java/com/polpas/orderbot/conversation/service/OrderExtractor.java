package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.NumberMatch;
import com.polpas.orderbot.conversation.model.ParsedOrderLine;
import com.polpas.orderbot.conversation.model.WorkingCatalog;
import com.polpas.orderbot.conversation.util.FuzzyMatcher;
import com.polpas.orderbot.conversation.util.NumberExtractor;
import com.polpas.orderbot.conversation.util.TextNormalizer;
import com.polpas.orderbot.conversation.util.TextSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a free-text order ("quero 2 mangas e tres queijos") and resolves it into product
 * quantities against the catalog of a conversation.
 */
@Service
public class OrderExtractor {

    private static final Logger logger = LoggerFactory.getLogger(OrderExtractor.class);

    static final int MAX_WINDOW = 4;
    private static final Set<String> FILLER_WORDS = Set.of("quero", "e");

    private final TextNormalizer normalizer;
    private final TextSegmenter segmenter;
    private final NumberExtractor numberExtractor;
    private final FuzzyMatcher fuzzyMatcher;
    private final QuantityAssociator quantityAssociator;
    private final double matchThreshold;
    private final double fallbackThreshold;

    public OrderExtractor(TextNormalizer normalizer,
                          TextSegmenter segmenter,
                          NumberExtractor numberExtractor,
                          FuzzyMatcher fuzzyMatcher,
                          QuantityAssociator quantityAssociator,
                          @Value("${orderbot.matching.threshold:80}") double matchThreshold,
                          @Value("${orderbot.matching.fallback-threshold:50}") double fallbackThreshold) {
        this.normalizer = normalizer;
        this.segmenter = segmenter;
        this.numberExtractor = numberExtractor;
        this.fuzzyMatcher = fuzzyMatcher;
        this.quantityAssociator = quantityAssociator;
        this.matchThreshold = matchThreshold;
        this.fallbackThreshold = fallbackThreshold;
    }

    /**
     * Extracts order lines from {@code text} and merges them into a copy of {@code catalog}.
     * Tokens that match nothing are skipped; the caller decides what an empty result means.
     */
    public ExtractionResult extract(String text, WorkingCatalog catalog) {
        List<String> tokens = segmenter.tokenize(normalizer.fold(text));
        if (tokens.isEmpty()) {
            return new ExtractionResult(List.of(), catalog);
        }

        List<NumberMatch> numbers = numberExtractor.extract(tokens);
        List<ProductKey> products = productKeys(catalog.productNames());
        Set<String> productWords = productWords(products);
        int maxWindow = Math.min(MAX_WINDOW, products.stream().mapToInt(ProductKey::wordCount).max().orElse(1));

        Set<Integer> usedPositions = new HashSet<>();
        Set<Integer> usedNumbers = new HashSet<>();
        List<ParsedOrderLine> lines = new ArrayList<>();
        WorkingCatalog working = catalog;

        int i = 0;
        while (i < tokens.size()) {
            if (usedPositions.contains(i) || isSkippable(tokens.get(i), productWords)) {
                i++;
                continue;
            }

            boolean committed = false;
            for (int size = maxWindow; size >= 1; size--) {
                if (i + size > tokens.size() || !windowAvailable(tokens, i, size, usedPositions, productWords)) {
                    continue;
                }
                String phrase = String.join(" ", tokens.subList(i, i + size));
                Optional<ProductMatch> best = bestMatch(phrase, products);
                if (best.isPresent() && best.get().score() >= matchThreshold) {
                    working = commit(best.get(), i, size, tokens, numbers, usedPositions, usedNumbers, lines, working);
                    i += size;
                    committed = true;
                    break;
                }
            }
            if (committed) {
                continue;
            }

            Optional<ProductMatch> guess = bestMatch(tokens.get(i), products);
            if (guess.isPresent() && guess.get().score() > fallbackThreshold) {
                working = commit(guess.get(), i, 1, tokens, numbers, usedPositions, usedNumbers, lines, working);
            }
            i++;
        }

        logger.debug("Extracted {} line(s) from {} token(s): {}", lines.size(), tokens.size(), lines);
        return new ExtractionResult(List.copyOf(lines), working);
    }

    private WorkingCatalog commit(ProductMatch match,
                                  int start,
                                  int size,
                                  List<String> tokens,
                                  List<NumberMatch> numbers,
                                  Set<Integer> usedPositions,
                                  Set<Integer> usedNumbers,
                                  List<ParsedOrderLine> lines,
                                  WorkingCatalog working) {
        QuantityAssociator.Association association =
                quantityAssociator.associate(start, size, tokens, numbers, usedNumbers);
        lines.add(new ParsedOrderLine(match.product(), association.quantity(), round(match.score())));
        for (int j = start; j < start + size; j++) {
            usedPositions.add(j);
        }
        association.numberPosition().ifPresent(usedNumbers::add);
        return working.merge(match.product(), association.quantity());
    }

    private boolean isSkippable(String token, Set<String> productWords) {
        if (productWords.contains(token)) {
            return false;
        }
        return FILLER_WORDS.contains(token) || numberExtractor.isNumberToken(token);
    }

    private boolean windowAvailable(List<String> tokens, int start, int size, Set<Integer> usedPositions, Set<String> productWords) {
        for (int j = start; j < start + size; j++) {
            if (usedPositions.contains(j) || isSkippable(tokens.get(j), productWords)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Best scoring product for a phrase. The phrase is also compared in its singular form,
     * so "limoes" reaches "limão" even though their raw edit distance is large.
     * Ties keep the product with more words, then catalog order.
     */
    private Optional<ProductMatch> bestMatch(String phrase, List<ProductKey> products) {
        String folded = normalizer.fold(phrase);
        String singular = normalizer.singularize(folded);
        ProductMatch best = null;
        for (ProductKey product : products) {
            double score = Math.max(
                    fuzzyMatcher.similarity(folded, product.folded()),
                    fuzzyMatcher.similarity(singular, product.singular()));
            if (best == null || score > best.score()) {
                best = new ProductMatch(product.name(), score);
            }
        }
        return Optional.ofNullable(best);
    }

    private List<ProductKey> productKeys(List<String> productNames) {
        List<ProductKey> keys = new ArrayList<>();
        for (String name : productNames) {
            String folded = normalizer.fold(name);
            keys.add(new ProductKey(name, folded, normalizer.singularize(folded), folded.split("\\s+").length));
        }
        keys.sort(Comparator.comparingInt(ProductKey::wordCount).reversed());
        return keys;
    }

    private Set<String> productWords(List<ProductKey> products) {
        Set<String> words = new HashSet<>();
        for (ProductKey product : products) {
            for (String word : product.folded().split("\\s+")) {
                words.add(word);
            }
        }
        return words;
    }

    private static double round(double score) {
        return Math.round(score * 100.0) / 100.0;
    }

    private record ProductKey(String name, String folded, String singular, int wordCount) {
    }

    private record ProductMatch(String product, double score) {
    }
}
