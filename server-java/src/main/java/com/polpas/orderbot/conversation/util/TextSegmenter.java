package com.polpas.orderbot.conversation.util;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a folded message into the token stream the extractor walks over.
 * "2mangas" becomes "2 mangas", number words glued to punctuation are freed,
 * and the punctuation itself is dropped.
 */
@Component
public class TextSegmenter {

    private static final Pattern DIGITS_THEN_LETTERS = Pattern.compile("(\\d+)([a-z])");
    private static final Pattern LETTERS_THEN_DIGITS = Pattern.compile("([a-z])(\\d+)");
    private static final Pattern PUNCTUATION = Pattern.compile("[,.;+\\-/()\\[\\]:!?]");

    private final TextNormalizer normalizer;
    private final List<Pattern> numberWordPatterns;

    public TextSegmenter(TextNormalizer normalizer, NumberWordLexicon lexicon) {
        this.normalizer = normalizer;
        List<Pattern> patterns = new ArrayList<>();
        for (String word : lexicon.wordsLongestFirst()) {
            if (!NumberWordLexicon.PROTECTED_TEENS.contains(word)) {
                patterns.add(Pattern.compile("\\b" + Pattern.quote(word) + "\\b"));
            }
        }
        this.numberWordPatterns = List.copyOf(patterns);
    }

    /**
     * Separates digits from letters and number words from their neighbours, then
     * collapses whitespace. Input is expected to be folded already.
     */
    public String separateNumbersAndWords(String folded) {
        String text = DIGITS_THEN_LETTERS.matcher(folded).replaceAll("$1 $2");
        text = LETTERS_THEN_DIGITS.matcher(text).replaceAll("$1 $2");

        for (String teen : NumberWordLexicon.PROTECTED_TEENS) {
            text = text.replace(teen, " " + teen + " ");
        }
        for (Pattern pattern : numberWordPatterns) {
            text = pattern.matcher(text).replaceAll(match -> " " + Matcher.quoteReplacement(match.group()) + " ");
        }
        return normalizer.collapseWhitespace(text);
    }

    public List<String> tokenize(String folded) {
        if (folded == null || folded.isBlank()) {
            return List.of();
        }
        String separated = separateNumbersAndWords(folded);
        String stripped = normalizer.collapseWhitespace(PUNCTUATION.matcher(separated).replaceAll(" "));
        if (stripped.isEmpty()) {
            return List.of();
        }
        return List.copyOf(Arrays.asList(stripped.split(" ")));
    }
}
