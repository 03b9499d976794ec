package com.polpas.orderbot.conversation.util;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case and diacritics folding shared by the extraction pipeline, so that
 * "Limão", "LIMAO" and "limao" all compare as the same token.
 */
@Component
public class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Ordered: the first matching ending wins.
    private static final List<PluralRule> PLURAL_RULES = List.of(
            new PluralRule("oes", "ao"),
            new PluralRule("aes", "ao"),
            new PluralRule("aos", "ao"),
            new PluralRule("ns", "m"),
            new PluralRule("res", "r"),
            new PluralRule("zes", "z"),
            new PluralRule("ses", "s"),
            new PluralRule("s", ""));

    private static final int MIN_SINGULAR_LENGTH = 3;

    public String fold(String input) {
        if (input == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(input.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").trim();
    }

    public String collapseWhitespace(String input) {
        if (input == null) {
            return "";
        }
        return WHITESPACE.matcher(input).replaceAll(" ").trim();
    }

    /**
     * Folds Portuguese plural endings word by word ("limoes" -> "limao", "mangas" -> "manga").
     * Expects already folded input.
     */
    public String singularize(String folded) {
        if (folded == null || folded.isBlank()) {
            return "";
        }
        String[] words = WHITESPACE.split(folded.trim());
        StringBuilder result = new StringBuilder();
        for (String word : words) {
            if (result.length() > 0) {
                result.append(' ');
            }
            result.append(singularizeWord(word));
        }
        return result.toString();
    }

    private String singularizeWord(String word) {
        for (PluralRule rule : PLURAL_RULES) {
            if (word.endsWith(rule.suffix())) {
                String stem = word.substring(0, word.length() - rule.suffix().length());
                String singular = stem + rule.replacement();
                if (singular.length() >= MIN_SINGULAR_LENGTH) {
                    return singular;
                }
                return word;
            }
        }
        return word;
    }

    private record PluralRule(String suffix, String replacement) {
    }
}
