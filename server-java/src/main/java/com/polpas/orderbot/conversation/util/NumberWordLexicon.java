package com.polpas.orderbot.conversation.util;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Spelled-out Portuguese numbers from zero to nine hundred, including the
 * misspellings customers commonly type ("treis", "cnico", "quarto").
 * Keys are folded (lowercase, no diacritics).
 */
@Component
public class NumberWordLexicon {

    public static final String CONJUNCTION = "e";

    static final Map<String, Integer> UNITS = Map.ofEntries(
            Map.entry("zero", 0),
            Map.entry("um", 1),
            Map.entry("uma", 1),
            Map.entry("dois", 2),
            Map.entry("duas", 2),
            Map.entry("dos", 2),
            Map.entry("tres", 3),
            Map.entry("treis", 3),
            Map.entry("quatro", 4),
            Map.entry("quarto", 4),
            Map.entry("cinco", 5),
            Map.entry("cnico", 5),
            Map.entry("seis", 6),
            Map.entry("ses", 6),
            Map.entry("sete", 7),
            Map.entry("oito", 8),
            Map.entry("nove", 9),
            Map.entry("nov", 9));

    static final Map<String, Integer> TEENS = Map.ofEntries(
            Map.entry("dez", 10),
            Map.entry("onze", 11),
            Map.entry("doze", 12),
            Map.entry("treze", 13),
            Map.entry("quatorze", 14),
            Map.entry("catorze", 14),
            Map.entry("quinze", 15),
            Map.entry("dezesseis", 16),
            Map.entry("dezessete", 17),
            Map.entry("dezoito", 18),
            Map.entry("dezenove", 19));

    static final Map<String, Integer> TENS = Map.ofEntries(
            Map.entry("vinte", 20),
            Map.entry("trinta", 30),
            Map.entry("quarenta", 40),
            Map.entry("cinquenta", 50),
            Map.entry("sessenta", 60),
            Map.entry("setenta", 70),
            Map.entry("oitenta", 80),
            Map.entry("noventa", 90));

    static final Map<String, Integer> HUNDREDS = Map.ofEntries(
            Map.entry("cem", 100),
            Map.entry("cento", 100),
            Map.entry("duzentos", 200),
            Map.entry("trezentos", 300),
            Map.entry("quatrocentos", 400),
            Map.entry("quinhentos", 500),
            Map.entry("seiscentos", 600),
            Map.entry("setecentos", 700),
            Map.entry("oitocentos", 800),
            Map.entry("novecentos", 900));

    /**
     * Compound teens that start with another number word ("dez", "dezes...") and must not be
     * split by the generic word-boundary pass.
     */
    public static final List<String> PROTECTED_TEENS = List.of("dezesseis", "dezessete", "dezoito", "dezenove");

    private final Map<String, Integer> allWords;
    private final List<String> wordsLongestFirst;

    public NumberWordLexicon() {
        Map<String, Integer> words = new HashMap<>();
        words.putAll(UNITS);
        words.putAll(TEENS);
        words.putAll(TENS);
        words.putAll(HUNDREDS);
        this.allWords = Map.copyOf(words);

        List<String> sorted = new ArrayList<>(allWords.keySet());
        sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        this.wordsLongestFirst = List.copyOf(sorted);
    }

    public boolean isNumberWord(String token) {
        return token != null && allWords.containsKey(token);
    }

    public List<String> wordsLongestFirst() {
        return wordsLongestFirst;
    }

    /**
     * Parses a run of number words with the conjunctions already removed.
     * Hundreds are added, a tens word absorbs an adjacent unit ("vinte", "cinco" -> 25),
     * teens and units are added directly, unknown words are ignored.
     *
     * @return the value, or empty when the run adds up to zero
     */
    public OptionalInt parse(List<String> words) {
        int total = 0;
        int i = 0;
        while (i < words.size()) {
            String word = words.get(i);
            if (HUNDREDS.containsKey(word)) {
                total += HUNDREDS.get(word);
                i++;
            } else if (TENS.containsKey(word)) {
                int value = TENS.get(word);
                if (i + 1 < words.size() && UNITS.containsKey(words.get(i + 1))) {
                    value += UNITS.get(words.get(i + 1));
                    i += 2;
                } else {
                    i++;
                }
                total += value;
            } else if (TEENS.containsKey(word)) {
                total += TEENS.get(word);
                i++;
            } else if (UNITS.containsKey(word)) {
                total += UNITS.get(word);
                i++;
            } else {
                i++;
            }
        }
        return total > 0 ? OptionalInt.of(total) : OptionalInt.empty();
    }
}
