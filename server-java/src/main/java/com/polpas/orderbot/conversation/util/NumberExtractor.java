package com.polpas.orderbot.conversation.util;

import com.polpas.orderbot.conversation.model.NumberMatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

@Component
public class NumberExtractor {

    private static final int MAX_DIGITS = 9;

    private final NumberWordLexicon lexicon;

    public NumberExtractor(NumberWordLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public static boolean isDigits(String token) {
        return token != null && !token.isEmpty() && token.chars().allMatch(Character::isDigit);
    }

    /**
     * Emits every number in the token stream in position order. A number word absorbs
     * any following "e" + number word pairs ("vinte e cinco" is one match at the
     * position of "vinte"); runs that add up to zero are dropped.
     */
    public List<NumberMatch> extract(List<String> tokens) {
        List<NumberMatch> numbers = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            String token = tokens.get(i);
            if (isDigits(token)) {
                if (token.length() <= MAX_DIGITS) {
                    numbers.add(new NumberMatch(i, Integer.parseInt(token)));
                }
                i++;
            } else if (lexicon.isNumberWord(token)) {
                List<String> run = new ArrayList<>();
                run.add(token);
                int j = i + 1;
                while (j < tokens.size() - 1
                        && NumberWordLexicon.CONJUNCTION.equals(tokens.get(j))
                        && lexicon.isNumberWord(tokens.get(j + 1))) {
                    run.add(tokens.get(j + 1));
                    j += 2;
                }
                OptionalInt value = lexicon.parse(run);
                if (value.isPresent()) {
                    numbers.add(new NumberMatch(i, value.getAsInt()));
                    i = j;
                } else {
                    i++;
                }
            } else {
                i++;
            }
        }
        return numbers;
    }

    public boolean isNumberToken(String token) {
        return isDigits(token) || lexicon.isNumberWord(token);
    }
}
