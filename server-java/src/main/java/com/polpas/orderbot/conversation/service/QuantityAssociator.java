package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.NumberMatch;
import com.polpas.orderbot.conversation.util.NumberExtractor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Picks the quantity for a product phrase from the numbers found in the same message.
 * Rules are tried in order and the first one that applies wins:
 * <ol>
 *     <li>the number right before the phrase</li>
 *     <li>the closest number anywhere before it</li>
 *     <li>the number right after the phrase</li>
 *     <li>the closest number anywhere after it</li>
 *     <li>one, with no number consumed</li>
 * </ol>
 * A number already given to an earlier phrase is swapped for the first unused number in
 * position order, or the default when none is left.
 */
@Component
public class QuantityAssociator {

    public static final int DEFAULT_QUANTITY = 1;

    private static final Comparator<NumberMatch> BY_POSITION = Comparator.comparingInt(NumberMatch::position);

    private final NumberExtractor numberExtractor;

    public QuantityAssociator(NumberExtractor numberExtractor) {
        this.numberExtractor = numberExtractor;
    }

    public Association associate(int windowStart,
                                 int windowSize,
                                 List<String> tokens,
                                 List<NumberMatch> numbers,
                                 Set<Integer> usedNumbers) {
        Optional<NumberMatch> chosen = choose(windowStart, windowStart + windowSize - 1, tokens, numbers);
        if (chosen.isEmpty()) {
            return Association.defaultQuantity();
        }
        NumberMatch match = chosen.get();
        if (!usedNumbers.contains(match.position())) {
            return new Association(match.value(), OptionalInt.of(match.position()));
        }
        return numbers.stream()
                .filter(number -> !usedNumbers.contains(number.position()))
                .min(BY_POSITION)
                .map(number -> new Association(number.value(), OptionalInt.of(number.position())))
                .orElseGet(Association::defaultQuantity);
    }

    private Optional<NumberMatch> choose(int windowStart, int windowEnd, List<String> tokens, List<NumberMatch> numbers) {
        if (numbers.isEmpty()) {
            return Optional.empty();
        }

        int before = windowStart - 1;
        if (before >= 0 && numberExtractor.isNumberToken(tokens.get(before))) {
            Optional<NumberMatch> adjacent = at(before, numbers);
            if (adjacent.isPresent()) {
                return adjacent;
            }
        }

        Optional<NumberMatch> closestBefore = numbers.stream()
                .filter(number -> number.position() < windowStart)
                .max(BY_POSITION);
        if (closestBefore.isPresent()) {
            return closestBefore;
        }

        int after = windowEnd + 1;
        if (after < tokens.size() && numberExtractor.isNumberToken(tokens.get(after))) {
            Optional<NumberMatch> adjacent = at(after, numbers);
            if (adjacent.isPresent()) {
                return adjacent;
            }
        }

        return numbers.stream()
                .filter(number -> number.position() > windowEnd)
                .min(BY_POSITION);
    }

    private Optional<NumberMatch> at(int position, List<NumberMatch> numbers) {
        return numbers.stream().filter(number -> number.position() == position).findFirst();
    }

    public record Association(int quantity, OptionalInt numberPosition) {

        static Association defaultQuantity() {
            return new Association(DEFAULT_QUANTITY, OptionalInt.empty());
        }
    }
}
