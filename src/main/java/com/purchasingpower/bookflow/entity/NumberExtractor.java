package com.purchasingpower.bookflow.entity;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Context-sensitive number extraction for quantities and order numbers.
 */
@Component
public class NumberExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    static final int MIN_QUANTITY = 1;
    static final int MAX_QUANTITY = 99;

    private static final List<Pattern> QUANTITY_PATTERNS = List.of(
            // "3 copias", "2 unidades", "1 ejemplar"
            Pattern.compile("(\\d+)\\s*(?:copias?|unidades?|ejemplares?)", FLAGS),
            // "compra 3 The Alchemist"
            Pattern.compile("(?:compra|dame|ponme|tráeme|traeme|agrega|añade|buy|add|get)\\s+(\\d+)\\s+", FLAGS),
            Pattern.compile("\\b(\\d{1,2})\\b", FLAGS));

    private static final Pattern ORDER_ID = Pattern.compile("(?:orden|pedido|order)\\s*#?\\s*(\\d+)", FLAGS);
    private static final Pattern ANY_NUMBER = Pattern.compile("\\b(\\d+)\\b", FLAGS);

    public Optional<Integer> extract(String query, NumberContext context) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        return switch (context) {
            case QUANTITY -> extractQuantity(query);
            case ORDER_ID -> firstGroup(ORDER_ID, query);
            case ANY -> firstGroup(ANY_NUMBER, query);
        };
    }

    private Optional<Integer> extractQuantity(String query) {
        for (Pattern pattern : QUANTITY_PATTERNS) {
            Optional<Integer> value = firstGroup(pattern, query);
            if (value.isPresent() && value.get() >= MIN_QUANTITY && value.get() <= MAX_QUANTITY) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<Integer> firstGroup(Pattern pattern, String query) {
        Matcher matcher = pattern.matcher(query);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return Optional.empty();
        }
    }
}
