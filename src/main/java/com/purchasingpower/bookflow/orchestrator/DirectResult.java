package com.purchasingpower.bookflow.orchestrator;

import com.purchasingpower.bookflow.entity.BookCard;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Data produced by a directly executed action. The payload is what gets worded
 * into a reply; the cards are returned to the client for display.
 */
@Value
public class DirectResult {

    Map<String, Object> payload;
    List<BookCard> books;

    public static DirectResult error(String message) {
        return new DirectResult(Map.of("error", message), List.of());
    }
}
