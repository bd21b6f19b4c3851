package com.purchasingpower.bookflow.entity;

import com.purchasingpower.bookflow.model.store.Book;
import lombok.Value;

import java.util.List;

/**
 * Outcome of resolving which book a query refers to.
 */
@Value
public class EntityResolution {

    ResolutionStatus status;

    /** The resolved book, only for {@link ResolutionStatus#FOUND}. */
    Book book;

    /** Tied candidates (at most 5), only for {@link ResolutionStatus#AMBIGUOUS}. */
    List<BookCard> candidates;

    public static EntityResolution found(Book book) {
        return new EntityResolution(ResolutionStatus.FOUND, book, List.of());
    }

    public static EntityResolution ambiguous(List<BookCard> candidates) {
        return new EntityResolution(ResolutionStatus.AMBIGUOUS, null, List.copyOf(candidates));
    }

    public static EntityResolution notFound() {
        return new EntityResolution(ResolutionStatus.NOT_FOUND, null, List.of());
    }

    public boolean isFound() {
        return status == ResolutionStatus.FOUND;
    }
}
