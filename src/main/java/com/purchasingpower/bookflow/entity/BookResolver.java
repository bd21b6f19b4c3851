package com.purchasingpower.bookflow.entity;

import com.purchasingpower.bookflow.model.store.Book;
import com.purchasingpower.bookflow.repository.BookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Decides which book of the catalog a query refers to. Read-only.
 *
 * <p>Tiers, each short-circuiting on success:
 * <ol>
 *   <li>a full title appears in the query (longest title wins)</li>
 *   <li>the best title contains every extracted keyword</li>
 *   <li>the title matching the most keywords, if it is the only one with that count</li>
 * </ol>
 * A tie in the last tier is ambiguous.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookResolver {

    static final int MAX_CANDIDATES = 5;

    private final BookRepository bookRepository;
    private final KeywordExtractor keywordExtractor;

    public EntityResolution resolve(String text) {
        return resolve(text, bookRepository.findAllByOrderByIdAsc());
    }

    public EntityResolution resolve(String text, List<Book> catalog) {
        if (text == null || text.isBlank() || catalog.isEmpty()) {
            return EntityResolution.notFound();
        }
        String query = text.toLowerCase(Locale.ROOT);

        List<Book> byTitleLength = new ArrayList<>(catalog);
        byTitleLength.sort(Comparator.comparingInt((Book b) -> b.getTitle().length()).reversed());
        for (Book book : byTitleLength) {
            if (!book.getTitle().isBlank() && query.contains(book.getTitle().toLowerCase(Locale.ROOT))) {
                log.info("📖 Exact title match: {} (ID: {})", book.getTitle(), book.getId());
                return EntityResolution.found(book);
            }
        }

        List<String> keywords = keywordExtractor.extract(text);
        if (keywords.isEmpty()) {
            return EntityResolution.notFound();
        }

        List<ScoredBook> scored = new ArrayList<>();
        for (Book book : catalog) {
            String title = book.getTitle().toLowerCase(Locale.ROOT);
            int matches = (int) keywords.stream()
                    .filter(k -> title.contains(k.toLowerCase(Locale.ROOT)))
                    .count();
            if (matches > 0) {
                scored.add(new ScoredBook(book, matches));
            }
        }
        if (scored.isEmpty()) {
            return EntityResolution.notFound();
        }
        scored.sort(Comparator.comparingInt(ScoredBook::matches).reversed());

        ScoredBook best = scored.get(0);
        if (best.matches() == keywords.size()) {
            log.info("📖 All-keyword match: {} (ID: {}, {}/{} keywords)",
                    best.book().getTitle(), best.book().getId(), best.matches(), keywords.size());
            return EntityResolution.found(best.book());
        }

        if (scored.size() == 1 || best.matches() > scored.get(1).matches()) {
            log.info("📖 Best keyword match: {} (ID: {}, {} keywords)",
                    best.book().getTitle(), best.book().getId(), best.matches());
            return EntityResolution.found(best.book());
        }

        List<BookCard> tied = scored.stream()
                .filter(s -> s.matches() == best.matches())
                .limit(MAX_CANDIDATES)
                .map(s -> BookCard.from(s.book()))
                .toList();
        log.info("📖 Ambiguous reference, {} candidates", tied.size());
        return EntityResolution.ambiguous(tied);
    }

    private record ScoredBook(Book book, int matches) {
    }
}
