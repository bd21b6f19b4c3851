package com.purchasingpower.bookflow.orchestrator;

import com.purchasingpower.bookflow.entity.BookCard;
import com.purchasingpower.bookflow.entity.EntityResolution;
import com.purchasingpower.bookflow.entity.KeywordExtractor;
import com.purchasingpower.bookflow.entity.ResolutionStatus;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.model.store.Book;
import com.purchasingpower.bookflow.model.store.Cart;
import com.purchasingpower.bookflow.model.store.CartItem;
import com.purchasingpower.bookflow.model.store.CartStatus;
import com.purchasingpower.bookflow.model.store.PurchaseOrder;
import com.purchasingpower.bookflow.repository.BookRepository;
import com.purchasingpower.bookflow.repository.CartItemRepository;
import com.purchasingpower.bookflow.repository.CartRepository;
import com.purchasingpower.bookflow.repository.PurchaseOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-only actions that do not need the flow engine.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectActionExecutor {

    static final int SEARCH_LIMIT = 10;
    static final int RECOMMEND_LIMIT = 5;

    static final String BOOK_NOT_IDENTIFIED = "No pude identificar el libro";
    static final String BOOK_AMBIGUOUS = "Encontré varios libros, sé más específico";
    static final String ORDER_NOT_FOUND = "No se encontró la orden";

    private final BookRepository bookRepository;
    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final PurchaseOrderRepository orderRepository;
    private final KeywordExtractor keywordExtractor;

    public DirectResult execute(ActionType action, String query, Long userId, ParameterExtraction extraction) {
        switch (action) {
            case SEARCH_BOOKS_FOR_SALE:
                return search(query);
            case RECOMMEND_BOOKS_FOR_PURCHASE:
                return recommend(query);
            case GET_BOOK_PRODUCT_DETAILS:
                return withResolvedBook(extraction.getBookResolution(), this::details);
            case CHECK_BOOK_STOCK:
                return withResolvedBook(extraction.getBookResolution(), this::stock);
            case GET_ORDER_STATUS:
                return orderStatus(userId, extraction.getParams().getOrderId());
            case VIEW_CART:
                return viewCart(userId);
            default:
                throw new IllegalArgumentException(action + " is not executed directly");
        }
    }

    DirectResult search(String query) {
        List<String> keywords = lowerCase(keywordExtractor.extract(query));
        List<Book> books = bookRepository.findAllByOrderByIdAsc().stream()
                .filter(b -> keywords.isEmpty() || keywords.stream().anyMatch(kw ->
                        contains(b.getTitle(), kw) || contains(b.getGenre(), kw) || contains(b.getAuthor(), kw)))
                .limit(SEARCH_LIMIT)
                .toList();
        log.info("🔍 Search {} -> {} books", keywords, books.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("books", books.stream().map(this::summary).toList());
        payload.put("count", books.size());
        return new DirectResult(payload, cards(books));
    }

    DirectResult recommend(String query) {
        List<String> keywords = lowerCase(keywordExtractor.extract(query));
        List<Book> books = bookRepository.findAllByOrderByIdAsc().stream()
                .filter(b -> keywords.isEmpty() || keywords.stream().anyMatch(kw -> contains(b.getGenre(), kw)))
                .limit(RECOMMEND_LIMIT)
                .toList();
        log.info("🔍 Recommendations for {} -> {} books", keywords, books.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recommendations", books.stream().map(this::summary).toList());
        return new DirectResult(payload, cards(books));
    }

    private DirectResult withResolvedBook(EntityResolution resolution, Function<Book, DirectResult> action) {
        if (resolution == null || resolution.getStatus() == ResolutionStatus.NOT_FOUND) {
            return DirectResult.error(BOOK_NOT_IDENTIFIED);
        }
        if (resolution.getStatus() == ResolutionStatus.AMBIGUOUS) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("error", BOOK_AMBIGUOUS);
            payload.put("options", resolution.getCandidates().stream().map(BookCard::getTitle).toList());
            return new DirectResult(payload, resolution.getCandidates());
        }
        return action.apply(resolution.getBook());
    }

    private DirectResult details(Book book) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", book.getId());
        payload.put("title", book.getTitle());
        payload.put("author", book.getAuthor());
        payload.put("genre", book.getGenre());
        payload.put("price", book.getPrice());
        payload.put("stock", book.getStock());
        payload.put("description", book.getDescription());
        return new DirectResult(payload, List.of(BookCard.from(book)));
    }

    private DirectResult stock(Book book) {
        log.info("📦 Stock of {}: {}", book.getTitle(), book.getStock());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", book.getId());
        payload.put("title", book.getTitle());
        payload.put("stock", book.getStock());
        payload.put("available", book.getStock() > 0);
        return new DirectResult(payload, List.of(BookCard.from(book)));
    }

    DirectResult orderStatus(Long userId, Long orderId) {
        Optional<PurchaseOrder> order = orderId != null
                ? orderRepository.findByIdAndUserId(orderId, userId)
                : orderRepository.findFirstByUserIdOrderByIdDesc(userId);
        if (order.isEmpty()) {
            return DirectResult.error(ORDER_NOT_FOUND);
        }

        PurchaseOrder o = order.get();
        log.info("📦 Order #{} is {}", o.getId(), o.getStatus());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("order_id", o.getId());
        payload.put("status", o.getStatus().label());
        payload.put("total", o.getTotal());
        return new DirectResult(payload, List.of());
    }

    DirectResult viewCart(Long userId) {
        Optional<Cart> cart = cartRepository.findFirstByUserIdAndStatusOrderByIdDesc(userId, CartStatus.ACTIVE);
        List<Map<String, Object>> items = new ArrayList<>();
        List<BookCard> cards = new ArrayList<>();
        double total = 0.0;

        if (cart.isPresent()) {
            for (CartItem item : cartItemRepository.findByCartIdOrderByIdAsc(cart.get().getId())) {
                Optional<Book> book = bookRepository.findById(item.getBookId());
                double price = book.map(Book::getPrice).orElse(0.0);
                double subtotal = price * item.getQuantity();
                total += subtotal;

                Map<String, Object> line = new LinkedHashMap<>();
                line.put("book_id", item.getBookId());
                line.put("title", book.map(Book::getTitle).orElse("Unknown"));
                line.put("quantity", item.getQuantity());
                line.put("price", price);
                line.put("subtotal", subtotal);
                items.add(line);
                book.map(BookCard::from).ifPresent(cards::add);
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("items", items);
        payload.put("total", total);
        return new DirectResult(payload, cards);
    }

    private Map<String, Object> summary(Book book) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", book.getId());
        summary.put("title", book.getTitle());
        summary.put("author", book.getAuthor());
        summary.put("genre", book.getGenre());
        summary.put("price", book.getPrice());
        summary.put("stock", book.getStock());
        return summary;
    }

    private static List<BookCard> cards(List<Book> books) {
        return books.stream().map(BookCard::from).toList();
    }

    private static List<String> lowerCase(List<String> keywords) {
        return keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }

    private static boolean contains(String field, String keyword) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(keyword);
    }
}
