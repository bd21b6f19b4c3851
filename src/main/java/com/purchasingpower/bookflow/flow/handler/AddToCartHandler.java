package com.purchasingpower.bookflow.flow.handler;

import com.purchasingpower.bookflow.flow.ActionResult;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowContext;
import com.purchasingpower.bookflow.flow.FlowContext.BookSnapshot;
import com.purchasingpower.bookflow.flow.FlowParams;
import com.purchasingpower.bookflow.flow.FlowState;
import com.purchasingpower.bookflow.model.store.Cart;
import com.purchasingpower.bookflow.model.store.CartItem;
import com.purchasingpower.bookflow.model.store.CartStatus;
import com.purchasingpower.bookflow.repository.BookRepository;
import com.purchasingpower.bookflow.repository.CartItemRepository;
import com.purchasingpower.bookflow.repository.CartRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds a quantity of one book to the user's active cart, creating the cart on
 * first use and merging into an existing line for the same book.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AddToCartHandler implements ActionHandler {

    private final BookRepository bookRepository;
    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;

    @Override
    public ActionType actionType() {
        return ActionType.ADD_BOOK_TO_CART;
    }

    @Override
    public FlowParams normalize(FlowParams params) {
        if (params.getQuantity() == null || params.getQuantity() < 1) {
            return params.toBuilder().quantity(1).build();
        }
        return params;
    }

    @Override
    public List<String> missingFields(FlowParams params) {
        List<String> missing = new ArrayList<>();
        if (params.getBookId() == null) {
            missing.add(FlowParams.BOOK_ID);
        }
        return missing;
    }

    @Override
    public FlowContext loadContext(FlowState state) {
        BookSnapshot book = bookRepository.findById(state.getParams().getBookId())
                .map(b -> new BookSnapshot(b.getId(), b.getTitle(), b.getPrice(), b.getStock()))
                .orElse(null);
        Long cartId = cartRepository.findFirstByUserIdAndStatusOrderByIdDesc(state.getUserId(), CartStatus.ACTIVE)
                .map(Cart::getId)
                .orElse(null);
        return FlowContext.builder().book(book).cartId(cartId).build();
    }

    @Override
    public ActionResult apply(FlowState state) {
        BookSnapshot book = state.getContext().getBook();
        if (book == null) {
            return ActionResult.refused("Libro no encontrado");
        }

        int quantity = state.getParams().getQuantity();
        if (book.stock() < quantity) {
            return ActionResult.refused("Stock insuficiente");
        }

        Long cartId = state.getContext().getCartId();
        if (cartId == null) {
            Cart cart = cartRepository.save(Cart.builder()
                    .userId(state.getUserId())
                    .status(CartStatus.ACTIVE)
                    .build());
            cartId = cart.getId();
            log.debug("Created cart {} for user {}", cartId, state.getUserId());
        }

        Long finalCartId = cartId;
        CartItem line = cartItemRepository.findByCartIdAndBookId(cartId, book.id())
                .map(existing -> {
                    existing.setQuantity(existing.getQuantity() + quantity);
                    return existing;
                })
                .orElseGet(() -> CartItem.builder()
                        .cartId(finalCartId)
                        .bookId(book.id())
                        .quantity(quantity)
                        .build());
        cartItemRepository.save(line);

        log.info("🛒 Added {} (x{}) to cart {}", book.title(), quantity, cartId);
        return ActionResult.builder()
                .success(true)
                .bookTitle(book.title())
                .quantity(quantity)
                .cartId(cartId)
                .build();
    }
}
