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

import java.util.List;
import java.util.Optional;

/**
 * Removes the whole line of one book from the active cart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoveFromCartHandler implements ActionHandler {

    private final BookRepository bookRepository;
    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;

    @Override
    public ActionType actionType() {
        return ActionType.REMOVE_BOOK_FROM_CART;
    }

    @Override
    public List<String> missingFields(FlowParams params) {
        return params.getBookId() == null ? List.of(FlowParams.BOOK_ID) : List.of();
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
        Long cartId = state.getContext().getCartId();
        if (cartId == null) {
            return ActionResult.refused("No tienes un carrito activo");
        }

        Optional<CartItem> line = cartItemRepository.findByCartIdAndBookId(cartId, state.getParams().getBookId());
        if (line.isEmpty()) {
            return ActionResult.refused("El libro no está en tu carrito");
        }

        cartItemRepository.delete(line.get());
        BookSnapshot book = state.getContext().getBook();
        log.info("🛒 Removed book {} from cart {}", state.getParams().getBookId(), cartId);
        return ActionResult.builder()
                .success(true)
                .message("Libro eliminado del carrito")
                .bookTitle(book != null ? book.title() : null)
                .cartId(cartId)
                .build();
    }
}
