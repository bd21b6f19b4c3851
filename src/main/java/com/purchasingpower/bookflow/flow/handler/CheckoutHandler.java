package com.purchasingpower.bookflow.flow.handler;

import com.purchasingpower.bookflow.flow.ActionResult;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowContext;
import com.purchasingpower.bookflow.flow.FlowContext.CartLine;
import com.purchasingpower.bookflow.flow.FlowParams;
import com.purchasingpower.bookflow.flow.FlowState;
import com.purchasingpower.bookflow.model.store.Book;
import com.purchasingpower.bookflow.model.store.Cart;
import com.purchasingpower.bookflow.model.store.CartStatus;
import com.purchasingpower.bookflow.model.store.OrderItem;
import com.purchasingpower.bookflow.model.store.OrderStatus;
import com.purchasingpower.bookflow.model.store.PurchaseOrder;
import com.purchasingpower.bookflow.repository.BookRepository;
import com.purchasingpower.bookflow.repository.CartItemRepository;
import com.purchasingpower.bookflow.repository.CartRepository;
import com.purchasingpower.bookflow.repository.OrderItemRepository;
import com.purchasingpower.bookflow.repository.PurchaseOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns the active cart into a CREATED order at the current book prices and
 * closes the cart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckoutHandler implements ActionHandler {

    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final BookRepository bookRepository;
    private final PurchaseOrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    @Override
    public ActionType actionType() {
        return ActionType.CHECKOUT_ORDER;
    }

    @Override
    public List<String> missingFields(FlowParams params) {
        return List.of();
    }

    @Override
    public FlowContext loadContext(FlowState state) {
        Optional<Cart> cart = cartRepository.findFirstByUserIdAndStatusOrderByIdDesc(
                state.getUserId(), CartStatus.ACTIVE);
        if (cart.isEmpty()) {
            return FlowContext.empty();
        }

        List<CartLine> lines = cartItemRepository.findByCartIdOrderByIdAsc(cart.get().getId()).stream()
                .map(item -> {
                    Optional<Book> book = bookRepository.findById(item.getBookId());
                    return new CartLine(
                            item.getBookId(),
                            book.map(Book::getTitle).orElse("Unknown"),
                            book.map(Book::getPrice).orElse(0.0),
                            item.getQuantity());
                })
                .toList();

        return FlowContext.builder()
                .cartId(cart.get().getId())
                .cartLines(lines)
                .build();
    }

    @Override
    public ActionResult apply(FlowState state) {
        FlowContext context = state.getContext();
        if (context.getCartId() == null || context.getCartLines().isEmpty()) {
            return ActionResult.refused("Tu carrito está vacío");
        }

        double total = context.getCartLines().stream()
                .mapToDouble(line -> line.price() * line.quantity())
                .sum();

        PurchaseOrder order = orderRepository.save(PurchaseOrder.builder()
                .userId(state.getUserId())
                .status(OrderStatus.CREATED)
                .total(total)
                .build());

        for (CartLine line : context.getCartLines()) {
            orderItemRepository.save(OrderItem.builder()
                    .orderId(order.getId())
                    .bookId(line.bookId())
                    .quantity(line.quantity())
                    .unitPrice(line.price())
                    .build());
        }

        Cart cart = cartRepository.findById(context.getCartId())
                .orElseThrow(() -> new IllegalStateException("Cart " + context.getCartId() + " disappeared during checkout"));
        cart.setStatus(CartStatus.CHECKED_OUT);
        cartRepository.save(cart);

        log.info("📦 Order #{} created, total {}", order.getId(), total);
        return ActionResult.builder()
                .success(true)
                .orderId(order.getId())
                .total(total)
                .itemsCount(context.getCartLines().size())
                .build();
    }
}
