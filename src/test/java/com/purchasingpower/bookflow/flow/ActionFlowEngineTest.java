package com.purchasingpower.bookflow.flow;

import com.purchasingpower.bookflow.knowledge.EmbeddingService;
import com.purchasingpower.bookflow.model.store.Book;
import com.purchasingpower.bookflow.model.store.Cart;
import com.purchasingpower.bookflow.model.store.CartItem;
import com.purchasingpower.bookflow.model.store.CartStatus;
import com.purchasingpower.bookflow.model.store.OrderStatus;
import com.purchasingpower.bookflow.model.store.Payment;
import com.purchasingpower.bookflow.model.store.PaymentStatus;
import com.purchasingpower.bookflow.model.store.PurchaseOrder;
import com.purchasingpower.bookflow.repository.BookRepository;
import com.purchasingpower.bookflow.repository.CartItemRepository;
import com.purchasingpower.bookflow.repository.CartRepository;
import com.purchasingpower.bookflow.repository.OrderItemRepository;
import com.purchasingpower.bookflow.repository.PaymentRepository;
import com.purchasingpower.bookflow.repository.PurchaseOrderRepository;
import com.purchasingpower.bookflow.service.GenerativeTextService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static com.purchasingpower.bookflow.flow.FlowStep.APPLY_ACTION;
import static com.purchasingpower.bookflow.flow.FlowStep.ASK_INPUT;
import static com.purchasingpower.bookflow.flow.FlowStep.BUILD_RESPONSE;
import static com.purchasingpower.bookflow.flow.FlowStep.DONE;
import static com.purchasingpower.bookflow.flow.FlowStep.LOAD_CONTEXT;
import static com.purchasingpower.bookflow.flow.FlowStep.PERSIST;
import static com.purchasingpower.bookflow.flow.FlowStep.VALIDATE_INPUT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

/**
 * Runs every flow action against the in-memory database.
 *
 * Not transactional on purpose: each flow opens and commits its own transaction.
 */
@SpringBootTest
@ActiveProfiles("test")
class ActionFlowEngineTest {

    private static final Long USER = 42L;

    @MockBean
    private EmbeddingService embeddingService;

    @MockBean
    private GenerativeTextService generativeTextService;

    @MockBean
    private PaymentSimulator paymentSimulator;

    @Autowired
    private ActionFlowEngine engine;

    @Autowired
    private BookRepository bookRepository;

    @Autowired
    private CartRepository cartRepository;

    @Autowired
    private CartItemRepository cartItemRepository;

    @Autowired
    private PurchaseOrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    private Book dune;
    private Book emma;

    @BeforeEach
    void setUp() {
        paymentRepository.deleteAll();
        orderItemRepository.deleteAll();
        orderRepository.deleteAll();
        cartItemRepository.deleteAll();
        cartRepository.deleteAll();
        bookRepository.deleteAll();

        dune = bookRepository.save(Book.builder()
                .title("Dune").author("Frank Herbert").genre("Ciencia ficción").price(19.99).stock(5).build());
        emma = bookRepository.save(Book.builder()
                .title("Emma").author("Jane Austen").genre("Clásico").price(8.50).stock(3).build());
    }

    private FlowState add(Book book, int quantity) {
        return engine.run(ActionType.ADD_BOOK_TO_CART, USER, "agrega " + book.getTitle(),
                FlowParams.builder().bookId(book.getId()).quantity(quantity).build());
    }

    private PurchaseOrder checkoutDuneAndEmma() {
        add(dune, 2);
        add(emma, 1);
        FlowState checkout = engine.run(ActionType.CHECKOUT_ORDER, USER, "hacer checkout", FlowParams.empty());
        assertThat(checkout.getActionResult().isSuccess()).isTrue();
        return orderRepository.findById(checkout.getActionResult().getOrderId()).orElseThrow();
    }

    @Test
    @DisplayName("Adding a book walks every step and leaves stock untouched")
    void addToCart_shouldPersistLineWithoutTouchingStock() {
        // When
        FlowState state = add(dune, 2);

        // Then
        assertThat(state.getStateTrace())
                .containsExactly(VALIDATE_INPUT, LOAD_CONTEXT, APPLY_ACTION, PERSIST, BUILD_RESPONSE, DONE);
        assertThat(state.getResponse()).startsWith("Dune (x2) agregado al carrito.");
        assertThat(state.isPersistenceFailed()).isFalse();

        List<CartItem> items = cartItemRepository.findAll();
        assertThat(items).hasSize(1);
        assertThat(items.get(0).getQuantity()).isEqualTo(2);
        assertThat(bookRepository.findById(dune.getId()).orElseThrow().getStock()).isEqualTo(5);
    }

    @Test
    void addingSameBookTwice_shouldMergeIntoOneLine() {
        add(dune, 1);
        add(dune, 2);

        List<CartItem> items = cartItemRepository.findAll();
        assertThat(items).hasSize(1);
        assertThat(items.get(0).getQuantity()).isEqualTo(3);
        assertThat(cartRepository.count()).isEqualTo(1);
    }

    @Test
    void quantityAboveStock_shouldBeRefused() {
        FlowState state = add(emma, 4);

        assertThat(state.getResponse()).isEqualTo("Stock insuficiente");
        assertThat(state.getActionResult().isSuccess()).isFalse();
        assertThat(cartItemRepository.count()).isZero();
    }

    @Test
    void missingBook_shouldAskForInputWithoutLoadingAnything() {
        FlowState state = engine.run(ActionType.ADD_BOOK_TO_CART, USER, "agrega algo", FlowParams.empty());

        assertThat(state.getStateTrace()).containsExactly(VALIDATE_INPUT, ASK_INPUT, DONE);
        assertThat(state.getMissingFields()).containsExactly(FlowParams.BOOK_ID);
        assertThat(state.getResponse()).contains("el ID del libro");
        assertThat(cartRepository.count()).isZero();
    }

    @Test
    void removeFromCart_shouldDeleteLine() {
        add(dune, 1);
        add(emma, 1);

        FlowState state = engine.run(ActionType.REMOVE_BOOK_FROM_CART, USER, "quita Dune",
                FlowParams.builder().bookId(dune.getId()).build());

        assertThat(state.getActionResult().isSuccess()).isTrue();
        assertThat(cartItemRepository.findAll()).extracting(CartItem::getBookId).containsExactly(emma.getId());
    }

    @Test
    void checkoutWithEmptyCart_shouldBeRefused() {
        FlowState state = engine.run(ActionType.CHECKOUT_ORDER, USER, "hacer checkout", FlowParams.empty());

        assertThat(state.getResponse()).isEqualTo("Tu carrito está vacío");
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    void checkout_shouldCreateOrderAtCurrentPrices() {
        PurchaseOrder order = checkoutDuneAndEmma();

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CREATED);
        assertThat(order.getTotal()).isCloseTo(48.48, within(1e-9));
        assertThat(orderItemRepository.findByOrderIdOrderByIdAsc(order.getId())).hasSize(2);
        assertThat(cartRepository.findAll()).extracting(Cart::getStatus).containsOnly(CartStatus.CHECKED_OUT);
    }

    @Test
    void paymentPrompt_shouldNotCharge() {
        PurchaseOrder order = checkoutDuneAndEmma();

        FlowState state = engine.run(ActionType.PROCESS_PAYMENT, USER, "pagar orden",
                FlowParams.builder().orderId(order.getId()).build());

        assertThat(state.getActionResult().isNeedsConfirmation()).isTrue();
        assertThat(state.getResponse()).contains("sí, confirmo el pago");
        assertThat(paymentRepository.count()).isZero();
    }

    @Test
    void approvedPayment_shouldMarkOrderPaid() {
        PurchaseOrder order = checkoutDuneAndEmma();
        when(paymentSimulator.approve()).thenReturn(true);

        FlowState state = engine.run(ActionType.CONFIRM_PAYMENT, USER, "sí, confirmo el pago", FlowParams.empty());

        assertThat(state.getResponse()).contains("Pago **aprobado**");
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(paymentRepository.findByOrderIdOrderByIdAsc(order.getId()))
                .extracting(Payment::getStatus).containsExactly(PaymentStatus.APPROVED);
    }

    @Test
    void rejectedPayment_shouldBeRecordedAndKeepOrderOpen() {
        PurchaseOrder order = checkoutDuneAndEmma();
        when(paymentSimulator.approve()).thenReturn(false);

        FlowState state = engine.run(ActionType.CONFIRM_PAYMENT, USER, "confirmo",
                FlowParams.builder().orderId(order.getId()).build());

        assertThat(state.getStateTrace()).contains(PERSIST);
        assertThat(state.getResponse()).contains("rechazado");
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.CREATED);
        assertThat(paymentRepository.findByOrderIdOrderByIdAsc(order.getId()))
                .extracting(Payment::getStatus).containsExactly(PaymentStatus.REJECTED);
    }

    @Test
    @DisplayName("A failure while applying rolls back and skips PERSIST")
    void failingApply_shouldRollBack() {
        PurchaseOrder order = checkoutDuneAndEmma();
        when(paymentSimulator.approve()).thenThrow(new IllegalStateException("gateway down"));

        FlowState state = engine.run(ActionType.CONFIRM_PAYMENT, USER, "confirmo",
                FlowParams.builder().orderId(order.getId()).build());

        assertThat(state.getStateTrace())
                .containsExactly(VALIDATE_INPUT, LOAD_CONTEXT, APPLY_ACTION, BUILD_RESPONSE, DONE);
        assertThat(state.getError()).isEqualTo("gateway down");
        assertThat(state.getResponse()).isEqualTo("Hubo un error al procesar tu solicitud: gateway down");
        assertThat(paymentRepository.count()).isZero();
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.CREATED);
    }

    @Test
    void cancel_shouldOnlyApplyToUnpaidOrders() {
        PurchaseOrder order = checkoutDuneAndEmma();
        FlowParams target = FlowParams.builder().orderId(order.getId()).build();

        FlowState cancelled = engine.run(ActionType.CANCEL_ORDER, USER, "cancela la orden", target);
        FlowState again = engine.run(ActionType.CANCEL_ORDER, USER, "cancela la orden", target);

        assertThat(cancelled.getResponse()).contains("cancelada exitosamente");
        assertThat(again.getResponse()).contains("ya está cancelada");
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.CANCELLED);
    }

    @Test
    void cancelWithoutOrderId_shouldAskForIt() {
        FlowState state = engine.run(ActionType.CANCEL_ORDER, USER, "cancela", FlowParams.empty());

        assertThat(state.getStateTrace()).containsExactly(VALIDATE_INPUT, ASK_INPUT, DONE);
        assertThat(state.getResponse()).contains("el número de orden");
    }

    @Test
    void otherUsersOrder_shouldNotBeFound() {
        PurchaseOrder order = checkoutDuneAndEmma();

        FlowState state = engine.run(ActionType.CANCEL_ORDER, 7L, "cancela",
                FlowParams.builder().orderId(order.getId()).build());

        assertThat(state.getResponse()).isEqualTo("Orden no encontrada");
    }
}
