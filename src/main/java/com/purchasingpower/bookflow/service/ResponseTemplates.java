package com.purchasingpower.bookflow.service;

import com.purchasingpower.bookflow.flow.ActionResult;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowParams;
import com.purchasingpower.bookflow.model.store.PaymentStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic Spanish replies. Transactional actions always use these; the
 * other actions use them when generative wording is unavailable.
 */
@Component
public class ResponseTemplates {

    static final String ERROR_PREFIX = "Hubo un error al procesar tu solicitud: ";
    static final String PERSISTENCE_NOTE =
            "\n\nNo pude confirmar que los cambios se guardaran. Revisa tu carrito o tus pedidos antes de continuar.";

    private static final Map<String, String> FIELD_NAMES = Map.of(
            FlowParams.BOOK_ID, "el ID del libro",
            FlowParams.ORDER_ID, "el número de orden",
            FlowParams.QUANTITY, "la cantidad");

    public String missingInput(List<String> missingFields) {
        String fields = missingFields.stream()
                .map(f -> FIELD_NAMES.getOrDefault(f, f))
                .collect(Collectors.joining(", "));
        return "Para continuar, necesito que me indiques " + fields + ".";
    }

    public String error(String error) {
        return ERROR_PREFIX + error;
    }

    public String persistenceNotConfirmed(String response) {
        return response + PERSISTENCE_NOTE;
    }

    /**
     * Reply for a flow-based action.
     */
    public String forFlow(ActionType action, ActionResult result) {
        switch (action) {
            case ADD_BOOK_TO_CART:
                if (!result.isSuccess()) {
                    return messageOr(result, "No se pudo agregar al carrito.");
                }
                return result.getBookTitle() + " (x" + result.getQuantity() + ") agregado al carrito.\n\n"
                        + "¿Qué deseas hacer ahora?\n"
                        + "- Escribe **\"ver mi carrito\"** para ver el contenido\n"
                        + "- Escribe **\"hacer checkout\"** para crear tu orden";
            case REMOVE_BOOK_FROM_CART:
                if (!result.isSuccess()) {
                    return messageOr(result, "No se pudo eliminar del carrito.");
                }
                return "Libro eliminado del carrito. Escribe **\"ver mi carrito\"** para ver el contenido actualizado.";
            case CHECKOUT_ORDER:
                if (!result.isSuccess()) {
                    return messageOr(result, "No se pudo crear la orden.");
                }
                return "Orden **#" + result.getOrderId() + "** creada con " + result.getItemsCount() + " item(s).\n"
                        + "**Total: $" + money(result.getTotal()) + "**\n\n"
                        + "Para pagar, escribe **\"pagar orden #" + result.getOrderId() + "\"**.";
            case PROCESS_PAYMENT:
                if (result.isNeedsConfirmation()) {
                    return "Estás a punto de pagar **$" + money(result.getAmount()) + "** para la orden **#"
                            + result.getOrderId() + "**.\n\n"
                            + "Responde **\"sí, confirmo el pago\"** para procesar el pago.";
                }
                return paymentOutcome(result);
            case CONFIRM_PAYMENT:
                return paymentOutcome(result);
            case CANCEL_ORDER:
                if (!result.isSuccess()) {
                    return messageOr(result, "No se pudo cancelar la orden.");
                }
                return "Orden **#" + result.getOrderId() + "** cancelada exitosamente.";
            default:
                throw new IllegalArgumentException("Not a flow action: " + action);
        }
    }

    /**
     * Reply for a directly executed action, built from its result payload.
     */
    public String forDirect(ActionType action, Map<String, Object> payload) {
        if (payload.containsKey("error")) {
            return String.valueOf(payload.get("error"));
        }
        switch (action) {
            case SEARCH_BOOKS_FOR_SALE:
                return bookList(payload, "books", "No encontré libros con esos criterios.",
                        "Encontré %d libro(s):\n");
            case RECOMMEND_BOOKS_FOR_PURCHASE:
                return bookList(payload, "recommendations", "No tengo recomendaciones por ahora.",
                        "Te recomiendo:\n");
            case GET_BOOK_PRODUCT_DETAILS:
                return payload.get("title") + "\n"
                        + "Autor: " + payload.get("author") + "\n"
                        + "Género: " + payload.getOrDefault("genre", "?") + "\n"
                        + "Precio: $" + money(number(payload.get("price"))) + "\n"
                        + "Stock: " + payload.get("stock") + " unidades\n"
                        + (payload.get("description") != null ? payload.get("description") : "");
            case CHECK_BOOK_STOCK: {
                Object title = payload.getOrDefault("title", "El libro");
                int stock = (int) number(payload.get("stock"));
                return stock > 0
                        ? title + " tiene " + stock + " unidades disponibles."
                        : title + " está agotado.";
            }
            case GET_ORDER_STATUS:
                return "Orden #" + payload.get("order_id") + ": estado " + payload.get("status")
                        + ", total $" + money(number(payload.get("total"))) + ".";
            case VIEW_CART:
                return cart(payload);
            default:
                throw new IllegalArgumentException("Not a direct action: " + action);
        }
    }

    private String paymentOutcome(ActionResult result) {
        if (!result.isSuccess() || result.getPaymentStatus() == PaymentStatus.REJECTED) {
            return messageOr(result, "El pago fue rechazado. Intenta de nuevo.");
        }
        return "Pago **aprobado** para la orden **#" + result.getOrderId() + "**.\n"
                + "Monto: **$" + money(result.getAmount()) + "**.\n\n"
                + "¡Gracias por tu compra!";
    }

    @SuppressWarnings("unchecked")
    private String bookList(Map<String, Object> payload, String key, String empty, String header) {
        List<Map<String, Object>> books = (List<Map<String, Object>>) payload.getOrDefault(key, List.of());
        if (books.isEmpty()) {
            return empty;
        }
        StringBuilder reply = new StringBuilder(header.contains("%d") ? String.format(header, books.size()) : header);
        for (Map<String, Object> book : books) {
            reply.append("\n- ").append(book.get("title"))
                    .append(" por ").append(book.get("author"))
                    .append(" -- $").append(money(number(book.get("price"))));
        }
        return reply.toString();
    }

    @SuppressWarnings("unchecked")
    private String cart(Map<String, Object> payload) {
        List<Map<String, Object>> items = (List<Map<String, Object>>) payload.getOrDefault("items", List.of());
        if (items.isEmpty()) {
            return "Tu carrito está vacío. Escribe **\"buscar libros\"** para explorar el catálogo.";
        }
        StringBuilder reply = new StringBuilder("**Tu carrito:**\n");
        for (Map<String, Object> item : items) {
            reply.append("\n- ").append(item.get("title"))
                    .append(" (x").append(item.get("quantity")).append(") — $")
                    .append(money(number(item.get("subtotal"))));
        }
        reply.append("\n\n**Total: $").append(money(number(payload.get("total")))).append("**");
        reply.append("\n\nEscribe **\"hacer checkout\"** para crear tu orden.");
        return reply.toString();
    }

    private static String messageOr(ActionResult result, String fallback) {
        return result.getMessage() != null ? result.getMessage() : fallback;
    }

    private static double number(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }

    static String money(double amount) {
        return String.format(Locale.US, "%.2f", amount);
    }
}
