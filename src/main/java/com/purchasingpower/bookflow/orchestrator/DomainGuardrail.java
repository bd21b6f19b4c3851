package com.purchasingpower.bookflow.orchestrator;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword check deciding whether an unclassified query still belongs to the
 * bookstore. Substring matching, so "recomend" covers every inflection.
 */
@Component
public class DomainGuardrail {

    static final String REFUSAL =
            "No puedo ayudar con eso. Puedo ayudarte con compras, recomendaciones y pedidos de libros.";

    private static final int SHORT_QUERY_WORDS = 3;

    private static final List<String> DOMAIN_KEYWORDS = List.of(
            "libro", "libros", "leer", "lectura", "autor", "autora", "novela", "novelas",
            "comprar", "compra", "carrito", "pedido", "orden", "pago", "pagar", "checkout",
            "stock", "disponible", "recomend", "buscar", "busca", "busco",
            "catálogo", "catalogo", "precio", "tienda", "librería", "libreria",
            "genero", "género", "ficción", "ficcion", "fantasia", "fantasía", "ciencia",
            "clásico", "clasico", "romance", "terror", "horror",
            "book", "cart", "order", "pay", "search", "recommend",
            "agregar", "añadir", "eliminar", "quitar", "cancelar",
            "detalle", "detalles", "información", "informacion",
            "hola", "ayuda", "ayudar", "help", "qué puedes", "que puedes");

    /**
     * Short queries (three words or fewer) are always considered in domain.
     */
    public boolean isRelevant(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String normalized = query.toLowerCase(Locale.ROOT).trim();
        if (normalized.split("\\s+").length <= SHORT_QUERY_WORDS) {
            return true;
        }
        return DOMAIN_KEYWORDS.stream().anyMatch(normalized::contains);
    }

    public String refusal() {
        return REFUSAL;
    }
}
