package com.purchasingpower.bookflow.orchestrator;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canned replies for greetings and "what can you do" questions, answered before
 * any classifier runs.
 */
@Component
public class ConversationShortcuts {

    static final String GREETING_REPLY = "Hola! Soy tu asistente de la librería. Puedo buscar libros, "
            + "darte recomendaciones, agregar al carrito y más. ¿Qué te gustaría hacer?";

    static final String HELP_REPLY = """
            Puedo ayudarte con todo lo relacionado a nuestra librería:

            - Buscar libros por género, autor o tema
            - Darte recomendaciones personalizadas
            - Mostrarte detalles de un libro específico
            - Verificar stock y disponibilidad
            - Agregar libros a tu carrito
            - Hacer checkout y procesar pagos
            - Consultar el estado de tus pedidos

            Prueba escribiendo algo como: "Buscar libros de fantasía" o "Agregar Dune al carrito\"""";

    private static final int FLAGS = Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Pattern> HELP_PATTERNS = List.of(
            Pattern.compile("(?:qu[eé]|que)\\s+(?:puedes?|puede)\\s+hacer", FLAGS),
            Pattern.compile("(?:qu[eé]|que)\\s+(?:sabes?|sabe)\\s+hacer", FLAGS),
            Pattern.compile("(?:ayuda|help)\\b", FLAGS),
            Pattern.compile("(?:c[oó]mo|como)\\s+(?:funciona|te\\s+uso)", FLAGS),
            Pattern.compile("(?:qu[eé]|que)\\s+(?:opciones|funciones|servicios)", FLAGS),
            Pattern.compile("(?:para\\s+)?(?:qu[eé]|que)\\s+(?:sirves?|eres)", FLAGS));

    private static final List<Pattern> GREETING_PATTERNS = List.of(
            Pattern.compile("^(?:hola|hey|buenas?|buenos?\\s+d[ií]as?|buenas?\\s+tardes?|buenas?\\s+noches?)[\\s!.?]*$", FLAGS),
            Pattern.compile("^(?:hi|hello|saludos?)[\\s!.?]*$", FLAGS));

    public Optional<String> reply(String query) {
        if (query == null) {
            return Optional.empty();
        }
        String normalized = query.toLowerCase(Locale.ROOT).trim();
        if (HELP_PATTERNS.stream().anyMatch(p -> p.matcher(normalized).find())) {
            return Optional.of(HELP_REPLY);
        }
        if (GREETING_PATTERNS.stream().anyMatch(p -> p.matcher(normalized).find())) {
            return Optional.of(GREETING_REPLY);
        }
        return Optional.empty();
    }
}
