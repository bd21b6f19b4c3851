package com.purchasingpower.bookflow.entity;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls title-like keywords out of a query, in three phases:
 * <ol>
 *   <li>quoted fragments, verbatim (at most 3)</li>
 *   <li>capitalized phrases, optionally joined by lowercase connectors
 *       ("One Hundred Years of Solitude"), plus leftover content words</li>
 *   <li>otherwise every alphanumeric token that is not a stop word</li>
 * </ol>
 * At most {@value #MAX_KEYWORDS} keywords are returned.
 */
@Component
public class KeywordExtractor {

    static final int MAX_KEYWORDS = 5;
    private static final int MAX_QUOTED = 3;

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern QUOTED = Pattern.compile("[\"“]([^\"”]+)[\"”]");

    private static final String UPPER = "[A-ZÁÉÍÓÚÑ]";
    private static final String WORD_TAIL = "[a-záéíóúñA-ZÁÉÍÓÚÑ]*";
    private static final String CONNECTORS = "(?:the|of|a|an|and|in|to|for|del|de|la|el|los|las|y)";

    private static final Pattern TITLE_PHRASE = Pattern.compile(
            "\\b(" + UPPER + WORD_TAIL
                    + "(?:\\s+" + CONNECTORS + "\\s+" + UPPER + WORD_TAIL
                    + "|(?:\\s+" + UPPER + WORD_TAIL + "))*)\\b", FLAGS);

    private static final Pattern CONTENT_WORD = Pattern.compile("\\b[a-zA-ZáéíóúñÁÉÍÓÚÑ]{3,}\\b", FLAGS);
    private static final Pattern TOKEN = Pattern.compile("\\b[a-zA-ZáéíóúñÁÉÍÓÚÑ0-9]{2,}\\b", FLAGS);

    /** Verbs that start sentences and must not be taken for one-word titles. */
    static final Set<String> ACTION_WORDS = Set.of(
            "busca", "busco", "buscar", "compra", "comprar", "agrega", "agregar",
            "dame", "ponme", "muestra", "mostrar", "quiero", "deseo", "ver",
            "añadir", "eliminar", "quitar", "sacar", "pagar", "cancelar",
            "recomienda", "sugiere", "hola", "buenas", "gracias",
            "buy", "add", "remove", "search", "find", "show", "get", "want");

    static final Set<String> STOP_WORDS = Set.of(
            "is", "are", "was", "were", "be", "been",
            "do", "does", "did", "have", "has", "had", "will", "would",
            "could", "should", "may", "might", "can", "shall",
            "i", "me", "my", "you", "your", "we", "our", "they", "them",
            "this", "that", "these", "those", "it", "its",
            "for", "to", "from", "with", "about", "in", "on", "at",
            "by", "and", "or", "but", "not", "no", "if", "so", "as",
            "what", "which", "who", "whom", "how", "when", "where", "why",
            "want", "need", "like", "get", "find", "show", "give", "tell",
            "search", "look", "looking", "please", "help", "book", "books",
            "buy", "purchase", "recommend", "recommendation", "available",
            "stock", "cart", "add", "remove", "order", "pay", "cancel",
            "check", "status", "details", "detail", "information", "info",
            "quiero", "buscar", "ver", "dame", "muestra", "mostrar",
            "tiene", "tienen", "hay", "del", "de", "el", "la", "los", "las",
            "un", "una", "unos", "unas", "mi", "mis", "tu", "tus",
            "por", "para", "con", "sin", "que", "como", "donde", "cuando",
            "porque", "pero", "este", "esta", "estos", "estas", "ese", "esa",
            "libro", "libros", "comprar", "agregar", "añadir", "carrito",
            "pagar", "cancelar", "recomendar", "recomendación", "disponible",
            "estado", "pedido", "orden", "quitar", "eliminar", "sacar",
            "también", "algo", "algún", "alguna", "más", "menos",
            "puedo", "puedes", "puede", "podría", "necesito", "necesitas",
            "favor", "gracias", "hola", "buenas",
            "cuánto", "cuántos", "cuál", "cuáles", "sobre",
            "quisiera", "deseo", "gustaría", "prefiero",
            "tienda", "venta", "catálogo", "precio",
            "cuesta", "cuanto", "cuantos", "cual", "cuales",
            "esos", "esas", "aquel", "aquella",
            "mío", "tuyo", "suyo", "nuestro", "vuestro",
            "ser", "estar", "tener", "hacer", "poder", "decir",
            "saber", "dar", "llegar", "llevar",
            "ponme", "tráeme", "traeme", "compra", "agrega");

    public List<String> extract(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        List<String> quoted = findAll(QUOTED, query, 1);
        if (!quoted.isEmpty()) {
            return List.copyOf(quoted.subList(0, Math.min(MAX_QUOTED, quoted.size())));
        }

        List<String> titlePhrases = new ArrayList<>();
        for (String phrase : findAll(TITLE_PHRASE, query, 1)) {
            String[] words = phrase.split("\\s+");
            if (words.length >= 2 || !ACTION_WORDS.contains(words[0].toLowerCase(Locale.ROOT))) {
                titlePhrases.add(phrase);
            }
        }

        String lower = query.toLowerCase(Locale.ROOT);
        if (!titlePhrases.isEmpty()) {
            Set<String> titleWords = new LinkedHashSet<>();
            titlePhrases.forEach(p -> {
                for (String w : p.split("\\s+")) {
                    titleWords.add(w.toLowerCase(Locale.ROOT));
                }
            });
            List<String> result = new ArrayList<>(titlePhrases);
            for (String word : findAll(CONTENT_WORD, lower, 0)) {
                if (!STOP_WORDS.contains(word) && !titleWords.contains(word)) {
                    result.add(word);
                }
            }
            return truncate(result);
        }

        List<String> keywords = new ArrayList<>();
        for (String token : findAll(TOKEN, lower, 0)) {
            if (!STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return truncate(keywords);
    }

    private static List<String> findAll(Pattern pattern, String text, int group) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group(group));
        }
        return found;
    }

    private static List<String> truncate(List<String> keywords) {
        return List.copyOf(keywords.subList(0, Math.min(MAX_KEYWORDS, keywords.size())));
    }
}
