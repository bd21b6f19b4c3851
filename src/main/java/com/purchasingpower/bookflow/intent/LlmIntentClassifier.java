package com.purchasingpower.bookflow.intent;

import com.purchasingpower.bookflow.client.ChatMessage;
import com.purchasingpower.bookflow.client.ProviderResult;
import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.service.GenerativeTextService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Third tier of intent resolution: asks the generative provider to pick one of
 * the offered action names, or NONE for queries outside the bookstore.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmIntentClassifier {

    static final String NONE = "NONE";

    private final GenerativeTextService generativeTextService;
    private final BookFlowProperties properties;

    /**
     * @param functions offered action names mapped to their descriptions, in catalog order
     * @return the chosen action; empty for NONE, an unknown name or a provider failure
     */
    public Optional<ActionType> classify(String query, Map<String, String> functions) {
        ProviderResult<String> result = generativeTextService.complete(
                List.of(ChatMessage.user(buildPrompt(query, functions))),
                properties.getLlm().getClassificationTemperature(),
                properties.getLlm().getClassificationMaxTokens());

        if (!result.isSuccess()) {
            log.warn("⚠️ Generative classification unavailable ({}): {}", result.getFailureKind(), result.getMessage());
            return Optional.empty();
        }

        String answer = clean(result.orElse(""));
        log.info("🤖 Generative classification answered: {}", answer);
        if (NONE.equalsIgnoreCase(answer) || !functions.containsKey(answer)) {
            return Optional.empty();
        }
        return ActionType.fromFunctionName(answer);
    }

    static String buildPrompt(String query, Map<String, String> functions) {
        String functionList = functions.entrySet().stream()
                .map(e -> "- " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));

        return """
                You are a classifier for a bookstore chatbot.
                Given the user query, classify it into ONE of these functions.
                If the query is NOT related to a bookstore (buying books, carts, orders, recommendations), respond with "NONE".

                Available functions:
                %s

                User query: "%s"

                Respond with ONLY the function name or "NONE". No explanation.""".formatted(functionList, query);
    }

    /**
     * Models sometimes wrap the name in quotes or backticks or add a trailing period.
     */
    private static String clean(String answer) {
        String trimmed = answer.trim();
        return trimmed.replaceAll("^[\"'`]+|[\"'`.]+$", "").trim();
    }
}
