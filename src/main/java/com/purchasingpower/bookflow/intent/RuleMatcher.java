package com.purchasingpower.bookflow.intent;

import com.purchasingpower.bookflow.configuration.IntentRuleProperties;
import com.purchasingpower.bookflow.flow.ActionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * First tier of intent resolution: ordered regular-expression rules loaded from
 * {@code intent-rules.yml}. Patterns are compiled once; the first rule with a
 * pattern found in the lower-cased query wins.
 */
@Slf4j
@Component
public class RuleMatcher {

    private final List<CompiledRule> rules;

    public RuleMatcher(IntentRuleProperties properties) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (IntentRuleProperties.Rule rule : properties.getRules()) {
            if (rule.getAction() == null) {
                throw new IllegalStateException("Intent rule without action: " + rule.getPatterns());
            }
            List<Pattern> patterns = rule.getPatterns().stream()
                    .map(p -> Pattern.compile(p, Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS))
                    .toList();
            compiled.add(new CompiledRule(rule.getAction(), patterns));
        }
        this.rules = List.copyOf(compiled);
        log.info("📏 Loaded {} intent rules", rules.size());
    }

    public Optional<ActionType> match(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String normalized = query.toLowerCase(Locale.ROOT).trim();
        for (CompiledRule rule : rules) {
            for (Pattern pattern : rule.patterns()) {
                if (pattern.matcher(normalized).find()) {
                    log.info("📏 Rule matched {} (pattern: {})", rule.action(), pattern.pattern());
                    return Optional.of(rule.action());
                }
            }
        }
        return Optional.empty();
    }

    private record CompiledRule(ActionType action, List<Pattern> patterns) {
    }
}
