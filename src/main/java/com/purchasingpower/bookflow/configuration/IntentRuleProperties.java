package com.purchasingpower.bookflow.configuration;

import com.purchasingpower.bookflow.flow.ActionType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps intent-rules.yml: an ordered list of actions with their trigger patterns.
 * The first rule with a matching pattern wins, so order matters.
 */
@Data
@Component
@ConfigurationProperties(prefix = "bookflow.intent")
public class IntentRuleProperties {

    private List<Rule> rules = new ArrayList<>();

    @Data
    public static class Rule {
        private ActionType action;
        private List<String> patterns = new ArrayList<>();
    }
}
