package com.purchasingpower.bookflow.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps semantic-catalog.yml: the action definitions that get embedded for
 * similarity matching.
 */
@Data
@Component
@ConfigurationProperties(prefix = "bookflow.catalog")
public class SemanticCatalogProperties {

    /** Encode definitions that have no vectors yet when the application starts. */
    private boolean indexOnStartup = true;

    private List<Definition> functions = new ArrayList<>();

    @Data
    public static class Definition {
        private String name;
        private String description;
        private List<String> examples = new ArrayList<>();
    }
}
