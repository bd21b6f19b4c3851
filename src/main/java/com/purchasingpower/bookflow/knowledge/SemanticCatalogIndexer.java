package com.purchasingpower.bookflow.knowledge;

import com.purchasingpower.bookflow.configuration.SemanticCatalogProperties;
import com.purchasingpower.bookflow.configuration.SemanticCatalogProperties.Definition;
import com.purchasingpower.bookflow.model.catalog.EmbeddingType;
import com.purchasingpower.bookflow.model.catalog.SemanticFunction;
import com.purchasingpower.bookflow.model.catalog.SemanticFunctionEmbedding;
import com.purchasingpower.bookflow.repository.SemanticFunctionEmbeddingRepository;
import com.purchasingpower.bookflow.repository.SemanticFunctionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads the action catalog from {@code semantic-catalog.yml} into the database and
 * computes its vectors: one combined vector per action (description plus all
 * examples) and one vector per description and per example.
 *
 * <p>Actions that already have vectors are left alone. When the vector provider
 * is down the definitions are stored without vectors and intent resolution
 * relies on rules and clarification until the next run.
 */
@Slf4j
@Component
public class SemanticCatalogIndexer {

    private final SemanticCatalogProperties catalogProperties;
    private final SemanticFunctionRepository functionRepository;
    private final SemanticFunctionEmbeddingRepository embeddingRepository;
    private final EmbeddingService embeddingService;
    private final TransactionTemplate transactionTemplate;

    public SemanticCatalogIndexer(SemanticCatalogProperties catalogProperties,
                                  SemanticFunctionRepository functionRepository,
                                  SemanticFunctionEmbeddingRepository embeddingRepository,
                                  EmbeddingService embeddingService,
                                  PlatformTransactionManager transactionManager) {
        this.catalogProperties = catalogProperties;
        this.functionRepository = functionRepository;
        this.embeddingRepository = embeddingRepository;
        this.embeddingService = embeddingService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!catalogProperties.isIndexOnStartup()) {
            log.info("📚 Catalog indexing on startup disabled");
            return;
        }
        indexCatalog();
    }

    /**
     * Index every catalog definition that has no vectors yet.
     *
     * @return number of actions whose vectors were computed in this run
     */
    public int indexCatalog() {
        List<Definition> definitions = catalogProperties.getFunctions();
        log.info("📚 Indexing semantic catalog: {} actions", definitions.size());

        int indexed = 0;
        for (Definition definition : definitions) {
            if (isIndexed(definition.getName())) {
                log.debug("Action {} already indexed, skipping", definition.getName());
                continue;
            }
            if (indexDefinition(definition)) {
                indexed++;
            }
        }

        log.info("✅ Semantic catalog ready: {} actions indexed in this run", indexed);
        return indexed;
    }

    private boolean isIndexed(String name) {
        Optional<SemanticFunction> existing = functionRepository.findByName(name);
        return existing.isPresent()
                && existing.get().getEmbedding() != null
                && !embeddingRepository.findByFunctionIdOrderByIdAsc(existing.get().getId()).isEmpty();
    }

    private boolean indexDefinition(Definition definition) {
        List<String> individualTexts = new ArrayList<>();
        individualTexts.add(definition.getDescription());
        individualTexts.addAll(definition.getExamples());

        List<Double> combined = null;
        List<List<Double>> individual = List.of();
        try {
            combined = embeddingService.generateTextEmbedding(combinedText(definition));
            individual = embeddingService.generateEmbeddingsBatch(individualTexts);
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not compute vectors for action {}: {}", definition.getName(), e.getMessage());
            combined = null;
        }

        List<Double> combinedVector = combined;
        List<List<Double>> individualVectors = individual;
        transactionTemplate.executeWithoutResult(status -> store(definition, individualTexts,
                combinedVector, individualVectors));
        return combinedVector != null;
    }

    private void store(Definition definition, List<String> individualTexts,
                       List<Double> combined, List<List<Double>> individual) {
        SemanticFunction function = functionRepository.findByName(definition.getName())
                .orElseGet(() -> SemanticFunction.builder().name(definition.getName()).build());
        function.setDescription(definition.getDescription());
        function.setExamples(new ArrayList<>(definition.getExamples()));
        function.setEmbedding(combined);
        SemanticFunction saved = functionRepository.save(function);

        if (combined == null || individual.size() != individualTexts.size()) {
            return;
        }

        embeddingRepository.deleteByFunctionId(saved.getId());
        List<SemanticFunctionEmbedding> rows = new ArrayList<>();
        for (int i = 0; i < individualTexts.size(); i++) {
            rows.add(SemanticFunctionEmbedding.builder()
                    .functionId(saved.getId())
                    .text(individualTexts.get(i))
                    .embeddingType(i == 0 ? EmbeddingType.DESCRIPTION : EmbeddingType.EXAMPLE)
                    .embedding(individual.get(i))
                    .build());
        }
        embeddingRepository.saveAll(rows);
        log.info("🔷 Indexed action {} ({} vectors)", saved.getName(), rows.size() + 1);
    }

    private static String combinedText(Definition definition) {
        return definition.getDescription() + " " + String.join(" ", definition.getExamples());
    }
}
