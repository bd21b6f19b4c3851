package com.purchasingpower.bookflow.intent;

import com.purchasingpower.bookflow.client.FailureKind;
import com.purchasingpower.bookflow.client.ProviderResult;
import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import com.purchasingpower.bookflow.configuration.ResolverProperties;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.knowledge.EmbeddingService;
import com.purchasingpower.bookflow.knowledge.VectorMath;
import com.purchasingpower.bookflow.model.catalog.EmbeddingType;
import com.purchasingpower.bookflow.model.catalog.SemanticFunction;
import com.purchasingpower.bookflow.model.catalog.SemanticFunctionEmbedding;
import com.purchasingpower.bookflow.repository.SemanticFunctionEmbeddingRepository;
import com.purchasingpower.bookflow.repository.SemanticFunctionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps a free-form query to one catalog action.
 *
 * <p>Priority chain, first success wins:
 * <ol>
 *   <li>rules from {@code intent-rules.yml} (confidence 1.0)</li>
 *   <li>embedding similarity against the catalog</li>
 *   <li>generative classification, only for near misses</li>
 *   <li>clarification with the best candidates</li>
 * </ol>
 * Provider failures never escape; they only push resolution further down the chain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentResolver {

    private final RuleMatcher ruleMatcher;
    private final SemanticFunctionRepository functionRepository;
    private final SemanticFunctionEmbeddingRepository embeddingRepository;
    private final EmbeddingService embeddingService;
    private final LlmIntentClassifier llmIntentClassifier;
    private final BookFlowProperties properties;

    public IntentMatch resolve(String query) {
        Optional<ActionType> ruleMatch = ruleMatcher.match(query);
        if (ruleMatch.isPresent()) {
            return IntentMatch.rule(ruleMatch.get());
        }

        List<SemanticFunction> functions = functionRepository.findAllByOrderByIdAsc();
        if (functions.isEmpty()) {
            log.warn("⚠️ Semantic catalog is empty, asking for clarification");
            return IntentMatch.clarification(0.0, List.of());
        }

        ProviderResult<List<Double>> queryVector = encode(query);
        if (!queryVector.isSuccess()) {
            log.warn("⚠️ Vector provider failed ({}), skipping embedding tier: {}",
                    queryVector.getFailureKind(), queryVector.getMessage());
            return IntentMatch.clarification(0.0, List.of());
        }

        ResolverProperties thresholds = properties.getResolver();
        Map<Long, List<SemanticFunctionEmbedding>> individual = embeddingRepository.findAll().stream()
                .collect(Collectors.groupingBy(SemanticFunctionEmbedding::getFunctionId));
        boolean hasIndividual = !individual.isEmpty();

        List<ScoredFunction> scored = new ArrayList<>();
        for (SemanticFunction function : functions) {
            double score = score(queryVector.orElse(List.of()), function,
                    individual.getOrDefault(function.getId(), List.of()), thresholds);
            scored.add(new ScoredFunction(function, score));
        }
        // List.sort is stable: equal scores keep catalog order
        scored.sort(Comparator.comparingDouble(ScoredFunction::score).reversed());

        List<ScoredCandidate> candidates = scored.stream()
                .limit(thresholds.getMaxCandidates())
                .map(s -> ScoredCandidate.of(s.function().getName(), s.score()))
                .toList();

        ScoredFunction best = scored.get(0);
        double bestScore = best.score();
        double secondScore = scored.size() > 1 ? scored.get(1).score() : 0.0;
        double baseThreshold = hasIndividual
                ? thresholds.getSimilarityThreshold()
                : thresholds.getCombinedSimilarityThreshold();

        log.info("🔎 Embedding top candidates: {} (individual vectors: {})", candidates, hasIndividual);

        Optional<ActionType> bestAction = ActionType.fromFunctionName(best.function().getName());
        if (bestAction.isEmpty() && bestScore >= baseThreshold) {
            log.warn("⚠️ Catalog function '{}' scored {} but maps to no action, check semantic-catalog.yml",
                    best.function().getName(), bestScore);
        }
        if (bestAction.isPresent() &&bestScore >= thresholds.getHighConfidenceThreshold()) {
            log.info("✅ High confidence: {} ({})", best.function().getName(), bestScore);
            return embeddingMatch(bestAction.get(), bestScore, candidates);
        }

        if (bestAction.isPresent() && bestScore >= baseThreshold) {
            double gap = bestScore - secondScore;
            if (gap < thresholds.getConfidenceGapThreshold()) {
                log.info("⚠️ Low gap, accepting best anyway: {} ({}, gap={})", best.function().getName(), bestScore, gap);
            } else {
                log.info("✅ Embedding accepted: {} ({}, gap={})", best.function().getName(), bestScore, gap);
            }
            return embeddingMatch(bestAction.get(), bestScore, candidates);
        }

        if (bestScore >= thresholds.getGenerativeFallbackFloor()) {
            log.info("🤖 Score {} below threshold {}, trying generative fallback", bestScore, baseThreshold);
            Map<String, String> offered = new LinkedHashMap<>();
            functions.forEach(f -> offered.put(f.getName(), f.getDescription()));

            Optional<ActionType> classified = llmIntentClassifier.classify(query, offered);
            if (classified.isPresent()) {
                return IntentMatch.builder()
                        .action(classified.get())
                        .confidence(bestScore)
                        .method(ResolutionMethod.GENERATIVE_FALLBACK)
                        .candidates(candidates)
                        .build();
            }
        }

        log.info("❓ Could not classify (best={}), asking for clarification", bestScore);
        return IntentMatch.clarification(bestScore, candidates);
    }

    private double score(List<Double> queryVector, SemanticFunction function,
                         List<SemanticFunctionEmbedding> vectors, ResolverProperties weights) {
        if (vectors.isEmpty()) {
            return function.getEmbedding() == null ? 0.0 : VectorMath.cosine(queryVector, function.getEmbedding());
        }
        double description = 0.0;
        double bestExample = 0.0;
        for (SemanticFunctionEmbedding vector : vectors) {
            double similarity = VectorMath.cosine(queryVector, vector.getEmbedding());
            if (vector.getEmbeddingType() == EmbeddingType.DESCRIPTION) {
                description = Math.max(description, similarity);
            } else {
                bestExample = Math.max(bestExample, similarity);
            }
        }
        return weights.getExampleWeight() * bestExample + weights.getDescriptionWeight() * description;
    }

    private ProviderResult<List<Double>> encode(String query) {
        try {
            List<Double> vector = embeddingService.generateTextEmbedding(query);
            if (vector == null || vector.isEmpty()) {
                return ProviderResult.failure(FailureKind.MALFORMED_OUTPUT, "empty query vector");
            }
            return ProviderResult.success(vector);
        } catch (IllegalArgumentException e) {
            return ProviderResult.failure(FailureKind.MALFORMED_OUTPUT, e.getMessage());
        } catch (RuntimeException e) {
            return ProviderResult.failure(FailureKind.UNAVAILABLE, e.getMessage());
        }
    }

    private static IntentMatch embeddingMatch(ActionType action, double score, List<ScoredCandidate> candidates) {
        return IntentMatch.builder()
                .action(action)
                .confidence(score)
                .method(ResolutionMethod.EMBEDDING)
                .candidates(candidates)
                .build();
    }

    private record ScoredFunction(SemanticFunction function, double score) {
    }
}
