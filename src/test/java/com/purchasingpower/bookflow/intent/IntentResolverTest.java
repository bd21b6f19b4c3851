package com.purchasingpower.bookflow.intent;

import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.knowledge.EmbeddingException;
import com.purchasingpower.bookflow.knowledge.EmbeddingService;
import com.purchasingpower.bookflow.model.catalog.EmbeddingType;
import com.purchasingpower.bookflow.model.catalog.SemanticFunction;
import com.purchasingpower.bookflow.model.catalog.SemanticFunctionEmbedding;
import com.purchasingpower.bookflow.repository.SemanticFunctionEmbeddingRepository;
import com.purchasingpower.bookflow.repository.SemanticFunctionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IntentResolverTest {

    private static final List<Double> QUERY = List.of(1.0, 0.0);

    private RuleMatcher ruleMatcher;
    private SemanticFunctionRepository functionRepository;
    private SemanticFunctionEmbeddingRepository embeddingRepository;
    private EmbeddingService embeddingService;
    private LlmIntentClassifier classifier;
    private IntentResolver resolver;

    @BeforeEach
    void setUp() {
        ruleMatcher = mock(RuleMatcher.class);
        functionRepository = mock(SemanticFunctionRepository.class);
        embeddingRepository = mock(SemanticFunctionEmbeddingRepository.class);
        embeddingService = mock(EmbeddingService.class);
        classifier = mock(LlmIntentClassifier.class);
        resolver = new IntentResolver(ruleMatcher, functionRepository, embeddingRepository,
                embeddingService, classifier, new BookFlowProperties());

        when(ruleMatcher.match(anyString())).thenReturn(Optional.empty());
        when(embeddingRepository.findAll()).thenReturn(List.of());
    }

    @Test
    void ruleMatch_shouldWinWithoutCallingProviders() {
        // Given
        when(ruleMatcher.match("compra 2 Dune")).thenReturn(Optional.of(ActionType.ADD_BOOK_TO_CART));

        // When
        IntentMatch match = resolver.resolve("compra 2 Dune");

        // Then
        assertThat(match.getAction()).isEqualTo(ActionType.ADD_BOOK_TO_CART);
        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.RULE);
        assertThat(match.getConfidence()).isEqualTo(1.0);
        verifyNoInteractions(embeddingService, classifier, functionRepository);
    }

    @Test
    void highestCombinedScore_shouldBeSelected() {
        // Given
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "check_book_stock", List.of(0.0, 1.0)),
                function(2L, "search_books_for_sale", List.of(1.0, 0.0))));
        when(embeddingService.generateTextEmbedding("novelas de misterio")).thenReturn(QUERY);

        // When
        IntentMatch match = resolver.resolve("novelas de misterio");

        // Then
        assertThat(match.getAction()).isEqualTo(ActionType.SEARCH_BOOKS_FOR_SALE);
        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.EMBEDDING);
        assertThat(match.getConfidence()).isCloseTo(1.0, within(1e-9));
        assertThat(match.getCandidates()).extracting(ScoredCandidate::getName)
                .containsExactly("search_books_for_sale", "check_book_stock");
    }

    @Test
    void equalScores_shouldKeepCatalogOrder() {
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "recommend_books_for_purchase", List.of(1.0, 0.0)),
                function(2L, "search_books_for_sale", List.of(1.0, 0.0))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);

        IntentMatch match = resolver.resolve("algo de fantasía");

        assertThat(match.getAction()).isEqualTo(ActionType.RECOMMEND_BOOKS_FOR_PURCHASE);
    }

    @Test
    void individualVectors_shouldBlendBestExampleAndDescription() {
        // Given: example matches perfectly, description is orthogonal
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "get_order_status", null)));
        when(embeddingRepository.findAll()).thenReturn(List.of(
                vector(1L, EmbeddingType.DESCRIPTION, List.of(0.0, 1.0)),
                vector(1L, EmbeddingType.EXAMPLE, List.of(1.0, 0.0))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);

        // When
        IntentMatch match = resolver.resolve("dónde está lo que compré");

        // Then: 0.6 * 1.0 + 0.4 * 0.0 clears the 0.45 threshold
        assertThat(match.getAction()).isEqualTo(ActionType.GET_ORDER_STATUS);
        assertThat(match.getConfidence()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void lowGapAboveThreshold_shouldStillAcceptBest() {
        // Given: 0.50 vs 0.48 clears 0.45 but the gap is under 0.05
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "search_books_for_sale", null),
                function(2L, "recommend_books_for_purchase", null)));
        when(embeddingRepository.findAll()).thenReturn(List.of(
                vector(1L, EmbeddingType.DESCRIPTION, unit(0.50)),
                vector(1L, EmbeddingType.EXAMPLE, unit(0.50)),
                vector(2L, EmbeddingType.DESCRIPTION, unit(0.48)),
                vector(2L, EmbeddingType.EXAMPLE, unit(0.48))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);

        // When
        IntentMatch match = resolver.resolve("libros de aventuras");

        // Then
        assertThat(match.getAction()).isEqualTo(ActionType.SEARCH_BOOKS_FOR_SALE);
        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.EMBEDDING);
        assertThat(match.getConfidence()).isCloseTo(0.50, within(1e-9));
        assertThat(match.getCandidates()).extracting(ScoredCandidate::getName)
                .containsExactly("search_books_for_sale", "recommend_books_for_purchase");
        verifyNoInteractions(classifier);
    }

    @Test
    void combinedOnlyCatalog_shouldUseLowerThreshold() {
        // Given: no per-example vectors, so 0.35 is measured against 0.30
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "get_order_status", unit(0.35)),
                function(2L, "cancel_order", List.of(0.0, 1.0))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);

        // When
        IntentMatch match = resolver.resolve("cómo va mi pedido");

        // Then
        assertThat(match.getAction()).isEqualTo(ActionType.GET_ORDER_STATUS);
        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.EMBEDDING);
        assertThat(match.getConfidence()).isCloseTo(0.35, within(1e-9));
        verifyNoInteractions(classifier);
    }

    @Test
    void combinedScoreWithIndividualVectorsPresent_shouldNotClearBaseThreshold() {
        // Given: another function has per-example vectors, so the threshold is 0.45
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "get_order_status", unit(0.35)),
                function(2L, "cancel_order", null)));
        when(embeddingRepository.findAll()).thenReturn(List.of(
                vector(2L, EmbeddingType.DESCRIPTION, List.of(0.0, 1.0)),
                vector(2L, EmbeddingType.EXAMPLE, List.of(0.0, 1.0))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);
        when(classifier.classify(anyString(), anyMap())).thenReturn(Optional.empty());

        // When
        IntentMatch match = resolver.resolve("cómo va mi pedido");

        // Then
        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.CLARIFICATION);
        assertThat(match.getConfidence()).isCloseTo(0.35, within(1e-9));
        verify(classifier).classify(anyString(), anyMap());
    }

    @Test
    void unmappedFunctionName_shouldFallThroughToClassifier() {
        // Given: perfect score on a catalog entry with no matching action
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "sell_ebook", List.of(1.0, 0.0))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);
        when(classifier.classify(anyString(), anyMap())).thenReturn(Optional.of(ActionType.SEARCH_BOOKS_FOR_SALE));

        // When
        IntentMatch match = resolver.resolve("quiero un ebook");

        // Then
        assertThat(match.getAction()).isEqualTo(ActionType.SEARCH_BOOKS_FOR_SALE);
        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.GENERATIVE_FALLBACK);
    }

    @Test
    void nearMiss_shouldAskGenerativeClassifier() {
        // Given: cosine 0.28 sits between the fallback floor and the combined threshold
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "check_book_stock", List.of(0.28, 0.96)),
                function(2L, "cancel_order", List.of(0.0, 1.0))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);
        when(classifier.classify(anyString(), anyMap())).thenReturn(Optional.of(ActionType.CHECK_BOOK_STOCK));

        // When
        IntentMatch match = resolver.resolve("¿les queda alguno?");

        // Then
        assertThat(match.getAction()).isEqualTo(ActionType.CHECK_BOOK_STOCK);
        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.GENERATIVE_FALLBACK);
        assertThat(match.getConfidence()).isCloseTo(0.28, within(1e-9));
    }

    @Test
    void nearMissRejectedByClassifier_shouldAskForClarification() {
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "check_book_stock", List.of(0.28, 0.96))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);
        when(classifier.classify(anyString(), anyMap())).thenReturn(Optional.empty());

        IntentMatch match = resolver.resolve("¿qué hora es?");

        assertThat(match.isResolved()).isFalse();
        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.CLARIFICATION);
        assertThat(match.getCandidates()).hasSize(1);
    }

    @Test
    void scoreBelowFloor_shouldSkipClassifier() {
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "check_book_stock", List.of(0.1, 0.995))));
        when(embeddingService.generateTextEmbedding(anyString())).thenReturn(QUERY);

        IntentMatch match = resolver.resolve("partido de fútbol de ayer");

        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.CLARIFICATION);
        verify(classifier, never()).classify(anyString(), any());
    }

    @Test
    void vectorProviderFailure_shouldDegradeToClarification() {
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                function(1L, "check_book_stock", List.of(1.0, 0.0))));
        when(embeddingService.generateTextEmbedding(anyString()))
                .thenThrow(new EmbeddingException("connection refused", new RuntimeException()));

        IntentMatch match = resolver.resolve("algo para leer");

        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.CLARIFICATION);
        assertThat(match.getConfidence()).isZero();
        verifyNoInteractions(classifier);
    }

    @Test
    void emptyCatalog_shouldAskForClarification() {
        when(functionRepository.findAllByOrderByIdAsc()).thenReturn(List.of());

        IntentMatch match = resolver.resolve("algo para leer");

        assertThat(match.getMethod()).isEqualTo(ResolutionMethod.CLARIFICATION);
        verifyNoInteractions(embeddingService);
    }

    private static SemanticFunction function(Long id, String name, List<Double> embedding) {
        return SemanticFunction.builder()
                .id(id)
                .name(name)
                .description(name)
                .embedding(embedding)
                .build();
    }

    /** Unit vector whose cosine with {@link #QUERY} is {@code x}. */
    private static List<Double> unit(double x) {
        return List.of(x, Math.sqrt(1 - x * x));
    }

    private static SemanticFunctionEmbedding vector(Long functionId, EmbeddingType type, List<Double> embedding) {
        return SemanticFunctionEmbedding.builder()
                .functionId(functionId)
                .embeddingType(type)
                .text("text")
                .embedding(embedding)
                .build();
    }
}
