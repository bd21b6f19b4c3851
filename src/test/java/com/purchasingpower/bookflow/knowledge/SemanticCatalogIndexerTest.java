package com.purchasingpower.bookflow.knowledge;

import com.purchasingpower.bookflow.configuration.SemanticCatalogProperties;
import com.purchasingpower.bookflow.model.catalog.EmbeddingType;
import com.purchasingpower.bookflow.model.catalog.SemanticFunction;
import com.purchasingpower.bookflow.model.catalog.SemanticFunctionEmbedding;
import com.purchasingpower.bookflow.repository.SemanticFunctionEmbeddingRepository;
import com.purchasingpower.bookflow.repository.SemanticFunctionRepository;
import com.purchasingpower.bookflow.service.GenerativeTextService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class SemanticCatalogIndexerTest {

    @MockBean
    private EmbeddingService embeddingService;

    @MockBean
    private GenerativeTextService generativeTextService;

    @Autowired
    private SemanticCatalogIndexer indexer;

    @Autowired
    private SemanticCatalogProperties catalogProperties;

    @Autowired
    private SemanticFunctionRepository functionRepository;

    @Autowired
    private SemanticFunctionEmbeddingRepository embeddingRepository;

    @AfterEach
    void tearDown() {
        // other tests expect an empty catalog
        embeddingRepository.deleteAll();
        functionRepository.deleteAll();
    }

    private void vectorsAvailable() {
        doReturn(List.of(1.0, 0.0)).when(embeddingService).generateTextEmbedding(anyString());
        doAnswer(invocation -> ((List<?>) invocation.getArgument(0)).stream().map(text -> List.of(0.0, 1.0)).toList())
                .when(embeddingService).generateEmbeddingsBatch(anyList());
    }

    @Test
    void indexCatalog_shouldStoreCombinedAndIndividualVectors() {
        // Given
        vectorsAvailable();
        int actions = catalogProperties.getFunctions().size();

        // When
        int indexed = indexer.indexCatalog();

        // Then
        assertThat(indexed).isEqualTo(actions);
        assertThat(functionRepository.findAllByOrderByIdAsc())
                .extracting(SemanticFunction::getName)
                .startsWith("search_books_for_sale");

        SemanticFunction search = functionRepository.findByName("search_books_for_sale").orElseThrow();
        assertThat(search.getEmbedding()).containsExactly(1.0, 0.0);
        List<SemanticFunctionEmbedding> vectors = embeddingRepository.findByFunctionIdOrderByIdAsc(search.getId());
        assertThat(vectors).hasSize(1 + search.getExamples().size());
        assertThat(vectors.get(0).getEmbeddingType()).isEqualTo(EmbeddingType.DESCRIPTION);
        assertThat(vectors.get(1).getEmbeddingType()).isEqualTo(EmbeddingType.EXAMPLE);
    }

    @Test
    void secondRun_shouldSkipIndexedActions() {
        vectorsAvailable();
        indexer.indexCatalog();

        assertThat(indexer.indexCatalog()).isZero();
    }

    @Test
    void providerFailure_shouldKeepDefinitionsForNextRun() {
        // Given
        when(embeddingService.generateTextEmbedding(anyString())).thenThrow(new EmbeddingException("offline", null));

        // When
        int indexed = indexer.indexCatalog();

        // Then
        assertThat(indexed).isZero();
        assertThat(functionRepository.count()).isEqualTo(catalogProperties.getFunctions().size());
        assertThat(functionRepository.findAll()).allMatch(f -> f.getEmbedding() == null);
        assertThat(embeddingRepository.count()).isZero();

        vectorsAvailable();
        assertThat(indexer.indexCatalog()).isEqualTo(catalogProperties.getFunctions().size());
    }
}
