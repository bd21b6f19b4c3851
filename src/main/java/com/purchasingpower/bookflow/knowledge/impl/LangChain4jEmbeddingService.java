package com.purchasingpower.bookflow.knowledge.impl;

import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import com.purchasingpower.bookflow.configuration.OllamaProperties;
import com.purchasingpower.bookflow.knowledge.EmbeddingException;
import com.purchasingpower.bookflow.knowledge.EmbeddingService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Embedding service backed by LangChain4j's Ollama model, which brings its own
 * timeout and retry handling.
 */
@Slf4j
@Service
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    @Autowired
    public LangChain4jEmbeddingService(BookFlowProperties properties) {
        OllamaProperties ollama = properties.getOllama();

        log.info("🔷 Initializing LangChain4j Embedding Service");
        log.info("   - Ollama URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getEmbeddingModel());

        this.embeddingModel = OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getEmbeddingModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    LangChain4jEmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public List<Double> generateTextEmbedding(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }

        log.debug("🔷 Generating embedding for text (length: {})", text.length());
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            List<Double> embedding = convertToDoubleList(response.content());
            log.debug("✅ Generated embedding ({} dimensions)", embedding.size());
            return embedding;
        } catch (Exception e) {
            log.error("❌ Failed to generate text embedding after retries: {}", e.getMessage());
            throw new EmbeddingException("Text embedding generation failed", e);
        }
    }

    @Override
    public List<List<Double>> generateEmbeddingsBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        log.info("🔷 Generating {} embeddings in batch", texts.size());

        List<TextSegment> segments = texts.stream()
                .map(TextSegment::from)
                .toList();
        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            return response.content().stream()
                    .map(this::convertToDoubleList)
                    .toList();
        } catch (Exception e) {
            log.error("❌ Batch embedding generation failed after retries: {}", e.getMessage());
            throw new EmbeddingException("Batch embedding generation failed", e);
        }
    }

    private List<Double> convertToDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add((double) value);
        }
        return result;
    }
}
