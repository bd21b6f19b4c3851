package com.purchasingpower.bookflow.model.catalog;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One description or example vector of a {@link SemanticFunction}.
 */
@Data
@Entity
@Table(name = "semantic_function_embeddings")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticFunctionEmbedding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "function_id", nullable = false)
    private Long functionId;

    @Column(nullable = false, length = 2000)
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(name = "embedding_type", nullable = false, length = 20)
    private EmbeddingType embeddingType;

    @Convert(converter = VectorJsonConverter.class)
    @Column(name = "embedding", length = 20000)
    private List<Double> embedding;
}
