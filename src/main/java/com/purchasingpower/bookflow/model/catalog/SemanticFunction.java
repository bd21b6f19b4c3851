package com.purchasingpower.bookflow.model.catalog;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog definition of one store action, with the combined vector of its
 * description and example phrases. Individual vectors live in
 * {@link SemanticFunctionEmbedding}.
 */
@Data
@Entity
@Table(name = "semantic_functions")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticFunction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(nullable = false, length = 2000)
    private String description;

    @Convert(converter = StringListJsonConverter.class)
    @Column(length = 10000)
    @Builder.Default
    private List<String> examples = new ArrayList<>();

    @Convert(converter = VectorJsonConverter.class)
    @Column(name = "embedding", length = 20000)
    private List<Double> embedding;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
