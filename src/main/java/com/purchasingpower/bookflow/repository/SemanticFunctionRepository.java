package com.purchasingpower.bookflow.repository;

import com.purchasingpower.bookflow.model.catalog.SemanticFunction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the semantic action catalog.
 */
@Repository
public interface SemanticFunctionRepository extends JpaRepository<SemanticFunction, Long> {

    Optional<SemanticFunction> findByName(String name);

    /**
     * Catalog in insertion order; the embedding tier breaks score ties by this order.
     */
    List<SemanticFunction> findAllByOrderByIdAsc();
}
