package com.purchasingpower.bookflow.repository;

import com.purchasingpower.bookflow.model.catalog.SemanticFunctionEmbedding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SemanticFunctionEmbeddingRepository extends JpaRepository<SemanticFunctionEmbedding, Long> {

    List<SemanticFunctionEmbedding> findByFunctionIdOrderByIdAsc(Long functionId);

    void deleteByFunctionId(Long functionId);
}
