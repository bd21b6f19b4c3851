package com.purchasingpower.bookflow.repository;

import com.purchasingpower.bookflow.model.audit.ExecutionLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Append-only audit trail of processed queries.
 */
@Repository
public interface ExecutionLogRepository extends JpaRepository<ExecutionLog, Long> {

    List<ExecutionLog> findByUserIdOrderByIdDesc(Long userId, Pageable pageable);

    List<ExecutionLog> findAllByOrderByIdDesc(Pageable pageable);
}
