package com.purchasingpower.bookflow.service;

import com.purchasingpower.bookflow.model.audit.ExecutionLog;
import com.purchasingpower.bookflow.orchestrator.OrchestratorResult;

import java.util.List;

/**
 * Audit trail of processed queries.
 */
public interface AuditLogService {

    /**
     * Store one record for a processed query. Storage failures are logged and
     * swallowed; they never reach the caller.
     */
    void record(Long userId, Long sessionId, String query, OrchestratorResult result);

    /**
     * Newest records first, optionally restricted to one user.
     */
    List<ExecutionLog> recent(Long userId, int limit);
}
