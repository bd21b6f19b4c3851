package com.purchasingpower.bookflow.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.bookflow.model.audit.ExecutionLog;
import com.purchasingpower.bookflow.orchestrator.OrchestratorResult;
import com.purchasingpower.bookflow.repository.ExecutionLogRepository;
import com.purchasingpower.bookflow.service.AuditLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogServiceImpl implements AuditLogService {

    static final int MAX_LIMIT = 200;

    private final ExecutionLogRepository executionLogRepository;
    private final ObjectMapper objectMapper;
    private final PlatformTransactionManager transactionManager;

    @Override
    public void record(Long userId, Long sessionId, String query, OrchestratorResult result) {
        try {
            ExecutionLog entry = ExecutionLog.builder()
                    .userId(userId)
                    .sessionId(sessionId)
                    .query(query)
                    .matchedFunction(result.getFunctionName())
                    .similarityScore(result.getSimilarity())
                    .method(result.getMethod() != null ? result.getMethod().label() : null)
                    .topCandidates(toJson(result.getCandidates()))
                    .stateTrace(result.getStateTrace().isEmpty() ? null : toJson(result.getStateTrace()))
                    .result(result.getResponse())
                    .build();

            TransactionTemplate template = new TransactionTemplate(transactionManager);
            template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
            template.executeWithoutResult(status -> executionLogRepository.save(entry));
        } catch (RuntimeException | JsonProcessingException e) {
            log.error("🔴 Failed to store execution log for user {}: {}", userId, e.getMessage());
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExecutionLog> recent(Long userId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));
        return userId != null
                ? executionLogRepository.findByUserIdOrderByIdDesc(userId, page)
                : executionLogRepository.findAllByOrderByIdDesc(page);
    }

    private String toJson(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }
}
