package com.purchasingpower.bookflow.api;

import com.purchasingpower.bookflow.model.audit.ExecutionLog;
import com.purchasingpower.bookflow.service.AuditLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read access to the audit trail.
 *
 * GET /api/v1/logs?userId=&limit=20
 */
@RestController
@RequestMapping("/api/v1/logs")
@RequiredArgsConstructor
public class LogController {

    private final AuditLogService auditLogService;

    @GetMapping
    public ResponseEntity<List<ExecutionLog>> recent(
            @RequestParam(required = false) Long userId,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(auditLogService.recent(userId, limit));
    }
}
