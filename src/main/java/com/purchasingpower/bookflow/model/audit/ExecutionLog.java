package com.purchasingpower.bookflow.model.audit;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only audit record, one per processed query (failures included).
 * Candidates and state trace are stored as JSON text.
 */
@Data
@Entity
@Table(name = "execution_logs")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "session_id")
    private Long sessionId;

    @Column(columnDefinition = "TEXT")
    private String query;

    @Column(name = "matched_function", length = 100)
    private String matchedFunction;

    @Column(name = "similarity_score")
    private Double similarityScore;

    @Column(length = 30)
    private String method;

    @Column(name = "top_candidates", columnDefinition = "TEXT")
    private String topCandidates;

    @Column(name = "state_trace", columnDefinition = "TEXT")
    private String stateTrace;

    @Column(columnDefinition = "TEXT")
    private String result;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
