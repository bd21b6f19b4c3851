package com.purchasingpower.bookflow.flow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One programmatic transaction per flow run: opened by APPLY_ACTION, committed by
 * PERSIST, rolled back when applying fails.
 *
 * <p>Transactions are keyed by the run id because {@link TransactionStatus} cannot
 * live in the serializable flow state. Graph nodes run on the thread that invoked
 * the graph, which is the thread the transaction is bound to.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowTransactions {

    private final PlatformTransactionManager transactionManager;
    private final Map<String, TransactionStatus> open = new ConcurrentHashMap<>();

    public void begin(String runId) {
        DefaultTransactionDefinition definition =
                new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        definition.setName("flow-" + runId);
        TransactionStatus previous = open.put(runId, transactionManager.getTransaction(definition));
        if (previous != null) {
            throw new IllegalStateException("Transaction already open for flow run " + runId);
        }
    }

    /**
     * @throws IllegalStateException if no transaction is open for the run
     */
    public void commit(String runId) {
        TransactionStatus status = open.remove(runId);
        if (status == null) {
            throw new IllegalStateException("No open transaction for flow run " + runId);
        }
        transactionManager.commit(status);
    }

    public void rollback(String runId) {
        TransactionStatus status = open.remove(runId);
        if (status != null && !status.isCompleted()) {
            transactionManager.rollback(status);
            log.info("↩️ Rolled back flow run {}", runId);
        }
    }

    /**
     * Roll back whatever is still open for the run. Called once the graph has finished.
     */
    public void release(String runId) {
        if (open.containsKey(runId)) {
            log.warn("⚠️ Flow run {} ended with an open transaction, rolling back", runId);
            rollback(runId);
        }
    }

    boolean isOpen(String runId) {
        return open.containsKey(runId);
    }
}
