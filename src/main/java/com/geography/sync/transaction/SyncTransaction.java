package com.geography.sync.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction spanning registry, tenant and ledger writes.
 * Each step registers an undo action; undo actions run newest-first when a
 * step fails or when the transaction closes without {@link #markSuccess()}.
 *
 * <pre>
 * try (SyncTransaction tx = new SyncTransaction("ingest")) {
 *     tx.execute("save canonical", () -> repo.save(unit), () -> repo.restore(snapshot));
 *     tx.executeNoCompensation("append ledger", () -> ledger.append(entry));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class SyncTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncTransaction.class);

    private final String name;
    private final Deque<Step> undo = new ArrayDeque<>();
    private boolean success;
    private boolean closed;

    public SyncTransaction(String name) {
        this.name = name;
    }

    /**
     * Runs a step and records how to reverse it. If the step throws, the
     * already recorded steps are reversed and the exception propagates.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        run(description, operation);
        undo.push(new Step(description, compensation));
    }

    /**
     * Runs a step that has nothing to reverse, typically the final ledger append.
     */
    public void executeNoCompensation(String description, Runnable operation) {
        run(description, operation);
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Number of steps that would be reversed on failure.
     */
    public int pendingCompensations() {
        return undo.size();
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("tx.rollback name={} steps={}", name, undo.size());
            compensate();
        }
        closed = true;
    }

    private void run(String description, Runnable operation) {
        if (closed) {
            throw new IllegalStateException("Transaction '" + name + "' is already closed");
        }
        try {
            log.debug("tx.step name={} step='{}'", name, description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("tx.step.failed name={} step='{}' error={}", name, description, e.getMessage());
            compensate();
            throw e;
        }
    }

    private void compensate() {
        while (!undo.isEmpty()) {
            Step step = undo.pop();
            try {
                step.compensation.run();
                log.debug("tx.compensated name={} step='{}'", name, step.description);
            } catch (RuntimeException e) {
                // keep unwinding; the remaining steps are independent
                log.error("tx.compensation.failed name={} step='{}' error={}", name, step.description, e.getMessage());
            }
        }
    }

    private record Step(String description, Runnable compensation) {}
}
