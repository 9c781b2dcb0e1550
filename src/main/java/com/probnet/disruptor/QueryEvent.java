package com.probnet.disruptor;

import com.probnet.engine.Posterior;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A mutable query slot inside the ring buffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> instances are pre-allocated during RingBuffer
 * construction and reused for every query that passes through the slot. The
 * consumer clears the slot once the query has been answered so that the
 * evidence map and future can be collected.
 */
public final class QueryEvent {
    private String variableName;
    private Map<String, Integer> evidence;
    private CompletableFuture<Posterior> result;
    private long sequenceId;

    /**
     * Configures the slot for a query.
     *
     * @param variableName Query variable.
     * @param evidence     Observed values, already copied by the publisher.
     * @param result       Future completed by the consumer thread.
     * @param seqId        The sequence ID (for correlation/logging).
     */
    public void set(String variableName, Map<String, Integer> evidence, CompletableFuture<Posterior> result,
            long seqId) {
        this.variableName = variableName;
        this.evidence = evidence;
        this.result = result;
        this.sequenceId = seqId;
    }

    public String variableName() {
        return variableName;
    }

    public Map<String, Integer> evidence() {
        return evidence;
    }

    public CompletableFuture<Posterior> result() {
        return result;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        variableName = null;
        evidence = null;
        result = null;
        sequenceId = 0;
    }
}
