package com.probnet.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.probnet.engine.EnumerationEngine;
import com.probnet.engine.Posterior;
import com.probnet.util.ErrorRateLimiter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serializes inference queries from any number of threads through an LMAX
 * Disruptor ring buffer onto a single consumer thread.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>A producer calls {@link #submit(String, Map)}; the query is written
 * into a pre-allocated {@link QueryEvent} slot.</li>
 * <li>The Disruptor sequences the slots.</li>
 * <li>The consumer runs {@link EnumerationEngine#query(String, Map)} and
 * completes the returned future, exceptionally when inference fails.</li>
 * </ol>
 *
 * Queries are answered in ring-buffer sequence order. Producers publish under
 * a shared lock and {@link #close()} takes it exclusively, so every future
 * handed out by {@link #submit(String, Map)} is answered. The engine itself is
 * safe for concurrent use; the publisher exists to bound the number of
 * in-flight queries and keep the enumeration off the callers' threads.
 */
public final class QueryPublisher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(QueryPublisher.class);
    private static final int DEFAULT_BUFFER_SIZE = 1024;

    private final EnumerationEngine engine;
    private final Disruptor<QueryEvent> disruptor;
    private final RingBuffer<QueryEvent> ringBuffer;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile boolean closed;
    private long answered;

    public QueryPublisher(EnumerationEngine engine) {
        this(engine, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize ring buffer capacity, must be a power of two.
     */
    public QueryPublisher(EnumerationEngine engine, int bufferSize) {
        if (Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of 2, got " + bufferSize);
        this.engine = engine;
        this.disruptor = new Disruptor<>(
                QueryEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new QueryEventHandler());
        this.ringBuffer = disruptor.start();
        log.info("Query publisher started (buffer size {})", bufferSize);
    }

    /**
     * Enqueues a query. Blocks while the ring buffer is full. Evidence values
     * are validated by the engine, so a null value fails the future with
     * {@link com.probnet.api.InvalidStateException}.
     *
     * @return a future completed with the posterior, or exceptionally with the
     *         inference error.
     * @throws IllegalStateException if the publisher has been closed.
     */
    public CompletableFuture<Posterior> submit(String variableName, Map<String, Integer> evidence) {
        CompletableFuture<Posterior> future = new CompletableFuture<>();
        Map<String, Integer> copy = Collections.unmodifiableMap(new HashMap<>(evidence));
        lifecycle.readLock().lock();
        try {
            if (closed)
                throw new IllegalStateException("QueryPublisher is closed");
            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).set(variableName, copy, future, sequence);
            } finally {
                ringBuffer.publish(sequence);
            }
        } finally {
            lifecycle.readLock().unlock();
        }
        return future;
    }

    public CompletableFuture<Posterior> submit(String variableName) {
        return submit(variableName, Map.of());
    }

    /** Number of queries answered so far, successfully or not. */
    public synchronized long answered() {
        return answered;
    }

    /**
     * Stops accepting queries, waits for the queued ones to be answered and
     * stops the consumer thread.
     */
    @Override
    public void close() {
        lifecycle.writeLock().lock();
        try {
            if (closed)
                return;
            closed = true;
        } finally {
            lifecycle.writeLock().unlock();
        }
        // no producer is past the closed check any more
        disruptor.shutdown();
        log.info("Query publisher stopped after {} queries", answered());
    }

    private final class QueryEventHandler implements EventHandler<QueryEvent> {
        @Override
        public void onEvent(QueryEvent event, long sequence, boolean endOfBatch) {
            CompletableFuture<Posterior> future = event.result();
            try {
                future.complete(engine.query(event.variableName(), event.evidence()));
            } catch (RuntimeException e) {
                errLimiter.log("Query #" + event.sequenceId() + " for '" + event.variableName() + "' failed", e);
                future.completeExceptionally(e);
            } finally {
                event.clear();
                synchronized (QueryPublisher.this) {
                    answered++;
                }
            }
        }
    }
}
