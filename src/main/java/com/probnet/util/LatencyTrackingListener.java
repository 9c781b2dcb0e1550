package com.probnet.util;

import com.probnet.api.InferenceListener;

import java.util.Map;

/**
 * A listener that tracks performance metrics for inference queries.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per query (in nanoseconds).</li>
 * <li><b>Throughput:</b> Total number of completed and failed queries.</li>
 * <li><b>Workload:</b> Table lookups performed by the last query.</li>
 * </ul>
 *
 * <p>
 * Failures are logged through an {@link ErrorRateLimiter}. Updates are
 * synchronized, so one instance may observe an engine queried from several
 * threads.
 */
public final class LatencyTrackingListener implements InferenceListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(LatencyTrackingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000); // 1-second throttle
    private long lastLatencyNanos, lastEvaluations;
    private long totalQueries, totalErrors, totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;

    @Override
    public void onQueryStart(String queryVariable, Map<String, Integer> evidence) {
        // Timing comes from the engine
    }

    @Override
    public synchronized void onQueryEnd(String queryVariable, long evaluations, long durationNanos) {
        lastLatencyNanos = durationNanos;
        lastEvaluations = evaluations;
        totalQueries++;
        totalLatencyNanos += durationNanos;
        if (durationNanos < minLatencyNanos)
            minLatencyNanos = durationNanos;
        if (durationNanos > maxLatencyNanos)
            maxLatencyNanos = durationNanos;
    }

    @Override
    public synchronized void onQueryError(String queryVariable, Throwable error) {
        totalErrors++;
        errLimiter.log(String.format("Query for '%s' failed: %s", queryVariable, error.getMessage()), error);
    }

    public synchronized long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public synchronized long lastEvaluations() {
        return lastEvaluations;
    }

    public synchronized long totalQueries() {
        return totalQueries;
    }

    public synchronized long totalErrors() {
        return totalErrors;
    }

    public synchronized double avgLatencyNanos() {
        return totalQueries > 0 ? (double) totalLatencyNanos / totalQueries : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public synchronized long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public synchronized long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public synchronized void reset() {
        lastLatencyNanos = 0;
        lastEvaluations = 0;
        totalQueries = 0;
        totalErrors = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-15s | %10s | %10s | %10s | %10s | %10s\n", "Metric", "Queries", "Errors",
                "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("------------------------------------------------------------------------------\n");
        sb.append(String.format("%-15s | %10d | %10d | %10.2f | %10.2f | %10.2f\n",
                "Inference",
                totalQueries(),
                totalErrors(),
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        return sb.toString();
    }
}
