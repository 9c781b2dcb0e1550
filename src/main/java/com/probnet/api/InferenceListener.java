package com.probnet.api;

import java.util.Map;

/**
 * Observability interface for monitoring queries run by the enumeration
 * engine.
 *
 * Implementations can be registered with the EnumerationEngine to receive
 * callbacks around each query. This is the primary mechanism for:
 *
 * - Profiling: measuring how long a query takes and how many table lookups
 * it needed.
 * - Debugging: tracing which queries fail and why.
 *
 * Callbacks run on the querying thread. When queries are issued from several
 * threads the implementation must be thread-safe.
 */
public interface InferenceListener {

    /**
     * Called before the enumeration of a query begins.
     *
     * @param queryVariable The variable whose posterior is requested.
     * @param evidence      The observed values (unmodifiable).
     */
    void onQueryStart(String queryVariable, Map<String, Integer> evidence);

    /**
     * Called after a query produced a normalized posterior.
     *
     * @param queryVariable The variable whose posterior was computed.
     * @param evaluations   Number of probability table lookups performed.
     * @param durationNanos Wall-clock time spent in the query.
     */
    void onQueryEnd(String queryVariable, long evaluations, long durationNanos);

    /**
     * Called when a query fails. The error is rethrown to the caller after all
     * listeners have been notified.
     */
    void onQueryError(String queryVariable, Throwable error);
}
