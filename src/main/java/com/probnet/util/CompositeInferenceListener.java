package com.probnet.util;

import com.probnet.api.InferenceListener;
import java.util.Arrays;
import java.util.Map;

/**
 * Fans callbacks out to several {@link InferenceListener} instances.
 * Listeners are notified in registration order.
 */
public class CompositeInferenceListener implements InferenceListener {
    private volatile InferenceListener[] listeners = new InferenceListener[0];

    public synchronized CompositeInferenceListener add(InferenceListener listener) {
        InferenceListener[] old = listeners;
        InferenceListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onQueryStart(String queryVariable, Map<String, Integer> evidence) {
        for (InferenceListener l : listeners)
            l.onQueryStart(queryVariable, evidence);
    }

    @Override
    public void onQueryEnd(String queryVariable, long evaluations, long durationNanos) {
        for (InferenceListener l : listeners)
            l.onQueryEnd(queryVariable, evaluations, durationNanos);
    }

    @Override
    public void onQueryError(String queryVariable, Throwable error) {
        for (InferenceListener l : listeners)
            l.onQueryError(queryVariable, error);
    }
}
