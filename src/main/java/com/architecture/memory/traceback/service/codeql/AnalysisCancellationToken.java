package com.architecture.memory.traceback.service.codeql;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked by the analysis pipeline between phases.
 * A phase that is already running is allowed to finish.
 */
public class AnalysisCancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static AnalysisCancellationToken none() {
        return new AnalysisCancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
