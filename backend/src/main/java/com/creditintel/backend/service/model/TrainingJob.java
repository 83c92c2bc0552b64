package com.creditintel.backend.service.model;

import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.util.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Handle for a background training run. Cancelling before the candidate is registered discards it;
 * once registered, the cancel is refused and the job completes normally. The active model is never
 * touched by training.
 */
public class TrainingJob {

    private final CompletableFuture<ModelVersion> result;
    private final CancellationToken token;

    TrainingJob(CompletableFuture<ModelVersion> result, CancellationToken token) {
        this.result = result;
        this.token = token;
    }

    public CompletableFuture<ModelVersion> result() {
        return result;
    }

    /**
     * @return {@code false} when the candidate was already registered
     */
    public boolean cancel() {
        if (!token.cancel()) {
            return false;
        }
        result.cancel(false);
        return true;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }
}
