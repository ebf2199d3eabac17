package com.docqa.rag.config;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

public final class Retries {

    private Retries() {
    }

    /**
     * Exponential backoff bounded by the policy. Exhaustion rethrows the last failure instead of
     * Reactor's wrapper so callers can map it to their own exception type.
     */
    public static RetryBackoffSpec backoff(RagProperties.RetryPolicy policy, Predicate<Throwable> retryable) {
        return Retry.backoff(Math.max(0, policy.getMaxAttempts() - 1), policy.getInitialBackoff())
                .maxBackoff(policy.getMaxBackoff())
                .filter(retryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public static boolean isTransientHttpFailure(Throwable throwable) {
        if (throwable instanceof TimeoutException || throwable instanceof WebClientRequestException) {
            return true;
        }
        if (throwable instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }
}
