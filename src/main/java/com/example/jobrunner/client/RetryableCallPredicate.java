package com.example.jobrunner.client;

import com.example.jobrunner.exception.ExternalServiceException;

import java.util.function.Predicate;

/**
 * Retry only edge function failures marked retryable (network errors, 5xx, 408, 429)
 */
public class RetryableCallPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ExternalServiceException e && e.isRetryable();
    }
}
