package com.example.syncengine.config;

import com.example.syncengine.exception.ProviderApiException;

import java.util.function.Predicate;

/**
 * Circuit breaker failure predicate for provider calls.
 * A 4xx answer means the upstream is healthy and rejected one request, so it is not counted.
 */
public class UpstreamFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ProviderApiException providerError && providerError.getStatus() != null) {
            int status = providerError.getStatus();
            return status < 400 || status >= 500;
        }
        return true;
    }
}
