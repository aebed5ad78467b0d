package com.example.syncengine.client.provider;

import com.example.syncengine.error.ErrorCategory;
import com.example.syncengine.exception.ProviderApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Converts transport and HTTP failures of provider calls into {@link ProviderApiException}.
 */
final class ProviderErrors {

    private static final int MAX_BODY_LENGTH = 500;

    private ProviderErrors() {
    }

    static Mono<? extends Throwable> fromResponse(String operation, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .onErrorReturn("")
                .map(body -> new ProviderApiException(
                        operation + " failed with status " + status + describe(status) + body(body),
                        status,
                        codeFor(status)));
    }

    static ProviderApiException fromThrowable(String operation, Throwable t) {
        if (t instanceof ProviderApiException providerError) {
            return providerError;
        }
        if (t instanceof CallNotPermittedException) {
            return new ProviderApiException(operation + " unavailable: circuit breaker open",
                    HttpStatus.SERVICE_UNAVAILABLE.value(), "circuit_open", ErrorCategory.SYSTEM, t);
        }
        Throwable root = rootCause(t);
        if (root instanceof UnknownHostException) {
            return new ProviderApiException(operation + " failed: DNS lookup failed (" + root.getMessage() + ")",
                    null, "ENOTFOUND", ErrorCategory.NETWORK, t);
        }
        if (root instanceof ConnectException) {
            return new ProviderApiException(operation + " failed: connection refused (" + root.getMessage() + ")",
                    null, "ECONNREFUSED", ErrorCategory.NETWORK, t);
        }
        if (root instanceof TimeoutException || t instanceof WebClientRequestException) {
            return new ProviderApiException(operation + " failed: " + t.getMessage(),
                    null, "ETIMEDOUT", ErrorCategory.NETWORK, t);
        }
        return new ProviderApiException(operation + " failed: " + t.getMessage(), null, null, null, t);
    }

    private static String codeFor(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved == null ? String.valueOf(status) : resolved.name().toLowerCase();
    }

    private static String describe(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved == null ? "" : " (" + resolved.getReasonPhrase() + ")";
    }

    private static String body(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        return ": " + (body.length() > MAX_BODY_LENGTH ? body.substring(0, MAX_BODY_LENGTH) : body);
    }

    private static Throwable rootCause(Throwable t) {
        Throwable current = t;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
