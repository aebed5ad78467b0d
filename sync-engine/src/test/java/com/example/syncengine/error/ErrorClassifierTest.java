package com.example.syncengine.error;

import com.example.syncengine.exception.ProviderApiException;
import com.example.syncengine.job.InvalidJobPayloadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.ConnectException;
import java.net.URI;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void nullInput_isUnknownAndRetryable() {
        ErrorClassification classification = classifier.classify(null);

        assertThat(classification.category()).isEqualTo(ErrorCategory.UNKNOWN);
        assertThat(classification.retryable()).isTrue();
        assertThat(classification.recoveryStrategies()).isNotEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Unauthorized", "invalid credentials", "some server error", "", "bad request"})
    void status429_isAlwaysRateLimit_whateverTheMessage(String message) {
        ErrorClassification classification = classifier.classify(message, 429, null);

        assertThat(classification.category()).isEqualTo(ErrorCategory.RATE_LIMIT);
        assertThat(classification.retryable()).isTrue();
        assertThat(classification.severity()).isEqualTo(ErrorSeverity.MEDIUM);
    }

    @Test
    void invalidGrantMessage_isRetryableAuthWithReauthenticateStrategy() {
        ErrorClassification classification = classifier.classify("invalid_grant", null, null);

        assertThat(classification.category()).isEqualTo(ErrorCategory.AUTH);
        assertThat(classification.retryable()).isTrue();
        assertThat(classification.severity()).isEqualTo(ErrorSeverity.HIGH);
        assertThat(classification.hasStrategy(RecoveryAction.REAUTHENTICATE)).isTrue();
        assertThat(classification.hasStrategy(RecoveryAction.REFRESH_TOKEN)).isTrue();
    }

    @Test
    void revokedRefreshToken_isCriticalAndNotRetryable() {
        ErrorClassification classification = classifier.reauthorizationRequired("invalid_grant: Token has been revoked");

        assertThat(classification.category()).isEqualTo(ErrorCategory.AUTH);
        assertThat(classification.severity()).isEqualTo(ErrorSeverity.CRITICAL);
        assertThat(classification.retryable()).isFalse();
        assertThat(classification.recoveryStrategies())
                .extracting(RecoveryStrategy::action)
                .containsExactly(RecoveryAction.REAUTHENTICATE);
    }

    @Test
    void httpStatus_takesPrecedenceOverMessage() {
        ProviderApiException forbidden = new ProviderApiException("request timed out upstream", 403, null);
        ProviderApiException serverError = new ProviderApiException("unauthorized caller", 503, null);

        assertThat(classifier.classify(forbidden).category()).isEqualTo(ErrorCategory.PERMISSION);
        assertThat(classifier.classify(forbidden).retryable()).isFalse();
        assertThat(classifier.classify(serverError).category()).isEqualTo(ErrorCategory.SYSTEM);
        assertThat(classifier.classify(serverError).retryable()).isTrue();
    }

    @Test
    void validationStatuses_areNotRetryable() {
        assertThat(classifier.classify("whatever", 400, null).category()).isEqualTo(ErrorCategory.VALIDATION);
        assertThat(classifier.classify("whatever", 422, null).retryable()).isFalse();
    }

    @Test
    void rejectedGrantOnBadRequest_isAuth() {
        ErrorClassification byCode = classifier.classify(
                new ProviderApiException("Token has been expired or revoked.", 400, "invalid_grant"));
        ErrorClassification byMessage = classifier.classify("invalid_token: access token malformed", 400, null);

        assertThat(byCode.category()).isEqualTo(ErrorCategory.AUTH);
        assertThat(byCode.retryable()).isTrue();
        assertThat(byMessage.category()).isEqualTo(ErrorCategory.AUTH);
        assertThat(classifier.classify("invalid_grant", 429, null).category()).isEqualTo(ErrorCategory.RATE_LIMIT);
    }

    @Test
    void categorySetAtOrigin_winsOverMessageText() {
        ProviderApiException error = new ProviderApiException("internal server hiccup", null, null,
                ErrorCategory.NETWORK, null);

        assertThat(classifier.classify(error).category()).isEqualTo(ErrorCategory.NETWORK);
    }

    @Test
    void invalidPayload_isValidation() {
        ErrorClassification classification = classifier.classify(
                new InvalidJobPayloadException(UUID.randomUUID(), "missing field 'service'"));

        assertThat(classification.category()).isEqualTo(ErrorCategory.VALIDATION);
        assertThat(classification.retryable()).isFalse();
    }

    @Test
    void connectionFailures_areNetwork() {
        RuntimeException wrapped = new RuntimeException("call failed", new ConnectException("Connection refused"));
        WebClientRequestException requestException = new WebClientRequestException(
                new TimeoutException("no answer"), HttpMethod.POST, URI.create("http://provider/v1"), new HttpHeaders());

        assertThat(classifier.classify(wrapped).category()).isEqualTo(ErrorCategory.NETWORK);
        assertThat(classifier.classify(requestException).category()).isEqualTo(ErrorCategory.NETWORK);
        assertThat(classifier.classify(null, null, "ECONNRESET").category()).isEqualTo(ErrorCategory.NETWORK);
    }

    @Test
    void messageRules_followTaxonomyOrder() {
        assertThat(classifier.classify("Token expired for account", null, null).category())
                .isEqualTo(ErrorCategory.AUTH);
        assertThat(classifier.classify("Quota exceeded for this project", null, null).category())
                .isEqualTo(ErrorCategory.RATE_LIMIT);
        assertThat(classifier.classify("Permission denied on calendar", null, null).category())
                .isEqualTo(ErrorCategory.PERMISSION);
        assertThat(classifier.classify("malformed date header", null, null).category())
                .isEqualTo(ErrorCategory.VALIDATION);
        assertThat(classifier.classify("Service unavailable", null, null).category())
                .isEqualTo(ErrorCategory.SYSTEM);
        assertThat(classifier.classify("something odd happened", null, null).category())
                .isEqualTo(ErrorCategory.UNKNOWN);
    }

    @Test
    void classifiedFailure_isReturnedUnchanged() {
        ErrorClassification revoked = classifier.reauthorizationRequired("revoked");
        RuntimeException failure = new ClassifiedRuntimeException(revoked);

        assertThat(classifier.classify(failure)).isSameAs(revoked);
    }

    @Test
    void storedCriticalAuthFailure_getsOnlyReauthenticate() {
        assertThat(classifier.strategiesFor(ErrorCategory.AUTH, ErrorSeverity.CRITICAL))
                .extracting(RecoveryStrategy::action)
                .containsExactly(RecoveryAction.REAUTHENTICATE);
        assertThat(classifier.strategiesFor(ErrorCategory.AUTH, ErrorSeverity.HIGH))
                .extracting(RecoveryStrategy::action)
                .contains(RecoveryAction.REFRESH_TOKEN);
    }

    private static class ClassifiedRuntimeException extends RuntimeException implements ClassifiedFailure {
        private final ErrorClassification classification;

        ClassifiedRuntimeException(ErrorClassification classification) {
            super("classified");
            this.classification = classification;
        }

        @Override
        public ErrorClassification getClassification() {
            return classification;
        }
    }
}
