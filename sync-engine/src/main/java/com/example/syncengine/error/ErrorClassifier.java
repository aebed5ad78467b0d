package com.example.syncengine.error;

import com.example.syncengine.exception.ProviderApiException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Turns any failure into an {@link ErrorClassification}.
 *
 * Resolution order:
 * <ol>
 *   <li>an exception that already carries a classification</li>
 *   <li>a category set by the provider client at the origin</li>
 *   <li>HTTP status (401, 429, 403, 400/422, 5xx); a 400/422 naming a rejected
 *       grant or token is auth</li>
 *   <li>connection-level exceptions and error codes</li>
 *   <li>message text, in taxonomy order</li>
 * </ol>
 * Never throws. A null input is classified as unknown.
 */
@Component
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private static final Set<String> NETWORK_CODES = Set.of(
            "ECONNREFUSED", "ETIMEDOUT", "ENOTFOUND", "ECONNRESET", "EAI_AGAIN", "EHOSTUNREACH");

    private static final Pattern REJECTED_GRANT = Pattern.compile("invalid[_\\s-]?(grant|token)");

    private static final List<MessageRule> MESSAGE_RULES = List.of(
            new MessageRule(ErrorCategory.AUTH,
                    "unauthori[sz]ed|invalid[_\\s-]?grant|invalid[_\\s-]?token|invalid[_\\s-]?credentials|token[\\w\\s]*expired"),
            new MessageRule(ErrorCategory.RATE_LIMIT,
                    "rate[_\\s-]?limit|quota|too[_\\s-]?many[_\\s-]?requests"),
            new MessageRule(ErrorCategory.NETWORK,
                    "connection|network|fetch failed|failed to fetch|timed?[_\\s-]?out|dns|socket hang up"),
            new MessageRule(ErrorCategory.PERMISSION,
                    "forbidden|permission[_\\s-]?denied|insufficient[_\\s-]?(scope|permission)"),
            new MessageRule(ErrorCategory.VALIDATION,
                    "invalid[_\\s-]?input|malformed|bad[_\\s-]?request|validation"),
            new MessageRule(ErrorCategory.SYSTEM,
                    "internal|server|service[_\\s-]?unavailable")
    );

    private static final Map<ErrorCategory, Profile> PROFILES = Map.of(
            ErrorCategory.AUTH, new Profile(ErrorSeverity.HIGH, true,
                    "Your account connection has expired or been revoked",
                    List.of(
                            RecoveryStrategy.auto(RecoveryAction.REFRESH_TOKEN, "Refresh access token",
                                    "Obtain a new access token using the stored refresh token"),
                            RecoveryStrategy.manual(RecoveryAction.REAUTHENTICATE, "Reconnect account",
                                    "Sign in to the provider again to restore access"))),
            ErrorCategory.RATE_LIMIT, new Profile(ErrorSeverity.MEDIUM, true,
                    "Provider API limits have been reached",
                    List.of(
                            RecoveryStrategy.auto(RecoveryAction.EXPONENTIAL_BACKOFF, "Wait and retry",
                                    "Retry with exponential backoff once the quota resets"),
                            RecoveryStrategy.manual(RecoveryAction.REDUCE_FREQUENCY, "Reduce sync scope",
                                    "Sync less often or limit the date range"))),
            ErrorCategory.NETWORK, new Profile(ErrorSeverity.MEDIUM, true,
                    "Network connectivity issues prevented the sync from completing",
                    List.of(
                            RecoveryStrategy.auto(RecoveryAction.RETRY_NOW, "Retry sync",
                                    "Try the operation again"),
                            RecoveryStrategy.manual(RecoveryAction.CHECK_CONNECTIVITY, "Check connectivity",
                                    "Verify network access to the provider"))),
            ErrorCategory.PERMISSION, new Profile(ErrorSeverity.HIGH, false,
                    "Required permissions for the account are missing",
                    List.of(
                            RecoveryStrategy.manual(RecoveryAction.REVIEW_PERMISSIONS, "Review permissions",
                                    "Check which scopes were granted to the application"),
                            RecoveryStrategy.manual(RecoveryAction.REAUTHORIZE, "Grant required permissions",
                                    "Reconnect with all requested permissions enabled"))),
            ErrorCategory.VALIDATION, new Profile(ErrorSeverity.MEDIUM, false,
                    "Some data could not be processed",
                    List.of(
                            RecoveryStrategy.manual(RecoveryAction.CHECK_DATA_FORMAT, "Check data format",
                                    "Review the request data for invalid or malformed values"),
                            RecoveryStrategy.manual(RecoveryAction.UPDATE_SETTINGS, "Update sync settings",
                                    "Adjust sync preferences and try again"))),
            ErrorCategory.SYSTEM, new Profile(ErrorSeverity.HIGH, true,
                    "The provider or a backing service is temporarily unavailable",
                    List.of(
                            RecoveryStrategy.auto(RecoveryAction.RETRY_LATER, "Retry later",
                                    "Try again after the service recovers"),
                            RecoveryStrategy.manual(RecoveryAction.CONTACT_SUPPORT, "Contact support",
                                    "Get help if the problem persists"))),
            ErrorCategory.UNKNOWN, new Profile(ErrorSeverity.MEDIUM, true,
                    "An unexpected error occurred",
                    List.of(
                            RecoveryStrategy.auto(RecoveryAction.RETRY, "Retry",
                                    "Try the operation again"),
                            RecoveryStrategy.manual(RecoveryAction.REVIEW_LOGS, "Review logs",
                                    "Inspect the error logs for details")))
    );

    public ErrorClassification classify(Throwable error) {
        if (error == null) {
            return build(ErrorCategory.UNKNOWN, null);
        }
        if (error instanceof ClassifiedFailure classified && classified.getClassification() != null) {
            return classified.getClassification();
        }

        String message = describe(error);
        if (error instanceof CategorizedFailure categorized && categorized.getCategory() != null) {
            return build(categorized.getCategory(), message);
        }

        return resolve(message, extractStatus(error), extractCode(error), isConnectionFailure(error));
    }

    /**
     * Classify a failure known only by its parts. Any argument may be null.
     */
    public ErrorClassification classify(String message, Integer status, String code) {
        if (isBlank(message) && status == null && isBlank(code)) {
            return build(ErrorCategory.UNKNOWN, message);
        }
        return resolve(message, status, code, false);
    }

    /**
     * Classification for a refresh token the provider has revoked.
     * Not retryable: only a new authorization by the user recovers from it.
     */
    public ErrorClassification reauthorizationRequired(String technicalMessage) {
        return new ErrorClassification(
                ErrorCategory.AUTH,
                ErrorSeverity.CRITICAL,
                false,
                List.of(RecoveryStrategy.manual(RecoveryAction.REAUTHENTICATE, "Reconnect account",
                        "The stored authorization was revoked. Sign in to the provider again.")),
                "Your account connection was revoked and must be reconnected",
                technicalMessage);
    }

    public ErrorClassification forCategory(ErrorCategory category, String technicalMessage) {
        return build(category == null ? ErrorCategory.UNKNOWN : category, technicalMessage);
    }

    /**
     * Strategies for a stored failure, whose original exception is gone.
     */
    public List<RecoveryStrategy> strategiesFor(ErrorCategory category, ErrorSeverity severity) {
        if (category == ErrorCategory.AUTH && severity == ErrorSeverity.CRITICAL) {
            return reauthorizationRequired(null).recoveryStrategies();
        }
        return PROFILES.get(category == null ? ErrorCategory.UNKNOWN : category).strategies();
    }

    private ErrorClassification resolve(String message, Integer status, String code, boolean connectionFailure) {
        ErrorCategory byStatus = categoryForStatus(status);
        if (byStatus == ErrorCategory.VALIDATION && (matches(REJECTED_GRANT, code) || matches(REJECTED_GRANT, message))) {
            return build(ErrorCategory.AUTH, message);
        }
        if (byStatus != null) {
            return build(byStatus, message);
        }
        if (connectionFailure || (code != null && NETWORK_CODES.contains(code.toUpperCase(Locale.ROOT)))) {
            return build(ErrorCategory.NETWORK, message);
        }

        String text = ((message == null ? "" : message) + " " + (code == null ? "" : code)).toLowerCase(Locale.ROOT);
        if (!text.isBlank()) {
            for (MessageRule rule : MESSAGE_RULES) {
                if (rule.pattern().matcher(text).find()) {
                    return build(rule.category(), message);
                }
            }
        }
        return build(ErrorCategory.UNKNOWN, message);
    }

    private static boolean matches(Pattern pattern, String text) {
        return text != null && pattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    private static ErrorCategory categoryForStatus(Integer status) {
        if (status == null) {
            return null;
        }
        if (status == 401) {
            return ErrorCategory.AUTH;
        }
        if (status == 429) {
            return ErrorCategory.RATE_LIMIT;
        }
        if (status == 403) {
            return ErrorCategory.PERMISSION;
        }
        if (status == 400 || status == 422) {
            return ErrorCategory.VALIDATION;
        }
        if (status >= 500 && status < 600) {
            return ErrorCategory.SYSTEM;
        }
        return null;
    }

    private static ErrorClassification build(ErrorCategory category, String technicalMessage) {
        Profile profile = PROFILES.get(category);
        return new ErrorClassification(
                category,
                profile.severity(),
                profile.retryable(),
                profile.strategies(),
                profile.userMessage(),
                technicalMessage);
    }

    private static Integer extractStatus(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ProviderApiException providerError && providerError.getStatus() != null) {
                return providerError.getStatus();
            }
            if (current instanceof WebClientResponseException responseError) {
                return responseError.getStatusCode().value();
            }
            current = current.getCause();
        }
        return null;
    }

    private static String extractCode(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ProviderApiException providerError && providerError.getErrorCode() != null) {
                return providerError.getErrorCode();
            }
            current = current.getCause();
        }
        return null;
    }

    private static boolean isConnectionFailure(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ConnectException
                    || current instanceof SocketTimeoutException
                    || current instanceof UnknownHostException
                    || current instanceof NoRouteToHostException
                    || current instanceof TimeoutException
                    || current instanceof WebClientRequestException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return isBlank(message) ? error.getClass().getSimpleName() : message;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record MessageRule(ErrorCategory category, Pattern pattern) {
        MessageRule(ErrorCategory category, String regex) {
            this(category, Pattern.compile(regex));
        }
    }

    private record Profile(ErrorSeverity severity, boolean retryable, String userMessage,
                           List<RecoveryStrategy> strategies) {
    }
}
