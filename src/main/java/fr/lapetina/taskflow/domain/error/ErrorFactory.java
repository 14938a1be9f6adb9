package fr.lapetina.taskflow.domain.error;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Builders for the common error kinds raised by route handlers and executors.
 */
public final class ErrorFactory {

    private static final Set<String> TRANSIENT_MARKERS = Set.of("ECONNRESET", "ETIMEDOUT", "ENOTFOUND");

    private static final Map<String, ErrorCode> RESOURCE_CODES = Map.of(
            "task", ErrorCode.TASK_NOT_FOUND,
            "user", ErrorCode.USER_NOT_FOUND,
            "category", ErrorCode.CATEGORY_NOT_FOUND,
            "team", ErrorCode.TEAM_NOT_FOUND,
            "notification", ErrorCode.NOTIFICATION_NOT_FOUND
    );

    private ErrorFactory() {
    }

    public static StructuredError authentication(String message) {
        return StructuredError.builder(ErrorCode.UNAUTHORIZED)
                .technicalMessage(message != null ? message : "Authentication required")
                .build();
    }

    public static StructuredError invalidCredentials() {
        return StructuredError.of(ErrorCode.INVALID_CREDENTIALS, "Invalid email or password");
    }

    public static StructuredError authorization(String message) {
        return StructuredError.builder(ErrorCode.INSUFFICIENT_PERMISSIONS)
                .technicalMessage(message != null ? message : "Insufficient permissions")
                .build();
    }

    public static StructuredError validation(String message) {
        return validation(message, null, List.of());
    }

    /**
     * Validation failure. A detail replaces the catalog explanation; field errors
     * are carried in the context under {@code fieldErrors}.
     */
    public static StructuredError validation(String message, String detail,
                                             List<RequestValidationException.FieldError> fieldErrors) {
        StructuredError.Builder builder = StructuredError.builder(ErrorCode.VALIDATION_ERROR)
                .technicalMessage(message)
                .userMessage(UserMessageOverride.builder()
                        .message(detail != null ? "Invalid input: " + detail : "Please check your input and try again.")
                        .build());
        if (fieldErrors != null && !fieldErrors.isEmpty()) {
            builder.context("fieldErrors", fieldErrors);
        }
        return builder.build();
    }

    /**
     * Not-found error for a named resource. Known resources map to their own code,
     * anything else to the generic NOT_FOUND with a resource-specific title.
     */
    public static StructuredError notFound(String resource) {
        String name = resource == null || resource.isBlank() ? "Resource" : resource.trim();
        ErrorCode code = RESOURCE_CODES.get(name.toLowerCase(Locale.ROOT));
        StructuredError.Builder builder = StructuredError
                .builder(code != null ? code : ErrorCode.NOT_FOUND)
                .technicalMessage(name + " not found")
                .context("resource", name);
        if (code == null) {
            builder.userMessage(UserMessageOverride.builder()
                    .title(capitalize(name) + " Not Found")
                    .message("The " + name.toLowerCase(Locale.ROOT) + " you're looking for doesn't exist.")
                    .build());
        }
        return builder.build();
    }

    /**
     * Generic database failure. Transient causes (lost connections, timeouts) are
     * retryable with three attempts; anything else is reported as non-retryable.
     */
    public static StructuredError database(String operation, Throwable cause) {
        boolean transientFailure = isTransient(cause);
        return StructuredError.builder(ErrorCode.DATABASE_ERROR)
                .technicalMessage("Database " + operation + " failed")
                .cause(cause)
                .userMessage(UserMessageOverride.builder()
                        .retryable(transientFailure)
                        .severity(transientFailure ? Severity.MEDIUM : Severity.HIGH)
                        .build())
                .context("operation", operation)
                .context("originalError", cause != null ? cause.getMessage() : null)
                .recovery(RecoveryOptions.retry(transientFailure ? 3 : 0, 1000))
                .build();
    }

    public static StructuredError externalService(String service, Throwable cause) {
        return StructuredError.builder(ErrorCode.EXTERNAL_SERVICE_ERROR)
                .technicalMessage("External service " + service + " failed")
                .cause(cause)
                .userMessage(UserMessageOverride.builder()
                        .title(service + " Service Unavailable")
                        .message("We're having trouble connecting to " + service + ".")
                        .supportInfo("We are working to restore full functionality.")
                        .build())
                .context("service", service)
                .context("originalError", cause != null ? cause.getMessage() : null)
                .recovery(RecoveryOptions.retryWithCircuitBreaker(3, 2000))
                .build();
    }

    /**
     * Rejection raised by an open circuit. Same shape as an external service failure,
     * with the breaker flag set so callers do not hammer the dependency.
     */
    public static StructuredError circuitOpen(String serviceId, long retryInMs) {
        return StructuredError.builder(ErrorCode.EXTERNAL_SERVICE_ERROR)
                .technicalMessage("Circuit breaker is OPEN for " + serviceId)
                .context("service", serviceId)
                .context("circuitState", "OPEN")
                .recovery(new RecoveryOptions(0, Math.max(0, retryInMs), true))
                .build();
    }

    public static StructuredError timeout(String operation, long timeoutMs) {
        return StructuredError.builder(ErrorCode.TIMEOUT_ERROR)
                .technicalMessage("Operation " + operation + " timed out after " + timeoutMs + "ms")
                .userMessage(UserMessageOverride.builder()
                        .message("The " + operation + " operation took too long to complete.")
                        .action("Please try again or contact support if this continues.")
                        .build())
                .context("operation", operation)
                .context("timeout", timeoutMs)
                .recovery(RecoveryOptions.retry(2, 3000))
                .build();
    }

    public static StructuredError rateLimit(int limit, long windowMs, Instant resetTime) {
        return StructuredError.builder(ErrorCode.RATE_LIMIT_EXCEEDED)
                .technicalMessage("Rate limit exceeded: " + limit + " requests per " + windowMs + "ms")
                .userMessage(UserMessageOverride.builder()
                        .action("Please wait until " + resetTime + " before trying again.")
                        .build())
                .context("limit", limit)
                .context("windowMs", windowMs)
                .context("resetTime", resetTime.toString())
                .build();
    }

    /**
     * Error for a bare HTTP status, using the generic code for that status.
     */
    public static StructuredError ofStatus(int statusCode, String message) {
        return StructuredError.builder(ErrorCode.forStatus(statusCode))
                .statusCode(statusCode)
                .technicalMessage(message)
                .build();
    }

    public static StructuredError internal(Throwable cause) {
        return StructuredError.builder(ErrorCode.INTERNAL_ERROR)
                .technicalMessage(cause != null && cause.getMessage() != null ? cause.getMessage() : "Unexpected error")
                .cause(cause)
                .build();
    }

    /**
     * Walks the cause chain looking for a connection-level or timeout failure.
     */
    static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException
                    || current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof SocketTimeoutException
                    || current instanceof TimeoutException) {
                return true;
            }
            if (current instanceof SQLException sql && sql.getSQLState() != null
                    && sql.getSQLState().startsWith("08")) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                for (String marker : TRANSIENT_MARKERS) {
                    if (message.contains(marker)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
