package fr.lapetina.taskflow.domain.error;

import java.util.Optional;

/**
 * Machine-readable error taxonomy.
 *
 * Each code carries the HTTP status it is rendered with unless the throw site
 * says otherwise. The user-facing text lives in {@link ErrorMessageCatalog}.
 * Generic codes (BAD_REQUEST, FORBIDDEN, CONFLICT, BAD_GATEWAY, SERVICE_UNAVAILABLE)
 * have no catalog entry and resolve through the status-code table.
 */
public enum ErrorCode {
    // Authentication and authorization
    UNAUTHORIZED(401),
    INVALID_CREDENTIALS(401),
    TOKEN_EXPIRED(401),
    INVALID_TOKEN(401),
    TOKEN_NOT_ACTIVE(401),
    INSUFFICIENT_PERMISSIONS(403),

    // Tasks
    TASK_NOT_FOUND(404),
    TASK_UPDATE_FAILED(500),
    TASK_DELETE_FAILED(500),
    TASK_CREATION_FAILED(500),

    // Users and other resources
    USER_NOT_FOUND(404),
    CATEGORY_NOT_FOUND(404),
    TEAM_NOT_FOUND(404),
    NOTIFICATION_NOT_FOUND(404),
    EMAIL_ALREADY_EXISTS(409),
    WEAK_PASSWORD(400),
    INVALID_PASSWORD(401),

    // Validation
    VALIDATION_ERROR(400),
    MISSING_REQUIRED_FIELDS(400),
    INVALID_FIELD(400),

    // Database
    DATABASE_ERROR(500),
    DUPLICATE_ENTRY(409),
    FOREIGN_KEY_VIOLATION(400),

    // Network and dependencies
    NETWORK_ERROR(503),
    EXTERNAL_SERVICE_ERROR(503),
    TIMEOUT_ERROR(408),

    // Throttling
    RATE_LIMIT_EXCEEDED(429),
    TEMPORARILY_BLOCKED(429),

    // Uploads
    FILE_TOO_LARGE(413),
    INVALID_FILE_TYPE(415),

    // Generic
    INTERNAL_ERROR(500),
    NOT_FOUND(404),
    METHOD_NOT_ALLOWED(405),
    BAD_REQUEST(400),
    FORBIDDEN(403),
    CONFLICT(409),
    BAD_GATEWAY(502),
    SERVICE_UNAVAILABLE(503);

    private final int defaultStatus;

    ErrorCode(int defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    public int defaultStatus() {
        return defaultStatus;
    }

    /**
     * Finds a code by its wire name.
     */
    public static Optional<ErrorCode> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ErrorCode code : values()) {
            if (code.name().equals(name)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

    /**
     * Generic code used when only an HTTP status is known.
     */
    public static ErrorCode forStatus(int status) {
        return switch (status) {
            case 400 -> BAD_REQUEST;
            case 401 -> UNAUTHORIZED;
            case 403 -> FORBIDDEN;
            case 404 -> NOT_FOUND;
            case 405 -> METHOD_NOT_ALLOWED;
            case 408 -> TIMEOUT_ERROR;
            case 409 -> CONFLICT;
            case 429 -> RATE_LIMIT_EXCEEDED;
            case 502 -> BAD_GATEWAY;
            case 503 -> SERVICE_UNAVAILABLE;
            default -> INTERNAL_ERROR;
        };
    }
}
