package fr.lapetina.taskflow.domain.error;

import java.util.Objects;

/**
 * Curated, user-facing description of an error.
 * Immutable; instances from the catalog are shared.
 */
public record UserMessage(
        String title,
        String message,
        String action,
        String supportInfo,
        boolean retryable,
        Severity severity
) {
    public UserMessage {
        Objects.requireNonNull(title, "Title is required");
        Objects.requireNonNull(message, "Message is required");
        Objects.requireNonNull(severity, "Severity is required");
    }

    static UserMessage of(String title, String message, String action, boolean retryable, Severity severity) {
        return new UserMessage(title, message, action, null, retryable, severity);
    }

    static UserMessage of(String title, String message, String action, String supportInfo,
                          boolean retryable, Severity severity) {
        return new UserMessage(title, message, action, supportInfo, retryable, severity);
    }
}
