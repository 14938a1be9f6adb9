package fr.lapetina.taskflow.domain.error;

import java.util.List;

/**
 * Thrown by route handlers when request input fails validation.
 * Rendered as VALIDATION_ERROR with the field errors in the context.
 */
public final class RequestValidationException extends RuntimeException {

    private final List<FieldError> fieldErrors;

    public RequestValidationException(String message) {
        this(message, List.of());
    }

    public RequestValidationException(String message, List<FieldError> fieldErrors) {
        super(message);
        this.fieldErrors = fieldErrors != null ? List.copyOf(fieldErrors) : List.of();
    }

    public List<FieldError> getFieldErrors() {
        return fieldErrors;
    }

    public record FieldError(String field, String message) {
    }
}
