package fr.lapetina.taskflow.domain.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import fr.lapetina.taskflow.auth.TokenVerificationException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLException;
import java.time.format.DateTimeParseException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Turns any throwable into a {@link StructuredError}.
 *
 * Async wrappers are unwrapped first. Structured errors pass through unchanged;
 * known exception families map to their taxonomy code; anything else becomes
 * INTERNAL_ERROR.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static StructuredError classify(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof StructuredError structured) {
            return structured;
        }
        if (cause instanceof SQLException sql) {
            return DatabaseErrorMapper.map(sql);
        }
        if (cause instanceof TokenVerificationException token) {
            ErrorCode code = switch (token.getReason()) {
                case EXPIRED -> ErrorCode.TOKEN_EXPIRED;
                case NOT_YET_VALID -> ErrorCode.TOKEN_NOT_ACTIVE;
                case MALFORMED -> ErrorCode.INVALID_TOKEN;
            };
            return StructuredError.builder(code)
                    .technicalMessage(token.getMessage())
                    .cause(token)
                    .build();
        }
        if (cause instanceof RequestValidationException validation) {
            return ErrorFactory.validation(validation.getMessage(), null, validation.getFieldErrors());
        }
        if (cause instanceof JsonProcessingException
                || cause instanceof NumberFormatException
                || cause instanceof DateTimeParseException) {
            return ErrorFactory.validation("Invalid data format", cause.getMessage(), null);
        }
        if (cause instanceof HttpTimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException) {
            return StructuredError.builder(ErrorCode.TIMEOUT_ERROR)
                    .technicalMessage(cause.getMessage() != null ? cause.getMessage() : "Operation timed out")
                    .cause(cause)
                    .recovery(RecoveryOptions.retry(2, 3000))
                    .build();
        }
        if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
            return ErrorFactory.externalService("Network", cause);
        }
        return ErrorFactory.internal(cause);
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
