package fr.lapetina.taskflow.domain.error;

import java.sql.SQLException;

/**
 * Maps driver errors to structured errors using the SQLState of the exception.
 *
 * Constraint violations are client errors and never retryable. Everything else
 * becomes DATABASE_ERROR, retryable only when the failure looks transient.
 */
public final class DatabaseErrorMapper {

    public static final String UNIQUE_VIOLATION = "23505";
    public static final String FOREIGN_KEY_VIOLATION = "23503";
    public static final String NOT_NULL_VIOLATION = "23502";
    public static final String UNDEFINED_TABLE = "42P01";
    public static final String UNDEFINED_COLUMN = "42703";

    private DatabaseErrorMapper() {
    }

    public static StructuredError map(SQLException error) {
        return map(error, "query");
    }

    public static StructuredError map(SQLException error, String operation) {
        String state = error.getSQLState();
        if (state == null) {
            return ErrorFactory.database(operation, error);
        }
        return switch (state) {
            case UNIQUE_VIOLATION -> constraint(error, ErrorCode.DUPLICATE_ENTRY, 409,
                    UserMessageOverride.builder()
                            .title("Information Already Exists")
                            .message("This information is already in use.")
                            .action("Please use different information.")
                            .build());
            case FOREIGN_KEY_VIOLATION -> constraint(error, ErrorCode.FOREIGN_KEY_VIOLATION, 400,
                    UserMessageOverride.builder()
                            .title("Invalid Reference")
                            .message("The referenced item does not exist.")
                            .action("Please check your selection and try again.")
                            .build());
            case NOT_NULL_VIOLATION -> constraint(error, ErrorCode.MISSING_REQUIRED_FIELDS, 400,
                    UserMessageOverride.none());
            case UNDEFINED_COLUMN -> constraint(error, ErrorCode.INVALID_FIELD, 400,
                    UserMessageOverride.none());
            case UNDEFINED_TABLE -> StructuredError.builder(ErrorCode.DATABASE_ERROR)
                    .technicalMessage("Database schema error: " + error.getMessage())
                    .cause(error)
                    .userMessage(UserMessageOverride.builder()
                            .title("System Configuration Error")
                            .message("There's a problem with our system configuration.")
                            .action("Please contact support immediately.")
                            .retryable(false)
                            .severity(Severity.CRITICAL)
                            .build())
                    .context("sqlState", state)
                    .build();
            default -> StructuredError.builder(ErrorCode.DATABASE_ERROR)
                    .technicalMessage("Database " + operation + " failed")
                    .cause(error)
                    .userMessage(ErrorFactory.isTransient(error)
                            ? UserMessageOverride.builder().retryable(true).severity(Severity.MEDIUM).build()
                            : UserMessageOverride.builder().retryable(false).severity(Severity.HIGH).build())
                    .context("sqlState", state)
                    .context("operation", operation)
                    .recovery(RecoveryOptions.retry(ErrorFactory.isTransient(error) ? 3 : 0, 1000))
                    .build();
        };
    }

    private static StructuredError constraint(SQLException error, ErrorCode code, int status,
                                              UserMessageOverride override) {
        return StructuredError.builder(code)
                .statusCode(status)
                .technicalMessage(error.getMessage())
                .cause(error)
                .userMessage(override)
                .context("sqlState", error.getSQLState())
                .build();
    }
}
