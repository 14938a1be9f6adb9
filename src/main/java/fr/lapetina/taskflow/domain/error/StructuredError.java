package fr.lapetina.taskflow.domain.error;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized error carrying both the machine-readable code and the curated
 * user-facing message.
 *
 * The user message is always populated: catalog defaults for the code (or the
 * status code when the code has no entry) with the override merged on top.
 * Only the context and the request id may change after construction.
 */
public class StructuredError extends RuntimeException {

    private final int statusCode;
    private final ErrorCode code;
    private final UserMessage userMessage;
    private final RecoveryOptions recoveryOptions;
    private final Instant timestamp;
    private volatile Map<String, Object> context;
    private volatile String requestId;

    protected StructuredError(Builder builder) {
        super(builder.technicalMessage, builder.cause);
        this.code = builder.code;
        this.statusCode = builder.statusCode != null ? builder.statusCode : builder.code.defaultStatus();
        this.userMessage = builder.override.applyTo(ErrorMessageCatalog.resolve(code, statusCode));
        this.recoveryOptions = builder.recoveryOptions;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
        this.requestId = builder.requestId;
    }

    public static Builder builder(ErrorCode code) {
        return new Builder(code);
    }

    /**
     * Shortcut for a code with its default status and catalog message.
     */
    public static StructuredError of(ErrorCode code, String technicalMessage) {
        return builder(code).technicalMessage(technicalMessage).build();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ErrorCode getCode() {
        return code;
    }

    public UserMessage getUserMessage() {
        return userMessage;
    }

    public Optional<RecoveryOptions> getRecoveryOptions() {
        return Optional.ofNullable(recoveryOptions);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * Merges entries into the context. Existing keys are overwritten.
     */
    public StructuredError setContext(Map<String, ?> additional) {
        if (additional != null && !additional.isEmpty()) {
            Map<String, Object> merged = new LinkedHashMap<>(context);
            merged.putAll(additional);
            this.context = Collections.unmodifiableMap(merged);
        }
        return this;
    }

    public StructuredError setRequestId(String requestId) {
        this.requestId = requestId;
        return this;
    }

    /**
     * True for server-side failures the catalog marks as retryable.
     * Client errors are never retried, whatever their message says.
     */
    public boolean isRetryable() {
        return userMessage.retryable() && statusCode >= 500;
    }

    @Override
    public String toString() {
        return "StructuredError{" +
                "code=" + code +
                ", statusCode=" + statusCode +
                ", message='" + getMessage() + '\'' +
                ", requestId='" + requestId + '\'' +
                '}';
    }

    public static final class Builder {
        private final ErrorCode code;
        private Integer statusCode;
        private String technicalMessage;
        private Throwable cause;
        private UserMessageOverride override = UserMessageOverride.none();
        private RecoveryOptions recoveryOptions;
        private Instant timestamp;
        private String requestId;
        private final Map<String, Object> context = new LinkedHashMap<>();

        private Builder(ErrorCode code) {
            this.code = Objects.requireNonNull(code, "Error code is required");
            this.technicalMessage = code.name();
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder technicalMessage(String technicalMessage) {
            if (technicalMessage != null) {
                this.technicalMessage = technicalMessage;
            }
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public Builder userMessage(UserMessageOverride override) {
            this.override = override != null ? override : UserMessageOverride.none();
            return this;
        }

        public Builder recovery(RecoveryOptions recoveryOptions) {
            this.recoveryOptions = recoveryOptions;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder context(String key, Object value) {
            if (value != null) {
                this.context.put(key, value);
            }
            return this;
        }

        public Builder context(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::context);
            }
            return this;
        }

        public StructuredError build() {
            return new StructuredError(this);
        }
    }
}
