package fr.lapetina.taskflow.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Body rendered by the error middleware for every failed request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseBody {

    private final boolean success = false;
    private ErrorDetail error;
    private Recovery recovery;

    public boolean isSuccess() { return success; }

    public ErrorDetail getError() { return error; }
    public void setError(ErrorDetail error) { this.error = error; }

    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private String code;
        private String message;
        private String title;
        private String action;
        private String severity;
        private boolean retryable;
        private String requestId;
        private Instant timestamp;
        private String supportInfo;
        private String technicalMessage;
        private String stack;
        private Map<String, Object> context;

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getAction() { return action; }
        public void setAction(String action) { this.action = action; }

        public String getSeverity() { return severity; }
        public void setSeverity(String severity) { this.severity = severity; }

        public boolean isRetryable() { return retryable; }
        public void setRetryable(boolean retryable) { this.retryable = retryable; }

        public String getRequestId() { return requestId; }
        public void setRequestId(String requestId) { this.requestId = requestId; }

        public Instant getTimestamp() { return timestamp; }
        public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

        public String getSupportInfo() { return supportInfo; }
        public void setSupportInfo(String supportInfo) { this.supportInfo = supportInfo; }

        public String getTechnicalMessage() { return technicalMessage; }
        public void setTechnicalMessage(String technicalMessage) { this.technicalMessage = technicalMessage; }

        public String getStack() { return stack; }
        public void setStack(String stack) { this.stack = stack; }

        public Map<String, Object> getContext() { return context; }
        public void setContext(Map<String, Object> context) { this.context = context; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Recovery {
        private boolean retryable;
        private Long retryAfter;
        private Integer maxRetries;
        private Boolean circuitBreakerEnabled;

        public boolean isRetryable() { return retryable; }
        public void setRetryable(boolean retryable) { this.retryable = retryable; }

        /** Seconds, rounded up. */
        public Long getRetryAfter() { return retryAfter; }
        public void setRetryAfter(Long retryAfter) { this.retryAfter = retryAfter; }

        public Integer getMaxRetries() { return maxRetries; }
        public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

        public Boolean getCircuitBreakerEnabled() { return circuitBreakerEnabled; }
        public void setCircuitBreakerEnabled(Boolean circuitBreakerEnabled) { this.circuitBreakerEnabled = circuitBreakerEnabled; }
    }
}
