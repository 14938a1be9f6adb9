package fr.lapetina.taskflow.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Compact 429 body used by the fixed-window limiter and the escalator gate.
 */
public class RateLimitResponseBody {

    private final boolean success = false;
    private Detail error;

    public RateLimitResponseBody() {
    }

    public RateLimitResponseBody(String code, String message, long retryAfter) {
        this.error = new Detail();
        this.error.setCode(code);
        this.error.setMessage(message);
        this.error.setRetryAfter(retryAfter);
    }

    public RateLimitResponseBody withContext(Map<String, Object> context) {
        this.error.setContext(context);
        return this;
    }

    public boolean isSuccess() { return success; }

    public Detail getError() { return error; }
    public void setError(Detail error) { this.error = error; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Detail {
        private String message;
        private String code;
        private long retryAfter;
        private Map<String, Object> context;

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }

        public long getRetryAfter() { return retryAfter; }
        public void setRetryAfter(long retryAfter) { this.retryAfter = retryAfter; }

        public Map<String, Object> getContext() { return context; }
        public void setContext(Map<String, Object> context) { this.context = context; }
    }
}
