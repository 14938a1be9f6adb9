package fr.lapetina.taskflow.domain.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredErrorTest {

    @Test
    @DisplayName("should take status and message from the code by default")
    void shouldUseCodeDefaults() {
        StructuredError error = StructuredError.of(ErrorCode.TASK_NOT_FOUND, "task 7 missing");

        assertThat(error.getStatusCode()).isEqualTo(404);
        assertThat(error.getMessage()).isEqualTo("task 7 missing");
        assertThat(error.getUserMessage().title()).isEqualTo("Task Not Found");
        assertThat(error.getTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("should merge an override over the catalog entry")
    void shouldMergeOverride() {
        StructuredError error = StructuredError.builder(ErrorCode.DATABASE_ERROR)
                .userMessage(UserMessageOverride.builder().title("Custom").retryable(false).build())
                .build();

        assertThat(error.getUserMessage().title()).isEqualTo("Custom");
        assertThat(error.getUserMessage().message())
                .isEqualTo("We're experiencing technical difficulties with our database.");
        assertThat(error.getUserMessage().retryable()).isFalse();
        assertThat(error.getUserMessage().severity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("should resolve the status entry for a generic code with an explicit status")
    void shouldUseStatusEntryForGenericCode() {
        StructuredError error = ErrorFactory.ofStatus(502, "upstream said no");

        assertThat(error.getCode()).isEqualTo(ErrorCode.BAD_GATEWAY);
        assertThat(error.getUserMessage().title()).isEqualTo("Service Unavailable");
    }

    @Test
    @DisplayName("should only be retryable for server errors")
    void shouldLimitRetryableToServerErrors() {
        StructuredError tooMany = StructuredError.of(ErrorCode.RATE_LIMIT_EXCEEDED, "slow down");
        StructuredError unavailable = StructuredError.of(ErrorCode.EXTERNAL_SERVICE_ERROR, "down");

        assertThat(tooMany.getUserMessage().retryable()).isTrue();
        assertThat(tooMany.isRetryable()).isFalse();
        assertThat(unavailable.isRetryable()).isTrue();
    }

    @Test
    @DisplayName("should merge context entries and skip null values")
    void shouldMergeContext() {
        StructuredError error = StructuredError.builder(ErrorCode.VALIDATION_ERROR)
                .context("field", "title")
                .context("ignored", null)
                .build();

        error.setContext(Map.of("field", "dueDate", "max", 10));

        assertThat(error.getContext())
                .containsEntry("field", "dueDate")
                .containsEntry("max", 10)
                .doesNotContainKey("ignored");
    }

    @Test
    @DisplayName("should accept a request id after construction")
    void shouldSetRequestId() {
        StructuredError error = StructuredError.of(ErrorCode.INTERNAL_ERROR, "boom").setRequestId("req_1");

        assertThat(error.getRequestId()).isEqualTo("req_1");
    }
}
