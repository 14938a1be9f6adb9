package fr.lapetina.taskflow.domain.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorMessageCatalogTest {

    @Test
    @DisplayName("should return the curated entry for a known code")
    void shouldResolveKnownCode() {
        UserMessage message = ErrorMessageCatalog.getByCode("TASK_NOT_FOUND");

        assertThat(message.title()).isEqualTo("Task Not Found");
        assertThat(message.retryable()).isFalse();
        assertThat(message.severity()).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("should fall back to INTERNAL_ERROR for an unknown code")
    void shouldFallBackForUnknownCode() {
        assertThat(ErrorMessageCatalog.getByCode("NOPE"))
                .isSameAs(ErrorMessageCatalog.findByCode(ErrorCode.INTERNAL_ERROR).orElseThrow());
        assertThat(ErrorMessageCatalog.getByCode(null).title()).isEqualTo("Something Went Wrong");
    }

    @Test
    @DisplayName("should fall back to the 500 entry for an unknown status")
    void shouldFallBackForUnknownStatus() {
        assertThat(ErrorMessageCatalog.getByStatusCode(418)).isSameAs(ErrorMessageCatalog.getByStatusCode(500));
        assertThat(ErrorMessageCatalog.getByStatusCode(503).title()).isEqualTo("Service Maintenance");
    }

    @Test
    @DisplayName("should resolve generic codes through the status table")
    void shouldResolveGenericCodesByStatus() {
        assertThat(ErrorMessageCatalog.findByCode(ErrorCode.CONFLICT)).isEmpty();
        assertThat(ErrorMessageCatalog.resolve(ErrorCode.CONFLICT, 409).title()).isEqualTo("Conflict");
    }

    @Test
    @DisplayName("should return the same instance on every lookup")
    void shouldBeStable() {
        assertThat(ErrorMessageCatalog.getByCode("RATE_LIMIT_EXCEEDED"))
                .isSameAs(ErrorMessageCatalog.getByCode("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    @DisplayName("should give every catalog entry a title, a message and an action")
    void shouldHaveCompleteEntries() {
        assertThat(ErrorMessageCatalog.getAllMessages()).isNotEmpty();
        ErrorMessageCatalog.getAllMessages().forEach((code, message) -> {
            assertThat(message.title()).as(code.name()).isNotBlank();
            assertThat(message.message()).as(code.name()).isNotBlank();
            assertThat(message.action()).as(code.name()).isNotBlank();
        });
    }
}
