package fr.lapetina.taskflow.domain.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SanitizerTest {

    @Test
    @DisplayName("should redact sensitive keys case-insensitively")
    void shouldRedactSensitiveKeys() {
        Map<String, Object> sanitized = Sanitizer.sanitize(Map.of(
                "email", "ada@example.com",
                "Password", "hunter2",
                "refreshToken", "abc",
                "apiKey", "k"
        ));

        assertThat(sanitized)
                .containsEntry("email", "ada@example.com")
                .containsEntry("Password", Sanitizer.REDACTED)
                .containsEntry("refreshToken", Sanitizer.REDACTED)
                .containsEntry("apiKey", Sanitizer.REDACTED);
    }

    @Test
    @DisplayName("should redact inside nested maps and lists")
    void shouldRedactNestedValues() {
        Map<String, Object> sanitized = Sanitizer.sanitize(Map.of(
                "user", Map.of("name", "Ada", "secret", "s"),
                "items", List.of(Map.of("authorization", "Bearer x"))
        ));

        assertThat(sanitized.get("user")).isEqualTo(Map.of("name", "Ada", "secret", Sanitizer.REDACTED));
        assertThat(sanitized.get("items")).isEqualTo(List.of(Map.of("authorization", Sanitizer.REDACTED)));
    }

    @Test
    @DisplayName("should return an empty map for null input")
    void shouldHandleNull() {
        assertThat(Sanitizer.sanitize(null)).isEmpty();
        assertThat(Sanitizer.isSensitive(null)).isFalse();
    }
}
