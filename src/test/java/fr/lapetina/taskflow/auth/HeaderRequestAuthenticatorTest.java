package fr.lapetina.taskflow.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderRequestAuthenticatorTest {

    private static final String SECRET = "gateway-secret";

    private final HeaderRequestAuthenticator authenticator = new HeaderRequestAuthenticator(() -> SECRET);

    @Test
    @DisplayName("should build the user from gateway headers")
    void shouldReadHeaders() {
        AuthenticatedUser user = authenticator.authenticate(fromGateway(Map.of(
                "x-user-id", " 42 ",
                "x-user-email", "ada@example.com",
                "x-user-role", "Admin"
        ))).orElseThrow();

        assertThat(user.id()).isEqualTo("42");
        assertThat(user.email()).isEqualTo("ada@example.com");
        assertThat(user.isAdmin()).isTrue();
    }

    @Test
    @DisplayName("should default the role to user")
    void shouldDefaultRole() {
        AuthenticatedUser user = authenticator.authenticate(fromGateway(Map.of("x-user-id", "7"))).orElseThrow();

        assertThat(user.role()).isEqualTo("user");
        assertThat(user.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("should treat a missing or blank id as anonymous")
    void shouldBeAnonymousWithoutId() {
        assertThat(authenticator.authenticate(fromGateway(Map.of()))).isEmpty();
        assertThat(authenticator.authenticate(fromGateway(Map.of("x-user-id", " ")))).isEmpty();
    }

    @Test
    @DisplayName("should ignore identity headers without the gateway secret")
    void shouldIgnoreUnsignedHeaders() {
        Map<String, String> claimed = Map.of("x-user-id", "1", "x-user-role", "super_admin");
        Map<String, String> wrongSecret = new HashMap<>(claimed);
        wrongSecret.put(HeaderRequestAuthenticator.GATEWAY_SECRET_HEADER, "guess");

        assertThat(authenticator.authenticate(claimed)).isEmpty();
        assertThat(authenticator.authenticate(wrongSecret)).isEmpty();
    }

    @Test
    @DisplayName("should ignore identity headers when no gateway secret is configured")
    void shouldIgnoreHeadersWithoutConfiguredSecret() {
        HeaderRequestAuthenticator unconfigured = new HeaderRequestAuthenticator(() -> null);
        Map<String, String> headers = new HashMap<>(Map.of("x-user-id", "1", "x-user-role", "admin"));
        headers.put(HeaderRequestAuthenticator.GATEWAY_SECRET_HEADER, "");

        assertThat(unconfigured.authenticate(headers)).isEmpty();
    }

    private static Map<String, String> fromGateway(Map<String, String> headers) {
        Map<String, String> signed = new HashMap<>(headers);
        signed.put(HeaderRequestAuthenticator.GATEWAY_SECRET_HEADER, SECRET);
        return signed;
    }
}
