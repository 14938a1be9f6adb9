package fr.lapetina.taskflow.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Trusts identity headers set by an upstream gateway that already verified the token.
 *
 * The gateway proves itself with a shared secret in {@value #GATEWAY_SECRET_HEADER}.
 * Without a configured secret, or when the header does not match, every caller
 * is anonymous whatever identity headers it sends.
 */
public final class HeaderRequestAuthenticator implements RequestAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(HeaderRequestAuthenticator.class);

    public static final String GATEWAY_SECRET_HEADER = "x-gateway-secret";
    public static final String USER_ID_HEADER = "x-user-id";
    public static final String USER_EMAIL_HEADER = "x-user-email";
    public static final String USER_ROLE_HEADER = "x-user-role";

    private final Supplier<String> gatewaySecret;

    public HeaderRequestAuthenticator(Supplier<String> gatewaySecret) {
        this.gatewaySecret = gatewaySecret;
    }

    @Override
    public Optional<AuthenticatedUser> authenticate(Map<String, String> headers) {
        String userId = headers.get(USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        if (!fromGateway(headers.get(GATEWAY_SECRET_HEADER))) {
            log.warn("Ignoring identity headers without a valid gateway secret: userId={}", userId);
            return Optional.empty();
        }
        return Optional.of(new AuthenticatedUser(
                userId.trim(),
                headers.get(USER_EMAIL_HEADER),
                headers.getOrDefault(USER_ROLE_HEADER, "user")
        ));
    }

    private boolean fromGateway(String presented) {
        String expected = gatewaySecret.get();
        if (expected == null || expected.isEmpty() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
