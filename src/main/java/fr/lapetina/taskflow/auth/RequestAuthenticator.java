package fr.lapetina.taskflow.auth;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the caller's identity from request headers.
 * Header names are lower-case.
 */
@FunctionalInterface
public interface RequestAuthenticator {

    Optional<AuthenticatedUser> authenticate(Map<String, String> headers);
}
