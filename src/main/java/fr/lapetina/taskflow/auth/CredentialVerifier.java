package fr.lapetina.taskflow.auth;

import fr.lapetina.taskflow.domain.error.ErrorFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Checks an email/password pair against the identity store.
 *
 * An empty result means the credentials were rejected; a failed future means the
 * identity store itself could not answer.
 */
@FunctionalInterface
public interface CredentialVerifier {

    CompletableFuture<Optional<AuthenticatedUser>> verify(String email, String password);

    /**
     * Verifier used when no identity store is wired in. Every call fails as an
     * unavailable dependency.
     */
    static CredentialVerifier unconfigured() {
        return (email, password) -> CompletableFuture.failedFuture(
                ErrorFactory.externalService("identity-provider",
                        new IllegalStateException("No credential verifier configured")));
    }
}
