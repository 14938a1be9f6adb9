package fr.lapetina.taskflow;

import fr.lapetina.taskflow.api.routing.RouteContributor;
import fr.lapetina.taskflow.auth.CredentialVerifier;
import fr.lapetina.taskflow.auth.RequestAuthenticator;

import java.util.List;

/**
 * External collaborators plugged into the pipeline: the identity store, the
 * caller identity resolver, and business route groups.
 *
 * A null authenticator selects {@link fr.lapetina.taskflow.auth.HeaderRequestAuthenticator}
 * with the gateway secret from the server configuration.
 */
public record Collaborators(
        CredentialVerifier credentialVerifier,
        RequestAuthenticator authenticator,
        List<RouteContributor> routes
) {
    public Collaborators {
        routes = routes != null ? List.copyOf(routes) : List.of();
    }

    /**
     * No identity store, gateway identity headers, no business routes.
     */
    public static Collaborators defaults() {
        return new Collaborators(CredentialVerifier.unconfigured(), null, List.of());
    }

    public Collaborators withCredentialVerifier(CredentialVerifier verifier) {
        return new Collaborators(verifier, authenticator, routes);
    }

    public Collaborators withRoutes(List<RouteContributor> extraRoutes) {
        return new Collaborators(credentialVerifier, authenticator, extraRoutes);
    }
}
