package fr.lapetina.taskflow.api;

import fr.lapetina.taskflow.api.routing.Route;
import fr.lapetina.taskflow.api.routing.RouteContributor;
import fr.lapetina.taskflow.api.routing.RouteTable;
import fr.lapetina.taskflow.auth.AuthenticatedUser;
import fr.lapetina.taskflow.auth.CredentialVerifier;
import fr.lapetina.taskflow.domain.error.ErrorFactory;
import fr.lapetina.taskflow.domain.error.RequestValidationException;
import fr.lapetina.taskflow.domain.error.RequestValidationException.FieldError;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import fr.lapetina.taskflow.ratelimit.ClientKeys;
import fr.lapetina.taskflow.ratelimit.FailedAttemptTracker;
import fr.lapetina.taskflow.resilience.ResilienceContext;
import fr.lapetina.taskflow.resilience.RetryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Login endpoint: the one route that feeds the failed-attempt escalator.
 *
 * Credentials are checked by the external {@link CredentialVerifier}, retried and
 * guarded by the identity provider's circuit breaker. Rejected credentials record
 * a failure for the client key; accepted ones clear it.
 */
public final class AuthRoutes implements RouteContributor {

    private static final Logger log = LoggerFactory.getLogger(AuthRoutes.class);

    public static final String LOGIN_PATH = "/api/v1/auth/login";
    public static final String IDENTITY_PROVIDER = "identity-provider";

    private final CredentialVerifier verifier;
    private final FailedAttemptTracker tracker;
    private final ResilienceContext resilience;
    private final RetryOptions retryOptions;

    public AuthRoutes(CredentialVerifier verifier, FailedAttemptTracker tracker, ResilienceContext resilience) {
        this.verifier = verifier;
        this.tracker = tracker;
        this.resilience = resilience;
        this.retryOptions = resilience.retryOptions("auth.login");
    }

    @Override
    public void register(RouteTable routes) {
        routes.add(Route.of("POST", LOGIN_PATH, "login", (request, params) -> login(request)));
    }

    CompletableFuture<ApiResponse> login(ApiRequest request) {
        String email = request.bodyString("email");
        String password = request.bodyString("password");

        List<FieldError> missing = new ArrayList<>();
        if (email == null || email.isBlank()) {
            missing.add(new FieldError("email", "Email is required"));
        }
        if (password == null || password.isEmpty()) {
            missing.add(new FieldError("password", "Password is required"));
        }
        if (!missing.isEmpty()) {
            throw new RequestValidationException("Email and password are required", missing);
        }

        String clientKey = ClientKeys.escalatorKey(request.ip());
        return resilience
                .guarded(IDENTITY_PROVIDER, () -> verifier.verify(email, password), retryOptions)
                .thenApply(result -> onVerified(result, clientKey, email));
    }

    private ApiResponse onVerified(Optional<AuthenticatedUser> result, String clientKey, String email) {
        if (result.isEmpty()) {
            tracker.recordFailure(clientKey);
            log.warn("Login rejected: key={}, email={}", clientKey, email);
            throw ErrorFactory.invalidCredentials();
        }

        tracker.recordSuccess(clientKey);
        AuthenticatedUser user = result.get();
        log.info("Login succeeded: key={}, userId={}", clientKey, user.id());

        Map<String, Object> userView = new LinkedHashMap<>();
        userView.put("id", user.id());
        userView.put("email", user.email());
        userView.put("role", user.role());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", Map.of("user", userView));
        return ApiResponse.ok(body);
    }
}
