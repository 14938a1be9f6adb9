package fr.lapetina.taskflow.integration;

import fr.lapetina.taskflow.api.AuthRoutes;
import fr.lapetina.taskflow.api.dto.ErrorResponseBody;
import fr.lapetina.taskflow.api.dto.RateLimitResponseBody;
import fr.lapetina.taskflow.auth.AuthenticatedUser;
import fr.lapetina.taskflow.disruptor.exception.BackpressureException;
import fr.lapetina.taskflow.domain.error.ErrorFactory;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import fr.lapetina.taskflow.resilience.CircuitBreakerState.State;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests through the Disruptor stages: routing, escalator gate,
 * fixed-window limiter and dispatch.
 * Configuration is externalized to test-config.yaml.
 */
class DisruptorPipelineIntegrationTest {

    private static final String CLIENT_IP = "10.0.0.5";
    private static final AuthenticatedUser ADMIN = new AuthenticatedUser("admin-1", "root@example.com", "admin");
    private static final AuthenticatedUser MEMBER = new AuthenticatedUser("user-2", "bob@example.com", "user");

    private TestPipelineFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestPipelineFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("should report UP health while every breaker is closed")
        void shouldReportHealth() throws Exception {
            ApiResponse response = send("GET", "/health", null, null);

            assertThat(response.status()).isEqualTo(200);
            assertThat(bodyMap(response)).containsEntry("status", "UP");
        }

        @Test
        @DisplayName("should render 404 for unknown paths")
        void shouldRenderNotFound() throws Exception {
            ApiResponse response = send("GET", "/api/v1/nothing-here", null, null);

            assertThat(response.status()).isEqualTo(404);
            assertThat(errorBody(response).getError().getCode()).isEqualTo("NOT_FOUND");
            assertThat(errorBody(response).isSuccess()).isFalse();
        }

        @Test
        @DisplayName("should render 405 when only another method matches")
        void shouldRenderMethodNotAllowed() throws Exception {
            ApiResponse response = send("DELETE", "/health", null, null);

            assertThat(response.status()).isEqualTo(405);
            assertThat(errorBody(response).getError().getCode()).isEqualTo("METHOD_NOT_ALLOWED");
        }

        @Test
        @DisplayName("should require authentication then an admin role on admin routes")
        void shouldGuardAdminRoutes() throws Exception {
            ApiResponse anonymous = send("GET", "/admin/circuit-breakers", null, null);
            ApiResponse member = send("GET", "/admin/circuit-breakers", null, MEMBER);
            ApiResponse admin = send("GET", "/admin/circuit-breakers", null, ADMIN);

            assertThat(anonymous.status()).isEqualTo(401);
            assertThat(errorBody(anonymous).getError().getCode()).isEqualTo("UNAUTHORIZED");
            assertThat(member.status()).isEqualTo(403);
            assertThat(errorBody(member).getError().getCode()).isEqualTo("INSUFFICIENT_PERMISSIONS");
            assertThat(admin.status()).isEqualTo(200);
        }
    }

    @Nested
    @DisplayName("login and escalator")
    class Login {

        @Test
        @DisplayName("should return the user on valid credentials")
        void shouldLogIn() throws Exception {
            ApiResponse response = login("alice@example.com", "s3cret");

            assertThat(response.status()).isEqualTo(200);
            assertThat(bodyMap(response)).containsEntry("success", true);
            assertThat(response.headers()).containsEntry("RateLimit-Limit", "10");
        }

        @Test
        @DisplayName("should reject wrong credentials with 401 and count the failure")
        void shouldRejectWrongCredentials() throws Exception {
            ApiResponse response = login("alice@example.com", "wrong");

            assertThat(response.status()).isEqualTo(401);
            assertThat(errorBody(response).getError().getCode()).isEqualTo("INVALID_CREDENTIALS");
            assertThat(factory.getTracker().blockStatus(CLIENT_IP).failureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should block the client after three failures without calling the identity store")
        void shouldBlockAfterThreeFailures() throws Exception {
            for (int i = 0; i < 3; i++) {
                assertThat(login("alice@example.com", "wrong-" + i).status()).isEqualTo(401);
            }

            ApiResponse blocked = login("alice@example.com", "s3cret");

            assertThat(blocked.status()).isEqualTo(429);
            assertThat(blocked.headers()).containsEntry("Retry-After", "300");
            RateLimitResponseBody.Detail error = ((RateLimitResponseBody) blocked.body()).getError();
            assertThat(error.getCode()).isEqualTo("TEMPORARILY_BLOCKED");
            assertThat(error.getRetryAfter()).isEqualTo(300);
            assertThat(error.getContext())
                    .containsEntry("failedAttempts", 3)
                    .containsEntry("blockRemainingSeconds", 300L);
            assertThat(factory.verifier().calls()).isEqualTo(3);
        }

        @Test
        @DisplayName("should block the address even when every attempt claims a different user")
        void shouldBlockRotatingIdentities() throws Exception {
            List<Integer> statuses = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                AuthenticatedUser claimed = new AuthenticatedUser("user-" + i, "u" + i + "@example.com", "user");
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("email", "alice@example.com");
                body.put("password", "wrong-" + i);
                statuses.add(send("POST", AuthRoutes.LOGIN_PATH, body, claimed).status());
            }

            assertThat(statuses).containsExactly(401, 401, 401, 429, 429, 429, 429, 429);
            assertThat(factory.getTracker().blockStatus(CLIENT_IP).failureCount()).isEqualTo(3);
            assertThat(factory.verifier().calls()).isEqualTo(3);
        }

        @Test
        @DisplayName("should let the client back in once the block expires and clear its record")
        void shouldUnblockAfterDuration() throws Exception {
            for (int i = 0; i < 3; i++) {
                login("alice@example.com", "wrong");
            }
            factory.clock().advance(Duration.ofMinutes(5).plusMillis(1));

            ApiResponse response = login("alice@example.com", "s3cret");

            assertThat(response.status()).isEqualTo(200);
            assertThat(factory.getTracker().blockStatus(CLIENT_IP).failureCount()).isZero();
        }

        @Test
        @DisplayName("should not consume login slots for successful logins")
        void shouldRefundSuccessfulLogins() throws Exception {
            for (int i = 0; i < 12; i++) {
                assertThat(login("alice@example.com", "s3cret").status()).isEqualTo(200);
            }
        }

        @Test
        @DisplayName("should apply the login window and escalate when it is exceeded")
        void shouldEnforceLoginWindow() throws Exception {
            for (int i = 0; i < 10; i++) {
                assertThat(login("alice@example.com", null).status()).isEqualTo(400);
            }

            ApiResponse limited = login("alice@example.com", null);

            assertThat(limited.status()).isEqualTo(429);
            assertThat(((RateLimitResponseBody) limited.body()).getError().getCode())
                    .isEqualTo("LOGIN_RATE_LIMIT_EXCEEDED");
            assertThat(limited.headers())
                    .containsEntry("RateLimit-Limit", "10")
                    .containsEntry("RateLimit-Remaining", "0")
                    .containsEntry("Retry-After", "3600");
            assertThat(factory.getTracker().blockStatus(CLIENT_IP).failureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report missing fields as a validation error")
        void shouldValidateBody() throws Exception {
            ApiResponse response = login("alice@example.com", null);

            assertThat(response.status()).isEqualTo(400);
            assertThat(errorBody(response).getError().getCode()).isEqualTo("VALIDATION_ERROR");
            assertThat(factory.verifier().calls()).isZero();
        }
    }

    @Nested
    @DisplayName("identity provider breaker")
    class IdentityProvider {

        @Test
        @DisplayName("should retry with backoff then open the breaker")
        void shouldOpenBreakerAfterRetries() throws Exception {
            factory.verifier().failWith(ErrorFactory.externalService(AuthRoutes.IDENTITY_PROVIDER,
                    new ConnectException("Connection refused")));

            ApiResponse response = login("alice@example.com", "s3cret");

            assertThat(response.status()).isEqualTo(503);
            assertThat(errorBody(response).getError().getCode()).isEqualTo("EXTERNAL_SERVICE_ERROR");
            assertThat(factory.verifier().calls()).isEqualTo(3);
            assertThat(factory.delays().requestedDelays()).containsExactly(10L, 20L);
            assertThat(factory.getBreakerRegistry().find(AuthRoutes.IDENTITY_PROVIDER))
                    .hasValueSatisfying(breaker -> assertThat(breaker.getState()).isEqualTo(State.OPEN));
        }

        @Test
        @DisplayName("should fail fast while open and recover after an admin reset")
        void shouldFailFastWhileOpen() throws Exception {
            factory.verifier().failWith(ErrorFactory.externalService(AuthRoutes.IDENTITY_PROVIDER,
                    new ConnectException("Connection refused")));
            login("alice@example.com", "s3cret");

            ApiResponse rejected = login("alice@example.com", "s3cret");
            assertThat(rejected.status()).isEqualTo(503);
            assertThat(factory.verifier().calls()).isEqualTo(3);
            assertThat(bodyMap(send("GET", "/health", null, null))).containsEntry("status", "DEGRADED");

            factory.verifier().accept("alice@example.com", "s3cret");
            ApiResponse reset = send("POST", "/admin/circuit-breakers/identity-provider/reset", null, ADMIN);

            assertThat(reset.status()).isEqualTo(200);
            assertThat(bodyMap(send("GET", "/health", null, null))).containsEntry("status", "UP");
            assertThat(login("alice@example.com", "s3cret").status()).isEqualTo(200);
        }

        @Test
        @DisplayName("should answer 503 when no identity store is wired in")
        void shouldFailWithoutIdentityStore() throws Exception {
            factory.verifier().failWith(ErrorFactory.externalService(AuthRoutes.IDENTITY_PROVIDER,
                    new IllegalStateException("No credential verifier configured")));

            ApiResponse response = login("alice@example.com", "s3cret");

            assertThat(response.status()).isEqualTo(503);
            assertThat(errorBody(response).getRecovery().getCircuitBreakerEnabled()).isTrue();
        }

        @Test
        @DisplayName("should 404 when resetting an unknown breaker")
        void shouldNotResetUnknownBreaker() throws Exception {
            ApiResponse response = send("POST", "/admin/circuit-breakers/payments/reset", null, ADMIN);

            assertThat(response.status()).isEqualTo(404);
            assertThat(errorBody(response).getError().getContext()).containsEntry("serviceId", "payments");
        }
    }

    @Nested
    @DisplayName("task store fallback")
    class TaskStore {

        @Test
        @DisplayName("should serve fresh tasks while the store is healthy")
        void shouldServeFreshTasks() throws Exception {
            ApiResponse response = send("GET", TestPipelineFactory.TASKS_PATH, null, MEMBER);

            assertThat(response.status()).isEqualTo(200);
            assertThat(bodyMap(response)).containsEntry("degraded", false);
            assertThat((List<?>) bodyMap(response).get("data")).hasSize(2);
            assertThat(factory.taskReads()).isEqualTo(1);
        }

        @Test
        @DisplayName("should serve the cached list after retries fail and keep serving it while the breaker is open")
        void shouldServeCachedTasks() throws Exception {
            factory.taskStoreDown(true);

            ApiResponse first = send("GET", TestPipelineFactory.TASKS_PATH, null, MEMBER);

            assertThat(first.status()).isEqualTo(200);
            assertThat(bodyMap(first))
                    .containsEntry("degraded", true)
                    .containsEntry("data", TestPipelineFactory.CACHED_TASKS);
            assertThat(factory.taskReads()).isEqualTo(3);
            assertThat(factory.getBreakerRegistry().find(TestPipelineFactory.TASK_STORE))
                    .hasValueSatisfying(breaker -> assertThat(breaker.getState()).isEqualTo(State.OPEN));

            ApiResponse second = send("GET", TestPipelineFactory.TASKS_PATH, null, MEMBER);

            assertThat(bodyMap(second)).containsEntry("degraded", true);
            assertThat(factory.taskReads()).isEqualTo(3);
            assertThat((String) send("GET", "/metrics", null, null).body())
                    .contains("taskflow_test_fallbacks_total");
        }
    }

    @Nested
    @DisplayName("rate limits and errors")
    class Limits {

        @Test
        @DisplayName("should cap sensitive operations at two per window")
        void shouldCapSensitiveOperations() throws Exception {
            assertThat(send("GET", "/admin/circuit-breakers", null, ADMIN).status()).isEqualTo(200);
            assertThat(send("GET", "/admin/circuit-breakers", null, ADMIN).status()).isEqualTo(200);

            ApiResponse limited = send("GET", "/admin/circuit-breakers", null, ADMIN);

            assertThat(limited.status()).isEqualTo(429);
            assertThat(((RateLimitResponseBody) limited.body()).getError().getCode())
                    .isEqualTo("SENSITIVE_OPERATION_RATE_LIMIT_EXCEEDED");
            assertThat(limited.headers()).containsEntry("Retry-After", "60");
        }

        @Test
        @DisplayName("should open a new window once the old one elapses")
        void shouldResetWindow() throws Exception {
            send("GET", "/admin/circuit-breakers", null, ADMIN);
            send("GET", "/admin/circuit-breakers", null, ADMIN);
            factory.clock().advance(Duration.ofSeconds(61));

            assertThat(send("GET", "/admin/circuit-breakers", null, ADMIN).status()).isEqualTo(200);
        }

        @Test
        @DisplayName("should map a unique violation to 409 without retrying")
        void shouldMapDuplicateEntry() throws Exception {
            ApiResponse response = send("POST", TestPipelineFactory.TASKS_PATH,
                    Map.of("title", "Write report"), MEMBER);

            assertThat(response.status()).isEqualTo(409);
            assertThat(errorBody(response).getError().getCode()).isEqualTo("DUPLICATE_ENTRY");
            assertThat(factory.taskInsertAttempts()).isEqualTo(1);
            assertThat(factory.getResilienceContext().retry().getRecord("tasks.create")).isPresent();
        }

        @Test
        @DisplayName("should expose error counters on the metrics endpoint")
        void shouldExposeMetrics() throws Exception {
            send("GET", "/api/v1/nothing-here", null, null);

            ApiResponse metrics = send("GET", "/metrics", null, null);

            assertThat(metrics.status()).isEqualTo(200);
            assertThat((String) metrics.body()).contains("taskflow_test_errors_total");
        }

        @Test
        @DisplayName("should process concurrent requests")
        void shouldProcessConcurrentRequests() throws Exception {
            int count = 20;
            List<CompletableFuture<ApiResponse>> futures = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                futures.add(factory.getPipeline().submit(request("GET", "/health", null, null)));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

            for (CompletableFuture<ApiResponse> future : futures) {
                assertThat(future.get().status()).isEqualTo(200);
            }
        }

        @Test
        @DisplayName("should refuse submissions once the pipeline is stopped")
        void shouldRefuseWhenStopped() {
            factory.getPipeline().close();

            assertThatThrownBy(() -> factory.getPipeline().submit(request("GET", "/health", null, null)))
                    .isInstanceOf(BackpressureException.class);
        }
    }

    private ApiResponse login(String email, String password) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        if (password != null) {
            body.put("password", password);
        }
        return send("POST", AuthRoutes.LOGIN_PATH, body, null);
    }

    private ApiResponse send(String method, String path, Map<String, Object> body, AuthenticatedUser user)
            throws Exception {
        return factory.getPipeline().submit(request(method, path, body, user)).get(5, TimeUnit.SECONDS);
    }

    private static ApiRequest request(String method, String path, Map<String, Object> body, AuthenticatedUser user) {
        return new ApiRequest("req_" + UUID.randomUUID(), method, path, Map.of(), Map.of(),
                body, CLIENT_IP, user, Instant.now());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> bodyMap(ApiResponse response) {
        return (Map<String, Object>) response.body();
    }

    private static ErrorResponseBody errorBody(ApiResponse response) {
        assertThat(response.body()).isInstanceOf(ErrorResponseBody.class);
        return (ErrorResponseBody) response.body();
    }
}
