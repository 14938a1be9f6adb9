package fr.lapetina.taskflow.resilience;

import fr.lapetina.taskflow.domain.error.ErrorCode;
import fr.lapetina.taskflow.domain.error.StructuredError;
import fr.lapetina.taskflow.infrastructure.store.InMemoryStateStore;
import fr.lapetina.taskflow.resilience.CircuitBreakerState.State;
import fr.lapetina.taskflow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        // 3 failures to open, 100ms reset timeout, 2 successes to close
        circuitBreaker = new CircuitBreaker("payments", new CircuitBreakerPolicy(3, 100, 2),
                new InMemoryStateStore<>(), clock);
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(State.CLOSED);
        assertThat(circuitBreaker.allowRequest()).isTrue();
    }

    @Test
    @DisplayName("should pass results through while closed")
    void shouldPassThroughWhenClosed() {
        CompletableFuture<String> result = circuitBreaker.execute(() -> CompletableFuture.completedFuture("ok"));

        assertThat(result.join()).isEqualTo("ok");
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should open after threshold failures and fail fast without calling the operation")
    void shouldOpenAndFailFast() {
        for (int i = 0; i < 3; i++) {
            failOnce();
        }
        assertThat(circuitBreaker.getState()).isEqualTo(State.OPEN);

        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> rejected = circuitBreaker.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        });

        assertThat(calls).hasValue(0);
        assertThatThrownBy(rejected::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOfSatisfying(StructuredError.class, error -> {
                    assertThat(error.getCode()).isEqualTo(ErrorCode.EXTERNAL_SERVICE_ERROR);
                    assertThat(error.getStatusCode()).isEqualTo(503);
                    assertThat(error.getContext()).containsEntry("service", "payments");
                    assertThat(error.getRecoveryOptions()).hasValueSatisfying(
                            recovery -> assertThat(recovery.isCircuitBreakerEnabled()).isTrue());
                });
    }

    @Test
    @DisplayName("should count a synchronous throw as a failure")
    void shouldCountSynchronousThrow() {
        CompletableFuture<String> result = circuitBreaker.execute(() -> {
            throw new IllegalStateException("boom");
        });

        assertThat(result).isCompletedExceptionally();
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should transition to HALF_OPEN after recovery timeout and close after successes")
    void shouldRecoverThroughHalfOpen() {
        for (int i = 0; i < 3; i++) {
            failOnce();
        }
        clock.advance(Duration.ofMillis(150));

        circuitBreaker.execute(() -> CompletableFuture.completedFuture("trial")).join();
        assertThat(circuitBreaker.getState()).isEqualTo(State.HALF_OPEN);

        circuitBreaker.execute(() -> CompletableFuture.completedFuture("trial")).join();
        assertThat(circuitBreaker.getState()).isEqualTo(State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should reopen when a HALF_OPEN trial fails")
    void shouldReopenOnTrialFailure() {
        for (int i = 0; i < 3; i++) {
            failOnce();
        }
        clock.advance(Duration.ofMillis(150));

        failOnce();

        assertThat(circuitBreaker.getState()).isEqualTo(State.OPEN);
        assertThat(circuitBreaker.allowRequest()).isFalse();
    }

    @Test
    @DisplayName("should not leave OPEN just by reading the state")
    void shouldNotTransitionOnRead() {
        for (int i = 0; i < 3; i++) {
            failOnce();
        }
        clock.advance(Duration.ofMillis(150));

        assertThat(circuitBreaker.getState()).isEqualTo(State.OPEN);
    }

    @Test
    @DisplayName("should allow forcing state")
    void shouldAllowForcingState() {
        circuitBreaker.forceState(State.OPEN);
        assertThat(circuitBreaker.getState()).isEqualTo(State.OPEN);

        circuitBreaker.forceState(State.CLOSED);
        assertThat(circuitBreaker.getState()).isEqualTo(State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should expose stats with the policy thresholds")
    void shouldExposeStats() {
        failOnce();

        CircuitBreakerStats stats = circuitBreaker.getStats();

        assertThat(stats.serviceId()).isEqualTo("payments");
        assertThat(stats.state()).isEqualTo(State.CLOSED);
        assertThat(stats.failureCount()).isEqualTo(1);
        assertThat(stats.lastFailureTime()).isEqualTo(clock.instant());
        assertThat(stats.failureThreshold()).isEqualTo(3);
    }

    private void failOnce() {
        circuitBreaker.execute(() -> CompletableFuture.failedFuture(new RuntimeException("down")));
    }
}
