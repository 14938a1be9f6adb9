package fr.lapetina.taskflow.resilience;

import fr.lapetina.taskflow.domain.error.DatabaseErrorMapper;
import fr.lapetina.taskflow.domain.error.ErrorCode;
import fr.lapetina.taskflow.domain.error.ErrorFactory;
import fr.lapetina.taskflow.domain.error.StructuredError;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.taskflow.infrastructure.store.InMemoryStateStore;
import fr.lapetina.taskflow.support.MutableClock;
import fr.lapetina.taskflow.support.RecordingDelayScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private MutableClock clock;
    private RecordingDelayScheduler scheduler;
    private MetricsRegistry metrics;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        scheduler = RecordingDelayScheduler.immediate();
        metrics = new MetricsRegistry("test");
        executor = new RetryExecutor(scheduler, new InMemoryStateStore<>(), metrics, clock);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should return the first success without waiting")
    void shouldSucceedFirstTime() {
        String result = executor.withRetry(() -> CompletableFuture.completedFuture("done"), options("op")).join();

        assertThat(result).isEqualTo("done");
        assertThat(scheduler.requestedDelays()).isEmpty();
        assertThat(executor.getRecord("op")).isEmpty();
    }

    @Test
    @DisplayName("should make three attempts with doubling delays on retryable errors")
    void shouldBackOffExponentially() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor.withRetry(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(ErrorFactory.database("update", new SQLException("ECONNRESET")));
        }, options("tasks.update"));

        assertThatThrownBy(result::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOfSatisfying(StructuredError.class,
                        error -> assertThat(error.getCode()).isEqualTo(ErrorCode.DATABASE_ERROR));
        assertThat(calls).hasValue(3);
        assertThat(scheduler.requestedDelays()).containsExactly(100L, 200L);
        assertThat(executor.getRecord("tasks.update")).hasValueSatisfying(
                record -> assertThat(record.attempts()).isEqualTo(3));
    }

    @Test
    @DisplayName("should keep a constant delay without backoff")
    void shouldKeepConstantDelay() {
        RetryOptions constant = options("op").toBuilder().maxAttempts(4).backoff(false).build();

        executor.withRetry(() -> CompletableFuture.failedFuture(
                StructuredError.of(ErrorCode.EXTERNAL_SERVICE_ERROR, "down")), constant);

        assertThat(scheduler.requestedDelays()).containsExactly(100L, 100L, 100L);
    }

    @Test
    @DisplayName("should cap the doubled delay at the configured maximum")
    void shouldCapBackoff() {
        RetryOptions capped = options("op").toBuilder().maxAttempts(5).maxDelayMs(250).build();

        executor.withRetry(() -> CompletableFuture.failedFuture(
                StructuredError.of(ErrorCode.EXTERNAL_SERVICE_ERROR, "down")), capped);

        assertThat(scheduler.requestedDelays()).containsExactly(100L, 200L, 250L, 250L);
    }

    @Test
    @DisplayName("should saturate instead of overflowing when doubling huge delays")
    void shouldNotOverflow() {
        assertThat(RetryExecutor.doubled(Long.MAX_VALUE / 2 + 1, Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE);
        assertThat(RetryExecutor.doubled(Long.MAX_VALUE, 60_000)).isEqualTo(60_000);
        assertThat(RetryExecutor.doubled(1_000, 60_000)).isEqualTo(2_000);
    }

    @Test
    @DisplayName("should not retry a unique violation")
    void shouldNotRetryDuplicateEntry() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor.withRetry(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(DatabaseErrorMapper.map(
                    new SQLException("duplicate key value", DatabaseErrorMapper.UNIQUE_VIOLATION)));
        }, options("users.insert"));

        assertThatThrownBy(result::join)
                .cause()
                .isInstanceOfSatisfying(StructuredError.class, error -> {
                    assertThat(error.getCode()).isEqualTo(ErrorCode.DUPLICATE_ENTRY);
                    assertThat(error.getStatusCode()).isEqualTo(409);
                });
        assertThat(calls).hasValue(1);
        assertThat(scheduler.requestedDelays()).isEmpty();
    }

    @Test
    @DisplayName("should not retry raw exceptions with the default condition")
    void shouldNotRetryRawExceptions() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> result = executor.withRetry(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }, options("op"));

        assertThatThrownBy(result::join).cause().isInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("should succeed on a later attempt and clear the record")
    void shouldRecoverOnLaterAttempt() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.withRetry(() -> calls.incrementAndGet() < 3
                ? CompletableFuture.failedFuture(StructuredError.of(ErrorCode.NETWORK_ERROR, "flaky"))
                : CompletableFuture.completedFuture("third time"), options("flaky")).join();

        assertThat(result).isEqualTo("third time");
        assertThat(executor.getRecord("flaky")).isEmpty();
    }

    @Test
    @DisplayName("should honour a custom retry condition")
    void shouldUseCustomCondition() {
        AtomicInteger calls = new AtomicInteger();
        RetryOptions retryEverything = options("op").toBuilder().retryCondition(error -> true).build();

        executor.withRetry(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new RuntimeException("anything"));
        }, retryEverything);

        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("should sweep records older than the retention period")
    void shouldSweepOldRecords() {
        executor.withRetry(() -> CompletableFuture.failedFuture(new RuntimeException("x")), options("old"));
        clock.advance(Duration.ofHours(2));
        executor.withRetry(() -> CompletableFuture.failedFuture(new RuntimeException("x")), options("recent"));

        int removed = executor.sweep(Duration.ofHours(1).toMillis());

        assertThat(removed).isEqualTo(1);
        assertThat(executor.getRecord("old")).isEmpty();
        assertThat(executor.getRecord("recent")).isPresent();
    }

    private static RetryOptions options(String operationId) {
        return RetryOptions.builder()
                .maxAttempts(3)
                .delayMs(100)
                .backoff(true)
                .operationId(operationId)
                .build();
    }
}
