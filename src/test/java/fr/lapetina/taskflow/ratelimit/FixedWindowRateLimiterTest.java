package fr.lapetina.taskflow.ratelimit;

import fr.lapetina.taskflow.infrastructure.store.InMemoryStateStore;
import fr.lapetina.taskflow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedWindowRateLimiterTest {

    private MutableClock clock;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        limiter = new FixedWindowRateLimiter(Map.of(
                "sensitive", policy("sensitive", 60_000, 5, false),
                "login", policy("login", 3_600_000, 10, true)
        ), new InMemoryStateStore<>(), clock);
    }

    @Test
    @DisplayName("should allow requests up to the limit and reject the next one")
    void shouldRejectAboveLimit() {
        for (int i = 1; i <= 5; i++) {
            RateLimitDecision decision = limiter.check("sensitive", "1.2.3.4");
            assertThat(decision.allowed()).isTrue();
            assertThat(decision.remaining()).isEqualTo(5 - i);
        }

        RateLimitDecision sixth = limiter.check("sensitive", "1.2.3.4");

        assertThat(sixth.allowed()).isFalse();
        assertThat(sixth.remaining()).isZero();
        assertThat(sixth.limit()).isEqualTo(5);
        assertThat(sixth.retryAfterSeconds()).isEqualTo(60);
    }

    @Test
    @DisplayName("should count each client key separately")
    void shouldIsolateClients() {
        for (int i = 0; i < 5; i++) {
            limiter.check("sensitive", "1.2.3.4");
        }

        assertThat(limiter.check("sensitive", "1.2.3.4").allowed()).isFalse();
        assertThat(limiter.check("sensitive", "5.6.7.8").allowed()).isTrue();
    }

    @Test
    @DisplayName("should start a fresh window once the previous one ended")
    void shouldResetAfterWindow() {
        for (int i = 0; i < 6; i++) {
            limiter.check("sensitive", "1.2.3.4");
        }

        clock.advance(Duration.ofSeconds(61));
        RateLimitDecision decision = limiter.check("sensitive", "1.2.3.4");

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(4);
        assertThat(decision.windowStartMs()).isEqualTo(clock.millis());
    }

    @Test
    @DisplayName("should report seconds until the window resets")
    void shouldReportResetSeconds() {
        RateLimitDecision decision = limiter.check("sensitive", "1.2.3.4");
        clock.advance(Duration.ofSeconds(20));

        assertThat(decision.resetSeconds(clock.millis())).isEqualTo(40);
    }

    @Test
    @DisplayName("should give back a refunded slot")
    void shouldRefundSlot() {
        for (int i = 0; i < 10; i++) {
            limiter.refund(limiter.check("login", "login:ada@example.com"));
        }

        assertThat(limiter.check("login", "login:ada@example.com").remaining()).isEqualTo(9);
    }

    @Test
    @DisplayName("should ignore a refund for a window that has already ended")
    void shouldIgnoreStaleRefund() {
        RateLimitDecision old = limiter.check("sensitive", "1.2.3.4");
        clock.advance(Duration.ofSeconds(61));
        limiter.check("sensitive", "1.2.3.4");

        limiter.refund(old);

        assertThat(limiter.check("sensitive", "1.2.3.4").remaining()).isEqualTo(3);
    }

    @Test
    @DisplayName("should fail on an unknown category")
    void shouldRejectUnknownCategory() {
        assertThatThrownBy(() -> limiter.check("unknown", "1.2.3.4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown");
    }

    @Test
    @DisplayName("should keep counters across a policy update")
    void shouldKeepCountersOnUpdate() {
        for (int i = 0; i < 3; i++) {
            limiter.check("sensitive", "1.2.3.4");
        }

        limiter.updatePolicies(Map.of("sensitive", policy("sensitive", 60_000, 3, false)));

        assertThat(limiter.check("sensitive", "1.2.3.4").allowed()).isFalse();
        assertThat(limiter.policy("login")).isEmpty();
    }

    @Test
    @DisplayName("should sweep expired windows only")
    void shouldSweepExpiredWindows() {
        limiter.check("sensitive", "old");
        clock.advance(Duration.ofSeconds(61));
        limiter.check("sensitive", "fresh");
        limiter.check("login", "login:1.2.3.4");

        assertThat(limiter.sweep()).isEqualTo(1);
        assertThat(limiter.check("sensitive", "fresh").remaining()).isEqualTo(3);
    }

    private static RateLimitPolicy policy(String category, long windowMs, int max, boolean skipSuccessful) {
        return new RateLimitPolicy(category, windowMs, max, KeyStrategy.CLIENT, skipSuccessful, false, false,
                "RATE_LIMIT_EXCEEDED", "Too many requests");
    }
}
