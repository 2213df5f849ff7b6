package com.civica.service.resilience;

import com.civica.model.AnalysisResult;
import com.civica.provider.BackendOutcome;
import com.civica.provider.FailureKind;
import com.civica.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CircuitBreaker.
 */
class CircuitBreakerTest {

    private static final Duration OPEN_DURATION = Duration.ofSeconds(30);

    private MutableClock clock;
    private CircuitBreaker breaker;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        breaker = new CircuitBreaker("test", 5, OPEN_DURATION, clock);
        calls = new AtomicInteger();
    }

    private BackendOutcome fail() {
        return breaker.execute(() -> {
            calls.incrementAndGet();
            return BackendOutcome.failure(FailureKind.HTTP_5XX, "503");
        });
    }

    private BackendOutcome succeed() {
        return breaker.execute(() -> {
            calls.incrementAndGet();
            return BackendOutcome.success(new AnalysisResult());
        });
    }

    @Test
    void testOpensAfterThreshold() {
        for (int i = 0; i < 4; i++) {
            fail();
            assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        }

        fail();

        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(5, breaker.getFailureCount());
        assertEquals(clock.instant(), breaker.getLastFailureAt());
    }

    @Test
    void testOpenBreakerFailsFast() {
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(OPEN_DURATION.minusMillis(1));

        BackendOutcome outcome = fail();

        assertEquals(BackendOutcome.Status.REJECTED, outcome.getStatus());
        assertEquals(FailureKind.CIRCUIT_OPEN, outcome.getFailureKind());
        assertEquals(5, calls.get());
    }

    @Test
    void testTrialSuccessCloses() {
        for (int i = 0; i < 5; i++) {
            fail();
        }
        List<CircuitBreakerState> seen = new ArrayList<>();
        breaker.addListener((from, to) -> seen.add(to));
        clock.advance(OPEN_DURATION.plusMillis(1));

        BackendOutcome outcome = succeed();

        assertTrue(outcome.isSuccess());
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertEquals(List.of(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED), seen);
    }

    @Test
    void testTrialFailureReopensWithFreshStamp() {
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(OPEN_DURATION.plusSeconds(1));

        fail();

        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(clock.instant(), breaker.getLastFailureAt());

        clock.advance(OPEN_DURATION.minusSeconds(1));
        assertEquals(BackendOutcome.Status.REJECTED, succeed().getStatus());
    }

    @Test
    void testOnlyOneTrialInHalfOpen() {
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(OPEN_DURATION);

        Optional<CircuitBreaker.Permit> trial = breaker.tryAcquire();
        assertTrue(trial.isPresent());
        assertTrue(trial.get().isTrial());
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.tryAcquire().isEmpty());

        breaker.release(trial.get());
        assertTrue(breaker.tryAcquire().isPresent());
    }

    @Test
    void testLateFailureDoesNotOverrideTrial() {
        CircuitBreaker.Permit straggler = breaker.tryAcquire().orElseThrow();
        assertFalse(straggler.isTrial());
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(OPEN_DURATION);
        CircuitBreaker.Permit trial = breaker.tryAcquire().orElseThrow();

        breaker.recordFailure(straggler);
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.tryAcquire().isEmpty());

        breaker.recordSuccess(trial);
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
    }

    @Test
    void testLateSuccessDoesNotCloseHalfOpenBreaker() {
        CircuitBreaker.Permit straggler = breaker.tryAcquire().orElseThrow();
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(OPEN_DURATION);
        CircuitBreaker.Permit trial = breaker.tryAcquire().orElseThrow();

        breaker.recordSuccess(straggler);
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());

        breaker.recordFailure(trial);
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(clock.instant(), breaker.getLastFailureAt());
    }

    @Test
    void testStaleTrialIsIgnoredAfterReset() {
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(OPEN_DURATION);
        CircuitBreaker.Permit oldTrial = breaker.tryAcquire().orElseThrow();
        breaker.reset();
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(OPEN_DURATION);
        CircuitBreaker.Permit newTrial = breaker.tryAcquire().orElseThrow();

        breaker.recordSuccess(oldTrial);
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());

        breaker.recordSuccess(newTrial);
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }

    @Test
    void testSuccessResetsCounterWhileClosed() {
        fail();
        fail();
        succeed();

        assertEquals(0, breaker.getFailureCount());
        for (int i = 0; i < 4; i++) {
            fail();
        }
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }

    @Test
    void testUnavailableOutcomeDoesNotCount() {
        for (int i = 0; i < 10; i++) {
            breaker.execute(() -> BackendOutcome.unavailable(FailureKind.INTERRUPTED, "interrupted"));
        }

        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
    }

    @Test
    void testThrowingCallCountsAsFailure() {
        BackendOutcome outcome = breaker.execute(() -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(BackendOutcome.Status.FAILURE, outcome.getStatus());
        assertEquals(FailureKind.UNKNOWN, outcome.getFailureKind());
        assertEquals(1, breaker.getFailureCount());
    }

    @Test
    void testReset() {
        for (int i = 0; i < 5; i++) {
            fail();
        }

        breaker.reset();

        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertNull(breaker.getLastFailureAt());
    }
}
