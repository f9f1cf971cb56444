package in.trendbook.infrastructure.execution;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private RetryPolicy policy(int maxAttempts) {
        return RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(350))
            .multiplier(2.0)
            .maxAttempts(maxAttempts)
            .sleeper(sleeps::add)
            .build();
    }

    @Test
    void testSucceedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> retried = new ArrayList<>();

        String result = policy(5).execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
            }
            return "ok";
        }, (attempt, cause) -> retried.add(attempt));

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(1, 2), retried);
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void testExhaustionWrapsLastFailure() {
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
            () -> policy(3).execute("placeOrder", () -> {
                throw new IllegalStateException("down " + calls.incrementAndGet());
            }, (attempt, cause) -> {}));

        assertEquals(3, calls.get());
        assertEquals(3, e.getAttempts());
        assertEquals("placeOrder", e.getOperation());
        assertEquals("down 3", e.getCause().getMessage());
        assertEquals(2, sleeps.size(), "no sleep after the final attempt");
    }

    @Test
    void testNonRetryableFailureRethrownImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> policy(5).execute("op", () -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad quantity");
        }, (attempt, cause) -> {}));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testCustomRetryPredicate() {
        RetryPolicy onlyState = RetryPolicy.builder()
            .retryOn(e -> e instanceof IllegalStateException)
            .sleeper(sleeps::add)
            .build();

        assertThrows(UnsupportedOperationException.class, () -> onlyState.execute("op", () -> {
            throw new UnsupportedOperationException();
        }, (attempt, cause) -> {}));
    }

    @Test
    void testInterruptedSleepStopsRetrying() {
        RetryPolicy interrupted = RetryPolicy.builder()
            .sleeper(d -> {
                throw new InterruptedException();
            })
            .build();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class, () -> interrupted.execute("op", () -> {
            throw new IllegalStateException("fail");
        }, (attempt, cause) -> {}));

        assertEquals(1, e.getAttempts());
        assertTrue(Thread.interrupted());
    }

    @Test
    void testBackoffIsCapped() {
        RetryPolicy p = policy(10);

        assertEquals(Duration.ofMillis(100), p.delayAfter(1));
        assertEquals(Duration.ofMillis(200), p.delayAfter(2));
        assertEquals(Duration.ofMillis(350), p.delayAfter(3));
        assertEquals(Duration.ofMillis(350), p.delayAfter(8));
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().multiplier(1.0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(10)).maxDelay(Duration.ofSeconds(1)).build());
    }

    @Test
    void testPresets() {
        assertEquals(3, RetryPolicy.forOrders().maxAttempts());
        assertEquals(5, RetryPolicy.forBootstrap().maxAttempts());
    }
}
