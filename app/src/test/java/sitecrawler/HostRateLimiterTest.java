package sitecrawler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HostRateLimiterTest {

    // Fake clock that only moves when the limiter sleeps.
    private final AtomicLong now = new AtomicLong(1_000_000_000L);
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = d -> {
        sleeps.add(d);
        now.addAndGet(d.toNanos());
        return true;
    };

    @Test
    void firstRequestToAHostDoesNotWait() throws Exception {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1), now::get);

        assertTrue(limiter.acquire("a.test", sleeper));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void waitsOutTheRemainderOfTheInterval() throws Exception {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1), now::get);

        limiter.acquire("a.test", sleeper);
        now.addAndGet(Duration.ofMillis(300).toNanos());
        limiter.acquire("a.test", sleeper);

        assertEquals(List.of(Duration.ofMillis(700)), sleeps);
    }

    @Test
    void hostsAreLimitedIndependently() throws Exception {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1), now::get);

        limiter.acquire("a.test", sleeper);
        limiter.acquire("b.test", sleeper);
        limiter.acquire("A.TEST", sleeper);

        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void raisedIntervalAppliesAndCannotBeLowered() throws Exception {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofMillis(500), now::get);
        limiter.raiseInterval("a.test", Duration.ofSeconds(2));
        limiter.raiseInterval("a.test", Duration.ofMillis(100));

        limiter.acquire("a.test", sleeper);
        limiter.acquire("a.test", sleeper);

        assertEquals(Duration.ofSeconds(2), limiter.intervalFor("a.test"));
        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
        assertEquals(Duration.ofMillis(500), limiter.intervalFor("other.test"));
    }

    @Test
    void enormousIntervalStillWaits() throws Exception {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1), now::get);
        limiter.raiseInterval("a.test", Duration.ofDays(365L * 1000));

        limiter.acquire("a.test", sleeper);
        limiter.acquire("a.test", sleeper);

        assertEquals(1, sleeps.size());
        assertTrue(sleeps.get(0).compareTo(Duration.ofDays(365)) > 0);
    }

    @Test
    void givesUpWhenTheSleeperIsCancelled() throws Exception {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1), now::get);
        CrawlCancellation cancellation = new CrawlCancellation();
        cancellation.cancel();

        assertTrue(limiter.acquire("a.test", cancellation));
        assertFalse(limiter.acquire("a.test", cancellation));
    }

    @Test
    void sameHostRequestsAreSerializedAcrossThreads() throws Exception {
        HostRateLimiter limiter = new HostRateLimiter(Duration.ofMillis(50));
        CrawlCancellation cancellation = new CrawlCancellation();

        long start = System.nanoTime();
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Thread t = new Thread(() -> {
                try {
                    limiter.acquire("a.test", cancellation);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            threads.add(t);
            t.start();
        }
        for (Thread t : threads) t.join();
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        // four requests to one host need at least three full intervals
        assertTrue(elapsedMillis >= 150, "four requests took only " + elapsedMillis + " ms");
    }
}
