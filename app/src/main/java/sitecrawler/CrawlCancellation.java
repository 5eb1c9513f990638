package sitecrawler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Crawl-wide stop signal: an explicit {@link #cancel()} or an optional deadline.
 * Every blocking wait in the fetch pipeline goes through {@link #pause(Duration)} so it
 * ends as soon as the crawl is stopped.
 */
public final class CrawlCancellation implements Sleeper {

    private static final long NO_DEADLINE = Long.MIN_VALUE;

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile long deadlineNanos = NO_DEADLINE;

    public void cancel() {
        cancelled.countDown();
    }

    // Zero or negative means no deadline.
    public void armDeadline(Duration maxDuration) {
        if (maxDuration == null || maxDuration.isZero() || maxDuration.isNegative()) {
            deadlineNanos = NO_DEADLINE;
        } else {
            deadlineNanos = System.nanoTime() + maxDuration.toNanos();
        }
    }

    public boolean isCancelled() {
        if (cancelled.getCount() == 0) return true;
        long deadline = deadlineNanos;
        return deadline != NO_DEADLINE && System.nanoTime() - deadline >= 0;
    }

    @Override
    public boolean pause(Duration duration) throws InterruptedException {
        long waitNanos = duration.toNanos();
        long deadline = deadlineNanos;
        if (deadline != NO_DEADLINE) {
            waitNanos = Math.min(waitNanos, deadline - System.nanoTime());
        }
        if (waitNanos > 0 && cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
            return false;
        }
        return !isCancelled();
    }
}
