package sitecrawler;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

// Enforces a minimum interval between requests to the same host.
// One slot per host: requests to a host are serialized, different hosts do not block each other.
public class HostRateLimiter {

    private final long defaultIntervalNanos;
    private final LongSupplier nanoClock;
    private final Map<String, HostSlot> slots = new ConcurrentHashMap<>();

    public HostRateLimiter(Duration defaultInterval) {
        this(defaultInterval, System::nanoTime);
    }

    HostRateLimiter(Duration defaultInterval, LongSupplier nanoClock) {
        this.defaultIntervalNanos = Math.max(0, toNanosSaturated(defaultInterval));
        this.nanoClock = nanoClock;
    }

    // Raise (never lower) the host's interval, e.g. from a robots.txt Crawl-delay.
    public void raiseInterval(String host, Duration interval) {
        HostSlot slot = slotFor(host);
        slot.lock.lock();
        try {
            slot.minIntervalNanos = Math.max(slot.minIntervalNanos, toNanosSaturated(interval));
        } finally {
            slot.lock.unlock();
        }
    }

    public Duration intervalFor(String host) {
        HostSlot slot = slots.get(key(host));
        return Duration.ofNanos(slot == null ? defaultIntervalNanos : slot.minIntervalNanos);
    }

    /**
     * Blocks until the host's minimum interval has passed since its last request, then
     * stamps the current time as the host's last request.
     *
     * @return false if the sleeper gave up (crawl cancelled); no timestamp is recorded then
     */
    public boolean acquire(String host, Sleeper sleeper) throws InterruptedException {
        HostSlot slot = slotFor(host);
        slot.lock.lockInterruptibly();
        try {
            if (slot.hasRequested) {
                // elapsed first: last + interval can overflow for very long intervals
                long elapsedNanos = nanoClock.getAsLong() - slot.lastRequestNanos;
                long waitNanos = slot.minIntervalNanos - elapsedNanos;
                if (waitNanos > 0 && !sleeper.pause(Duration.ofNanos(waitNanos))) {
                    return false;
                }
            }
            slot.lastRequestNanos = nanoClock.getAsLong();
            slot.hasRequested = true;
            return true;
        } finally {
            slot.lock.unlock();
        }
    }

    private static long toNanosSaturated(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return d.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    private HostSlot slotFor(String host) {
        return slots.computeIfAbsent(key(host), k -> new HostSlot(defaultIntervalNanos));
    }

    private static String key(String host) {
        return host == null ? "" : host.toLowerCase(Locale.ROOT);
    }

    private static final class HostSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile long minIntervalNanos;
        private long lastRequestNanos;
        private boolean hasRequested;

        private HostSlot(long minIntervalNanos) {
            this.minIntervalNanos = minIntervalNanos;
        }
    }
}
