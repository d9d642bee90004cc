package in.shopwire.transport.ws;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window inbound frame limiter, one per connection.
 *
 * The window opens on the first counted frame and resets on the first frame
 * that arrives after it has fully elapsed.
 */
public final class FixedWindowRateLimiter {
    private final int maxEvents;
    private final long windowMs;
    private final Clock clock;

    private long windowStartMs = -1;
    private int count;

    public FixedWindowRateLimiter(int maxEvents, Duration window, Clock clock) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("Max events must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        this.maxEvents = maxEvents;
        this.windowMs = window.toMillis();
        this.clock = clock;
    }

    /**
     * Count one frame.
     *
     * @return true if the frame is within the limit
     */
    public synchronized boolean tryAcquire() {
        long now = clock.millis();
        if (windowStartMs < 0 || now - windowStartMs > windowMs) {
            windowStartMs = now;
            count = 0;
        }
        count++;
        return count <= maxEvents;
    }

    public synchronized int getCurrentCount() {
        return count;
    }

    public synchronized void reset() {
        windowStartMs = -1;
        count = 0;
    }
}
