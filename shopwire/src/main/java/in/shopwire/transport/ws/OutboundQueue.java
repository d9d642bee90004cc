package in.shopwire.transport.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded per-connection send queue.
 *
 * At most one send is in flight per connection, so frames leave in the order
 * they were offered. When the queue is full the oldest pending frame is
 * dropped. A slow socket only ever fills its own queue.
 */
public final class OutboundQueue {
    private static final Logger log = LoggerFactory.getLogger(OutboundQueue.class);

    public enum OfferResult {
        QUEUED,
        DROPPED_OLDEST,
        CLOSED
    }

    private final String connectionId;
    private final WsTransport transport;
    private final Executor executor;
    private final int capacity;

    // Guarded by this
    private final Deque<String> pending = new ArrayDeque<>();
    private boolean inFlight;
    private boolean closed;
    private boolean discarding;
    private Runnable onDrained;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public OutboundQueue(String connectionId, WsTransport transport, Executor executor, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.connectionId = connectionId;
        this.transport = transport;
        this.executor = executor;
        this.capacity = capacity;
    }

    /**
     * Queue a frame for delivery. Never blocks.
     */
    public OfferResult offer(String frame) {
        boolean droppedOldest = false;
        boolean schedule = false;
        synchronized (this) {
            if (closed) {
                return OfferResult.CLOSED;
            }
            if (pending.size() >= capacity) {
                pending.pollFirst();
                droppedOldest = true;
            }
            pending.addLast(frame);
            if (!inFlight) {
                inFlight = true;
                schedule = true;
            }
        }
        if (droppedOldest) {
            dropped.incrementAndGet();
            log.debug("[{}] Outbound queue full, dropped oldest frame", connectionId);
        }
        if (schedule) {
            schedulePump();
        }
        return droppedOldest ? OfferResult.DROPPED_OLDEST : OfferResult.QUEUED;
    }

    /**
     * Discard pending frames and refuse new ones. The frame in flight, if any,
     * is left to the transport.
     */
    public void close() {
        synchronized (this) {
            closed = true;
            discarding = true;
            pending.clear();
        }
    }

    /**
     * Refuse new frames, deliver the pending ones, then run {@code then}.
     * Runs it right away when nothing is pending.
     */
    public void finish(Runnable then) {
        boolean runNow;
        synchronized (this) {
            closed = true;
            runNow = !inFlight;
            if (!runNow) {
                onDrained = then;
            }
        }
        if (runNow) {
            then.run();
        }
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public long getSentCount() {
        return sent.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    private void schedulePump() {
        try {
            executor.execute(this::sendNext);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Delivery executor rejected pump, closing queue", connectionId);
            abort();
        }
    }

    private void sendNext() {
        String frame;
        synchronized (this) {
            frame = discarding ? null : pending.pollFirst();
            if (frame == null) {
                inFlight = false;
            }
        }
        if (frame == null) {
            runDrained();
            return;
        }

        try {
            transport.send(frame, new WsTransport.SendCallback() {
                @Override
                public void onComplete() {
                    sent.incrementAndGet();
                    schedulePump();
                }

                @Override
                public void onError(Throwable error) {
                    log.debug("[{}] Send failed: {}", connectionId, error.toString());
                    abort();
                }
            });
        } catch (RuntimeException e) {
            log.warn("[{}] Transport threw on send: {}", connectionId, e.toString());
            abort();
        }
    }

    private void abort() {
        synchronized (this) {
            closed = true;
            discarding = true;
            pending.clear();
            inFlight = false;
        }
        runDrained();
    }

    private void runDrained() {
        Runnable then;
        synchronized (this) {
            then = onDrained;
            onDrained = null;
        }
        if (then != null) {
            try {
                then.run();
            } catch (RuntimeException e) {
                log.warn("[{}] Drain callback failed: {}", connectionId, e.toString());
            }
        }
    }
}
