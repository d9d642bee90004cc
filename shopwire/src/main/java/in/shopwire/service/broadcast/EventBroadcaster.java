package in.shopwire.service.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import in.shopwire.domain.common.EventType;
import in.shopwire.domain.common.VisibilityMatrix;
import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.domain.event.DeliveryReport;
import in.shopwire.domain.event.RealtimeEvent;
import in.shopwire.metrics.RealtimeMetrics;
import in.shopwire.transport.ws.Connection;
import in.shopwire.transport.ws.ConnectionRegistry;
import in.shopwire.transport.ws.WireFrames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fans events out to the connections entitled to see them.
 *
 * - {@link #emit(RealtimeEvent)}: fan out on the caller's thread and report
 * - {@link #publish(RealtimeEvent)}: hand off to the dispatcher thread, FIFO, never waits
 *
 * Fan-out only enqueues onto each connection's bounded outbound queue, so a
 * slow socket cannot hold up the others. Failures are logged and counted,
 * never thrown back at the caller.
 */
public final class EventBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final ConnectionRegistry registry;
    private final RealtimeMetrics metrics;

    // Dispatcher queue (oldest dropped when full)
    private final BlockingQueue<Pending> queue;
    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "ws-broadcaster");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running = false;

    public EventBroadcaster(ConnectionRegistry registry, RealtimeMetrics metrics, int queueCapacity) {
        this.registry = registry;
        this.metrics = metrics;
        this.queue = new LinkedBlockingQueue<>(queueCapacity);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher.execute(this::dispatchLoop);
        log.info("EventBroadcaster started (queue capacity {})", queue.remainingCapacity() + queue.size());
    }

    /**
     * Stop accepting events. Events already queued are still dispatched, then
     * the dispatcher thread exits.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }

        List<Pending> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        for (Pending pending : leftover) {
            pending.future.complete(DeliveryReport.rejected(pending.event.type().wireName()));
        }
        log.info("EventBroadcaster stopped ({} queued events discarded)", leftover.size());
    }

    public boolean isRunning() {
        return running;
    }

    // ═══════════════════════════════════════════════════════════════
    // Entry points
    // ═══════════════════════════════════════════════════════════════

    /**
     * Fan out now, on the calling thread. Non-blocking: sockets are written by
     * the delivery pool.
     */
    public DeliveryReport emit(RealtimeEvent event) {
        if (event == null) {
            return DeliveryReport.rejected("null");
        }
        try {
            DeliveryReport report = fanOut(event);
            metrics.recordBroadcast(report);
            return report;
        } catch (Exception e) {
            log.error("Broadcast of {} failed", event.type().wireName(), e);
            DeliveryReport report = DeliveryReport.rejected(event.type().wireName());
            metrics.recordBroadcast(report);
            return report;
        }
    }

    /**
     * Emit by wire type name, for relays that only have strings. Unknown types
     * are logged and discarded.
     */
    public DeliveryReport emit(String type, JsonNode payload, String targetUserId) {
        Optional<EventType> eventType = EventType.fromWire(type);
        if (eventType.isEmpty()) {
            log.warn("Discarding event of unknown type '{}'", type);
            DeliveryReport report = DeliveryReport.rejected(String.valueOf(type));
            metrics.recordBroadcast(report);
            return report;
        }
        return emit(new RealtimeEvent(eventType.get(), payload, targetUserId, null, System.currentTimeMillis()));
    }

    /**
     * Queue for the dispatcher thread. Events are fanned out in publish order.
     * When the queue is full the oldest pending event is dropped and its future
     * completes with a rejected report.
     */
    public CompletableFuture<DeliveryReport> publish(RealtimeEvent event) {
        CompletableFuture<DeliveryReport> future = new CompletableFuture<>();
        if (event == null) {
            future.complete(DeliveryReport.rejected("null"));
            return future;
        }
        if (!running) {
            log.warn("Broadcaster not running, discarding {}", event.type().wireName());
            future.complete(DeliveryReport.rejected(event.type().wireName()));
            return future;
        }

        Pending pending = new Pending(event, future);
        while (!queue.offer(pending)) {
            Pending oldest = queue.poll();
            if (oldest != null) {
                metrics.recordBroadcastQueueOverflow();
                log.warn("Broadcast queue full, dropped {}", oldest.event.type().wireName());
                oldest.future.complete(DeliveryReport.rejected(oldest.event.type().wireName()));
            }
        }

        // stop() may have drained the queue between the running check and the offer
        if (!running && queue.remove(pending)) {
            log.warn("Broadcaster stopped while publishing, discarding {}", event.type().wireName());
            future.complete(DeliveryReport.rejected(event.type().wireName()));
        }
        return future;
    }

    // ═══════════════════════════════════════════════════════════════
    // Fan-out
    // ═══════════════════════════════════════════════════════════════

    private DeliveryReport fanOut(RealtimeEvent event) {
        String frame = WireFrames.event(event);
        int eligible = 0;
        int delivered = 0;
        int dropped = 0;
        int skipped = 0;

        for (Connection connection : registry.connectionsFor(event.namespace())) {
            ConnectionIdentity identity = connection.getIdentity();
            if (identity == null || !VisibilityMatrix.canSee(identity, event)) {
                continue;
            }
            eligible++;

            if (connection.isRemoved()) {
                skipped++;
                continue;
            }

            try {
                switch (connection.send(frame)) {
                    case QUEUED:
                        delivered++;
                        break;
                    case DROPPED_OLDEST:
                        delivered++;
                        dropped++;
                        break;
                    case CLOSED:
                    default:
                        skipped++;
                        break;
                }
            } catch (RuntimeException e) {
                skipped++;
                log.debug("Enqueue to {} failed: {}", connection.getId(), e.toString());
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Broadcast {}{}: eligible={}, delivered={}, dropped={}, skipped={}",
                event.type().wireName(),
                event.isTargeted() ? " (target=" + event.targetUserId() + ")" : "",
                eligible, delivered, dropped, skipped);
        }
        return new DeliveryReport(event.type().wireName(), true, eligible, delivered, dropped, skipped);
    }

    private void dispatchLoop() {
        while (running || !queue.isEmpty()) {
            Pending pending;
            try {
                pending = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (pending == null) {
                continue;
            }
            pending.future.complete(emit(pending.event));
        }
    }

    private static final class Pending {
        final RealtimeEvent event;
        final CompletableFuture<DeliveryReport> future;

        Pending(RealtimeEvent event, CompletableFuture<DeliveryReport> future) {
            this.event = event;
            this.future = future;
        }
    }
}
