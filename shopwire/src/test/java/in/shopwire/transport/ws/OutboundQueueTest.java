package in.shopwire.transport.ws;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OutboundQueue.
 *
 * Tests:
 * - FIFO delivery, one send in flight
 * - Drop-oldest when full
 * - Slow consumer isolation
 * - close / finish semantics
 */
class OutboundQueueTest {

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void testFifoDelivery() {
        FakeWsTransport transport = new FakeWsTransport();
        OutboundQueue queue = new OutboundQueue("c1", transport, Runnable::run, 10);

        for (int i = 0; i < 5; i++) {
            assertEquals(OutboundQueue.OfferResult.QUEUED, queue.offer("f" + i));
        }

        assertEquals(List.of("f0", "f1", "f2", "f3", "f4"), transport.sentFrames());
        assertEquals(5, queue.getSentCount());
        assertEquals(0, queue.size());
    }

    @Test
    void testOneSendInFlight() {
        FakeWsTransport transport = new FakeWsTransport();
        transport.holdSends();
        OutboundQueue queue = new OutboundQueue("c1", transport, Runnable::run, 10);

        queue.offer("a");
        queue.offer("b");
        queue.offer("c");

        assertEquals(List.of("a"), transport.sentFrames(), "Only the first frame is handed to the socket");
        assertEquals(2, queue.size());

        transport.completeNext();
        assertEquals(List.of("a", "b"), transport.sentFrames());
        transport.completeNext();
        transport.completeNext();
        assertEquals(List.of("a", "b", "c"), transport.sentFrames());
        assertEquals(0, transport.heldCount());
    }

    @Test
    void testDropOldestWhenFull() {
        FakeWsTransport transport = new FakeWsTransport();
        transport.holdSends();
        OutboundQueue queue = new OutboundQueue("c1", transport, Runnable::run, 2);

        queue.offer("in-flight");
        assertEquals(OutboundQueue.OfferResult.QUEUED, queue.offer("old"));
        assertEquals(OutboundQueue.OfferResult.QUEUED, queue.offer("mid"));
        assertEquals(OutboundQueue.OfferResult.DROPPED_OLDEST, queue.offer("new"));

        assertEquals(2, queue.size());
        assertEquals(1, queue.getDroppedCount());

        transport.completeNext();
        transport.completeNext();
        transport.completeNext();
        assertEquals(List.of("in-flight", "mid", "new"), transport.sentFrames(), "'old' should have been dropped");
    }

    @Test
    void testSlowConsumerDoesNotBlockOthers() throws Exception {
        pool = Executors.newFixedThreadPool(2);
        FakeWsTransport slow = new FakeWsTransport();
        slow.holdSends();
        FakeWsTransport fast = new FakeWsTransport();
        OutboundQueue slowQueue = new OutboundQueue("slow", slow, pool, 4);
        OutboundQueue fastQueue = new OutboundQueue("fast", fast, pool, 4);

        for (int i = 0; i < 100; i++) {
            slowQueue.offer("s" + i);
            fastQueue.offer("f" + i);
        }

        long deadline = System.currentTimeMillis() + 2000;
        while (fastQueue.getSentCount() < 100 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(100, fastQueue.getSentCount(), "Fast consumer receives everything");
        assertTrue(slowQueue.size() <= 4, "Slow consumer's backlog stays bounded");
        assertTrue(slowQueue.getDroppedCount() >= 95, "Slow consumer drops its oldest frames");
    }

    @Test
    void testOfferAfterCloseRefused() {
        FakeWsTransport transport = new FakeWsTransport();
        transport.holdSends();
        OutboundQueue queue = new OutboundQueue("c1", transport, Runnable::run, 10);
        queue.offer("a");
        queue.offer("b");

        queue.close();

        assertTrue(queue.isClosed());
        assertEquals(0, queue.size(), "Pending frames discarded");
        assertEquals(OutboundQueue.OfferResult.CLOSED, queue.offer("c"));

        transport.completeNext();
        assertEquals(List.of("a"), transport.sentFrames(), "Nothing sent after close");
    }

    @Test
    void testFinishDeliversPendingThenRunsCallback() {
        FakeWsTransport transport = new FakeWsTransport();
        transport.holdSends();
        OutboundQueue queue = new OutboundQueue("c1", transport, Runnable::run, 10);
        AtomicBoolean finished = new AtomicBoolean(false);

        queue.offer("a");
        queue.offer("error-frame");
        queue.finish(() -> finished.set(true));

        assertFalse(finished.get(), "Callback waits for pending frames");
        assertEquals(OutboundQueue.OfferResult.CLOSED, queue.offer("late"));

        transport.completeNext();
        assertFalse(finished.get());
        transport.completeNext();
        assertTrue(finished.get(), "Callback runs once the queue is drained");
        assertEquals(List.of("a", "error-frame"), transport.sentFrames());
    }

    @Test
    void testFinishOnIdleQueueRunsImmediately() {
        OutboundQueue queue = new OutboundQueue("c1", new FakeWsTransport(), Runnable::run, 10);
        AtomicBoolean finished = new AtomicBoolean(false);

        queue.finish(() -> finished.set(true));

        assertTrue(finished.get());
    }

    @Test
    void testSendFailureClosesQueue() {
        FakeWsTransport transport = new FakeWsTransport();
        transport.failSends();
        OutboundQueue queue = new OutboundQueue("c1", transport, Runnable::run, 10);

        queue.offer("a");

        assertTrue(queue.isClosed());
        assertEquals(OutboundQueue.OfferResult.CLOSED, queue.offer("b"));
    }

    @Test
    void testConcurrentOffersKeepPerProducerOrder() throws Exception {
        pool = Executors.newFixedThreadPool(4);
        FakeWsTransport transport = new FakeWsTransport();
        OutboundQueue queue = new OutboundQueue("c1", transport, pool, 10_000);
        CountDownLatch done = new CountDownLatch(2);

        for (String producer : List.of("x", "y")) {
            new Thread(() -> {
                for (int i = 0; i < 500; i++) {
                    queue.offer(producer + i);
                }
                done.countDown();
            }).start();
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));

        long deadline = System.currentTimeMillis() + 5000;
        while (queue.getSentCount() < 1000 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        List<String> sent = transport.sentFrames();
        assertEquals(1000, sent.size());

        for (String producer : List.of("x", "y")) {
            List<Integer> sequence = new ArrayList<>();
            for (String frame : sent) {
                if (frame.startsWith(producer)) {
                    sequence.add(Integer.parseInt(frame.substring(1)));
                }
            }
            for (int i = 0; i < sequence.size(); i++) {
                assertEquals(i, sequence.get(i), "Frames from " + producer + " out of order");
            }
        }
    }
}
