package in.shopwire.metrics;

import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.common.Role;
import in.shopwire.domain.event.DeliveryReport;

import java.time.Duration;

/**
 * Realtime server metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or anything else; {@link #NOOP}
 * is used where no metrics backend is wired (mostly tests).
 */
public interface RealtimeMetrics {

    /**
     * An authenticated connection entered the registry.
     */
    void recordConnectionOpened(Role role);

    /**
     * A registered connection left, for the given reason.
     */
    void recordConnectionClosed(Role role, String reason);

    /**
     * Handshake or admission refused before registration.
     */
    void recordAdmissionRejected(ErrorCode code);

    void recordAuthentication(boolean success, Duration latency);

    /**
     * Outcome of one broadcast fan-out.
     */
    void recordBroadcast(DeliveryReport report);

    void recordBroadcastQueueOverflow();

    void recordRateLimitHit();

    void recordProtocolViolation(ErrorCode code);

    void recordHeartbeatEviction();

    RealtimeMetrics NOOP = new RealtimeMetrics() {
        @Override public void recordConnectionOpened(Role role) {}
        @Override public void recordConnectionClosed(Role role, String reason) {}
        @Override public void recordAdmissionRejected(ErrorCode code) {}
        @Override public void recordAuthentication(boolean success, Duration latency) {}
        @Override public void recordBroadcast(DeliveryReport report) {}
        @Override public void recordBroadcastQueueOverflow() {}
        @Override public void recordRateLimitHit() {}
        @Override public void recordProtocolViolation(ErrorCode code) {}
        @Override public void recordHeartbeatEviction() {}
    };
}
