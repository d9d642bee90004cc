package in.shopwire.domain.event;

/**
 * Outcome of one fan-out.
 *
 * @param eventType wire name of the event, or the raw type string when it was rejected
 * @param accepted  false when the event never reached fan-out (unknown type, broadcaster stopped)
 * @param eligible  connections subscribed to the namespace and entitled to see the event
 * @param delivered frames enqueued on an outbound queue
 * @param dropped   older frames evicted from full outbound queues to make room
 * @param skipped   eligible connections that closed before the frame could be enqueued
 */
public record DeliveryReport(
    String eventType,
    boolean accepted,
    int eligible,
    int delivered,
    int dropped,
    int skipped
) {
    public static DeliveryReport rejected(String eventType) {
        return new DeliveryReport(eventType, false, 0, 0, 0, 0);
    }
}
