package in.shopwire.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Operator-facing notice: notifications, alerts, maintenance windows.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SystemNotice(
    String title,
    String message,
    String severity,     // info | warning | error | success
    Long scheduledAt,    // maintenance start, epoch millis
    Long durationMinutes
) {
}
