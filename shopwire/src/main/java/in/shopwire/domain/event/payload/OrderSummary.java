package in.shopwire.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Order fields pushed with order events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderSummary(
    String orderId,
    String orderNumber,
    String customerId,
    String status,
    String previousStatus,   // status-change events only
    BigDecimal total,
    Integer itemCount
) {
    public static OrderSummary deleted(String orderId) {
        return new OrderSummary(orderId, null, null, null, null, null, null);
    }
}
