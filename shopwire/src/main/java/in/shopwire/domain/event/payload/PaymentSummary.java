package in.shopwire.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Payment outcome for an order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentSummary(
    String paymentId,
    String orderId,
    String customerId,
    BigDecimal amount,
    String currency,
    String method,
    String reason    // failure or refund reason
) {
}
