package in.shopwire.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Storefront activity of a customer (browsing, cart, presence).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustomerActivity(
    String customerId,
    String customerName,
    String activity,
    String productId,
    String productName,
    Integer quantity,
    Boolean online
) {
}
