package in.shopwire.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Product catalog change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProductSummary(
    String productId,
    String productName,
    String category,
    BigDecimal price,
    BigDecimal previousPrice,   // price-change events only
    Map<String, Object> changes // update events only
) {
}
