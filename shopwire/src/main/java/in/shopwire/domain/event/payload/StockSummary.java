package in.shopwire.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Stock level change for one product.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StockSummary(
    String productId,
    String productName,
    String sku,
    Integer previousStock,
    int newStock,
    Integer addedQuantity,   // restock events only
    Integer threshold,       // low-stock alerts only
    String severity          // "low" | "critical" on low-stock alerts
) {
    public static StockSummary update(String productId, String productName, String sku,
                                      int previousStock, int newStock) {
        return new StockSummary(productId, productName, sku, previousStock, newStock, null, null, null);
    }

    public StockSummary asAlert(int threshold, String severity) {
        return new StockSummary(productId, productName, sku, null, newStock, null, threshold, severity);
    }

    public StockSummary asOutOfStock() {
        return new StockSummary(productId, productName, sku, null, 0, null, null, null);
    }
}
