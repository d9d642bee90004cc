package in.shopwire.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Business event as received by a client.
 */
public record ClientEvent(
    String type,
    String namespace,
    JsonNode payload,
    long timestamp
) {
}
