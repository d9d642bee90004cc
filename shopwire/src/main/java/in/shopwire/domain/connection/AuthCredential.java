package in.shopwire.domain.connection;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Credential presented by a client in its {@code auth} frame.
 * Fields are raw client input; the Authenticator decides whether they are acceptable.
 *
 * @param expiresAt session expiry as epoch milliseconds, may be null when the client omitted it
 */
public record AuthCredential(
    String userId,
    String role,
    String sessionId,
    Long expiresAt
) {
    /**
     * Read the {@code data} object of an auth frame. Missing or mistyped fields come back null.
     */
    public static AuthCredential fromJson(JsonNode data) {
        if (data == null || !data.isObject()) {
            return new AuthCredential(null, null, null, null);
        }
        JsonNode expiresAt = data.path("expiresAt");
        return new AuthCredential(
            text(data, "userId"),
            text(data, "role"),
            text(data, "sessionId"),
            expiresAt.canConvertToLong() && expiresAt.isNumber() ? expiresAt.asLong() : null
        );
    }

    private static String text(JsonNode data, String field) {
        JsonNode node = data.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
