package in.shopwire.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory session store that knows only about revoked sessions (logout).
 *
 * A revoked entry is kept until the session would have expired anyway;
 * after that the expiry check in the Authenticator rejects it on its own.
 */
public final class RevocationListSessionValidator implements SessionValidator {
    private static final Logger log = LoggerFactory.getLogger(RevocationListSessionValidator.class);

    private final Clock clock;

    // SessionId -> session expiry
    private final Map<String, Instant> revoked = new ConcurrentHashMap<>();

    public RevocationListSessionValidator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Boolean> isValid(String userId, String sessionId) {
        return CompletableFuture.completedFuture(sessionId != null && !revoked.containsKey(sessionId));
    }

    /**
     * Revoke a session (for logout).
     *
     * @param sessionExpiresAt when the session would have expired; the entry is pruned after that
     */
    public void revoke(String sessionId, Instant sessionExpiresAt) {
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        revoked.put(sessionId, sessionExpiresAt);
        log.info("Session revoked: {}", sessionId);
    }

    public boolean isRevoked(String sessionId) {
        return sessionId != null && revoked.containsKey(sessionId);
    }

    /**
     * Drop entries whose session has expired.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        Instant now = clock.instant();
        int before = revoked.size();
        revoked.entrySet().removeIf(e -> !e.getValue().isAfter(now));
        int removed = before - revoked.size();
        if (removed > 0) {
            log.debug("Pruned {} expired revocations", removed);
        }
        return removed;
    }

    public int size() {
        return revoked.size();
    }
}
