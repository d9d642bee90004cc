package in.shopwire.auth;

import java.util.concurrent.CompletableFuture;

/**
 * Session-store lookup used during authentication.
 *
 * Implementations may answer asynchronously; the Authenticator bounds the wait.
 */
@FunctionalInterface
public interface SessionValidator {

    /**
     * @return future completing with true if the session is still valid for the user
     */
    CompletableFuture<Boolean> isValid(String userId, String sessionId);

    SessionValidator ALLOW_ALL = (userId, sessionId) -> CompletableFuture.completedFuture(true);
}
