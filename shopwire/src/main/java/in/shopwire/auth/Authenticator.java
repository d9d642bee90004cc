package in.shopwire.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.common.RealtimeException;
import in.shopwire.domain.common.Role;
import in.shopwire.domain.connection.AuthCredential;
import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.metrics.RealtimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a client credential into a {@link ConnectionIdentity}.
 *
 * Checks, in order: user id, role, expiry, then the session store. The store
 * lookup is bounded by the configured timeout.
 */
public final class Authenticator {
    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SessionValidator sessionValidator;
    private final Duration timeout;
    private final Clock clock;
    private final RealtimeMetrics metrics;

    public Authenticator(SessionValidator sessionValidator, Duration timeout, Clock clock, RealtimeMetrics metrics) {
        this.sessionValidator = sessionValidator;
        this.timeout = timeout;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Validate a credential without blocking the caller.
     *
     * The future completes exceptionally with a {@link RealtimeException}
     * (UNAUTHENTICATED, SESSION_EXPIRED, SESSION_REVOKED, AUTH_TIMEOUT or ADMISSION_REJECTED).
     */
    public CompletableFuture<ConnectionIdentity> authenticateAsync(AuthCredential credential) {
        Instant started = clock.instant();
        ConnectionIdentity identity;
        try {
            identity = checkCredential(credential, started);
        } catch (RealtimeException e) {
            record(false, started);
            log.debug("Authentication rejected: {} ({})", e.getCode(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Boolean> lookup;
        try {
            lookup = sessionValidator.isValid(identity.userId(), identity.sessionId());
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }

        return lookup
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((valid, error) -> {
                if (error != null) {
                    record(false, started);
                    throw translate(error, identity.userId());
                }
                if (!Boolean.TRUE.equals(valid)) {
                    record(false, started);
                    log.info("Authentication rejected: session revoked (user={})", identity.userId());
                    throw new RealtimeException(ErrorCode.SESSION_REVOKED);
                }
                record(true, started);
                return identity;
            });
    }

    /**
     * Blocking variant for request/response callers such as {@code GET /stats}.
     */
    public ConnectionIdentity authenticate(AuthCredential credential) {
        try {
            return authenticateAsync(credential).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RealtimeException) {
                throw (RealtimeException) e.getCause();
            }
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Authentication failed", e.getCause());
        }
    }

    /**
     * Decode an {@code Authorization: Bearer} value: base64url JSON with the same
     * fields as an auth frame's data.
     */
    public static AuthCredential parseBearer(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith("Bearer ")) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Missing bearer token");
        }
        String token = authorizationHeader.substring("Bearer ".length()).trim();
        try {
            byte[] json = Base64.getUrlDecoder().decode(token);
            JsonNode data = MAPPER.readTree(new String(json, StandardCharsets.UTF_8));
            return AuthCredential.fromJson(data);
        } catch (Exception e) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Malformed bearer token", e);
        }
    }

    /**
     * Inverse of {@link #parseBearer} without the scheme prefix. Used by clients and tests.
     */
    public static String encodeBearer(AuthCredential credential) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(credential);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encode credential", e);
        }
    }

    private ConnectionIdentity checkCredential(AuthCredential credential, Instant now) {
        if (credential == null || credential.userId() == null || credential.userId().isBlank()) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Missing user id");
        }
        if (credential.sessionId() == null || credential.sessionId().isBlank()) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Missing session id");
        }
        Role role = Role.fromWire(credential.role())
            .orElseThrow(() -> new RealtimeException(ErrorCode.UNAUTHENTICATED, "Unknown role: " + credential.role()));
        if (credential.expiresAt() == null) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Missing session expiry");
        }
        Instant expiresAt = Instant.ofEpochMilli(credential.expiresAt());
        if (!expiresAt.isAfter(now)) {
            throw new RealtimeException(ErrorCode.SESSION_EXPIRED);
        }
        return new ConnectionIdentity(credential.userId(), role, credential.sessionId(), expiresAt);
    }

    private RealtimeException translate(Throwable error, String userId) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RealtimeException) {
            return (RealtimeException) cause;
        }
        if (cause instanceof TimeoutException) {
            log.warn("Session store did not answer within {}ms (user={})", timeout.toMillis(), userId);
            return new RealtimeException(ErrorCode.AUTH_TIMEOUT);
        }
        log.warn("Session store lookup failed (user={}): {}", userId, cause.toString());
        return new RealtimeException(ErrorCode.ADMISSION_REJECTED, "Session store unavailable", cause);
    }

    private void record(boolean success, Instant started) {
        metrics.recordAuthentication(success, Duration.between(started, clock.instant()));
    }
}
