package com.landrecords.ec.session;

import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.SessionArtifact;
import com.landrecords.ec.model.SessionState;
import com.landrecords.ec.model.ValidationResult;
import com.landrecords.ec.service.EcSearchApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the single session artifact for the process.
 *
 * EMPTY until an artifact with a token or cookies is supplied, then ACTIVE until either
 * its TTL lapses or the remote API answers 401. EXPIRED is terminal for the artifact;
 * only a new external login (another {@link #activate}) leaves it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionManager {

    private final EcSearchApiClient apiClient;
    private final EcSearchProperties properties;
    private final Clock clock;

    private SessionArtifact artifact;
    private SessionState state = SessionState.EMPTY;
    private String expiryReason;

    public synchronized void activate(SessionArtifact supplied) {
        if (supplied == null || !supplied.isUsable()) {
            throw new IllegalArgumentException("A session needs an auth token or at least one cookie");
        }
        Instant now = clock.instant();
        SessionArtifact candidate = supplied.withDefaults(now, properties.getSession().getTtl());
        if (candidate.isExpiredAt(now)) {
            throw new IllegalArgumentException("Session acquired at " + candidate.acquiredAt()
                    + " is already older than its TTL of " + candidate.ttl());
        }
        this.artifact = candidate;
        this.state = SessionState.ACTIVE;
        this.expiryReason = null;
        log.info("Session active (token: {}, cookies: {}, acquired {}, ttl {})",
                candidate.tokenPreview(), candidate.cookies().size(), candidate.acquiredAt(), candidate.ttl());
    }

    /** Run the external login capability and activate whatever it returns. */
    public SessionArtifact acquire(SessionAcquirer acquirer) {
        SessionArtifact acquired = acquirer.acquireSession();
        activate(acquired);
        return current();
    }

    public synchronized SessionState state() {
        if (state == SessionState.ACTIVE && artifact.isExpiredAt(clock.instant())) {
            expire("TTL of " + artifact.ttl() + " elapsed");
        }
        return state;
    }

    public boolean isActive() {
        return state() == SessionState.ACTIVE;
    }

    public synchronized SessionArtifact current() {
        return artifact;
    }

    /**
     * The live artifact, or an immediate failure telling the operator to log in again.
     */
    public synchronized SessionArtifact requireActive() {
        SessionState s = state();
        if (s == SessionState.EMPTY) {
            throw new SessionExpiredException("No session. Complete the external login first.");
        }
        if (s == SessionState.EXPIRED) {
            throw new SessionExpiredException("Session expired (" + expiryReason + "). Please login again.");
        }
        return artifact;
    }

    public synchronized void markExpired(String reason) {
        if (state == SessionState.ACTIVE) {
            expire(reason);
        }
    }

    /**
     * Probe the remote API with the current artifact. Success leaves the state untouched;
     * a 401 expires the session; other failures are reported without changing state.
     */
    public ValidationResult validate() {
        SessionArtifact live;
        synchronized (this) {
            SessionState s = state();
            if (s != SessionState.ACTIVE) {
                return new ValidationResult(false, s == SessionState.EMPTY
                        ? "No session loaded"
                        : "Session expired (" + expiryReason + ")");
            }
            live = artifact;
        }

        EcSearchApiClient.ProbeResult probe = apiClient.probe(live);
        switch (probe.status()) {
            case OK -> {
                return new ValidationResult(true, probe.message());
            }
            case UNAUTHORIZED -> {
                markExpired(probe.message());
                return new ValidationResult(false, probe.message());
            }
            default -> {
                log.warn("Session probe inconclusive: {}", probe.message());
                return new ValidationResult(false, probe.message());
            }
        }
    }

    public synchronized void clear() {
        artifact = null;
        state = SessionState.EMPTY;
        expiryReason = null;
    }

    /** Display-safe view of the session, token truncated. */
    public synchronized Map<String, Object> describe() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("state", state().name());
        info.put("hasToken", artifact != null && artifact.hasToken());
        info.put("tokenPreview", artifact == null ? "None" : artifact.tokenPreview());
        info.put("cookieCount", artifact == null ? 0 : artifact.cookies().size());
        info.put("acquiredAt", artifact == null ? "Never" : String.valueOf(artifact.acquiredAt()));
        if (expiryReason != null) {
            info.put("expiryReason", expiryReason);
        }
        return info;
    }

    private void expire(String reason) {
        state = SessionState.EXPIRED;
        expiryReason = reason;
        log.warn("Session expired: {}", reason);
    }
}
