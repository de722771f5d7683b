package com.landrecords.ec.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Token and cookie bundle produced by the external login flow.
 *
 * @param authToken  opaque token sent as the {@code _append} header, may be null
 * @param cookies    cookies captured from the browser session, may be empty
 * @param acquiredAt wall-clock time the login completed
 * @param ttl        validity window, null means the configured default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionArtifact(String authToken, List<SessionCookie> cookies, Instant acquiredAt, Duration ttl) {

    public SessionArtifact {
        cookies = cookies == null ? List.of() : List.copyOf(cookies);
    }

    public boolean hasToken() {
        return authToken != null && !authToken.isBlank();
    }

    public boolean hasCookies() {
        return !cookies.isEmpty();
    }

    @JsonIgnore
    public boolean isUsable() {
        return hasToken() || hasCookies();
    }

    public SessionArtifact withDefaults(Instant now, Duration defaultTtl) {
        return new SessionArtifact(authToken, cookies,
                acquiredAt != null ? acquiredAt : now,
                ttl != null ? ttl : defaultTtl);
    }

    public boolean isExpiredAt(Instant now) {
        return Duration.between(acquiredAt, now).compareTo(ttl) > 0;
    }

    public String cookieHeader() {
        return cookies.stream()
                .map(c -> c.name() + "=" + c.value())
                .collect(Collectors.joining("; "));
    }

    public String tokenPreview() {
        if (!hasToken()) return "None";
        return authToken.length() <= 8 ? authToken : authToken.substring(0, 8) + "...";
    }
}
