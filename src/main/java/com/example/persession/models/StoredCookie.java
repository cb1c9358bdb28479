package com.example.persession.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.net.HttpCookie;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Persisted form of a single cookie from the session's cookie jar.
 *
 * Expiry is stored as an absolute instant so a cookie keeps counting down while
 * the session sits on disk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredCookie {
    private String name;
    private String value;
    private String domain;
    private String path;
    // null for a session cookie
    private Instant expiresAt;
    private boolean secure;
    private boolean httpOnly;
    private int version;
    private String portlist;
    // URL of the response that set the cookie; null when unknown
    private String originUri;

    /**
     * @param origin    URL of the response that set the cookie, may be null
     * @param createdAt when the cookie was received; the max-age counts from here
     */
    public static StoredCookie from(HttpCookie cookie, URI origin, Instant createdAt) {
        return StoredCookie.builder()
                .name(cookie.getName())
                .value(cookie.getValue())
                .domain(cookie.getDomain())
                .path(cookie.getPath())
                .expiresAt(cookie.getMaxAge() < 0 ? null : createdAt.plusSeconds(cookie.getMaxAge()))
                .secure(cookie.getSecure())
                .httpOnly(cookie.isHttpOnly())
                .version(cookie.getVersion())
                .portlist(cookie.getPortlist())
                .originUri(origin != null ? origin.toString() : null)
                .build();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * @throws IllegalArgumentException if the origin is not a valid URI
     */
    public URI origin() {
        return originUri != null ? URI.create(originUri) : null;
    }

    /**
     * Rebuilds the cookie with the max-age left at {@code now}.
     *
     * @throws IllegalArgumentException if the name is not a legal cookie name
     */
    public HttpCookie toHttpCookie(Instant now) {
        if (name == null || value == null) {
            throw new IllegalArgumentException("Cookie name and value are required");
        }
        HttpCookie cookie = new HttpCookie(name, value);
        cookie.setDomain(domain);
        cookie.setPath(path);
        cookie.setMaxAge(expiresAt == null ? -1 : Math.max(0, Duration.between(now, expiresAt).getSeconds()));
        cookie.setSecure(secure);
        cookie.setHttpOnly(httpOnly);
        cookie.setVersion(version);
        cookie.setPortlist(portlist);
        return cookie;
    }
}
