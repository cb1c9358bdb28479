package com.example.persession.models;

import com.example.persession.http.ProxySpec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to resume a session in another process: cookies, default
 * headers, proxies and the cache settings of the session that wrote it.
 *
 * The snapshot is written as JSON. {@link #validate()} is the gate a document
 * has to pass before it is adopted; anything that fails it is treated as a
 * corrupt cache.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionState {
    public static final int SCHEMA_VERSION = 2;

    private int schemaVersion;
    // Informational only; freshness is taken from the file's modification time
    private Instant savedAt;
    private List<StoredCookie> cookies = new ArrayList<>();
    private Map<String, List<String>> headers = new LinkedHashMap<>();
    private Map<String, String> proxies = new LinkedHashMap<>();
    private String cacheFilePath;
    private Duration cacheTimeout;
    private CacheType cacheType;

    /**
     * Checks the snapshot field by field.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public void validate() {
        if (schemaVersion != SCHEMA_VERSION) {
            throw new IllegalStateException("Unsupported schema version " + schemaVersion);
        }
        if (cacheType == null) {
            throw new IllegalStateException("Missing cache type");
        }
        if (cacheTimeout == null || cacheTimeout.isNegative()) {
            throw new IllegalStateException("Missing or negative cache timeout");
        }
        if (cookies == null || headers == null || proxies == null) {
            throw new IllegalStateException("Missing cookies, headers or proxies");
        }
        headers.forEach((name, values) -> {
            if (name == null || values == null || values.contains(null)) {
                throw new IllegalStateException("Invalid header entry: " + name);
            }
        });
        proxies.forEach((scheme, url) -> {
            if (scheme == null || url == null) {
                throw new IllegalStateException("Invalid proxy entry: " + scheme);
            }
            // an empty URL disables the proxy for that scheme
            try {
                if (!url.isEmpty()) {
                    ProxySpec.parse(url);
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid proxy entry: " + scheme, e);
            }
        });
        Instant now = Instant.now();
        for (StoredCookie cookie : cookies) {
            if (cookie == null) {
                throw new IllegalStateException("Null cookie entry");
            }
            try {
                cookie.toHttpCookie(now);
                cookie.origin();
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid cookie: " + e.getMessage(), e);
            }
        }
    }
}
