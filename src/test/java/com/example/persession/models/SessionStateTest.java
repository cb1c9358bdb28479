package com.example.persession.models;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.HttpCookie;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateTest {

    private SessionState state;

    @BeforeEach
    void setUp() {
        state = new SessionState();
        state.setSchemaVersion(SessionState.SCHEMA_VERSION);
        state.setCacheType(CacheType.AFTER_EACH_LOGIN);
        state.setCacheTimeout(Duration.ofHours(1));
    }

    @Test
    void minimalStateIsValid() {
        assertThatCode(state::validate).doesNotThrowAnyException();
    }

    @Test
    void missingCacheTypeIsRejected() {
        state.setCacheType(null);

        assertThatThrownBy(state::validate).isInstanceOf(IllegalStateException.class).hasMessageContaining("cache type");
    }

    @Test
    void negativeTimeoutIsRejected() {
        state.setCacheTimeout(Duration.ofSeconds(-1));

        assertThatThrownBy(state::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nullHeaderValueIsRejected() {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put("Accept", Arrays.asList("*/*", null));
        state.setHeaders(headers);

        assertThatThrownBy(state::validate).isInstanceOf(IllegalStateException.class).hasMessageContaining("Accept");
    }

    @Test
    void nullProxyUrlIsRejected() {
        Map<String, String> proxies = new HashMap<>();
        proxies.put("https", null);
        state.setProxies(proxies);

        assertThatThrownBy(state::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cookieWithoutValueIsRejected() {
        state.setCookies(List.of(StoredCookie.builder().name("sid").build()));

        assertThatThrownBy(state::validate).isInstanceOf(IllegalStateException.class).hasMessageContaining("cookie");
    }

    @Test
    void unparsableProxyUrlIsRejected() {
        state.setProxies(Map.of("https", "gopher://proxy.local:70"));

        assertThatThrownBy(state::validate).isInstanceOf(IllegalStateException.class).hasMessageContaining("https");
    }

    @Test
    void emptyProxyUrlIsAllowed() {
        state.setProxies(Map.of("http", "", "https", "socks5://proxy.local"));

        assertThatCode(state::validate).doesNotThrowAnyException();
    }

    @Test
    void cookieWithBadOriginIsRejected() {
        state.setCookies(List.of(StoredCookie.builder().name("sid").value("abc").originUri("http://bad host/").build()));

        assertThatThrownBy(state::validate).isInstanceOf(IllegalStateException.class).hasMessageContaining("cookie");
    }

    @Test
    void storedCookieMirrorsHttpCookie() {
        Instant received = Instant.parse("2024-05-01T10:00:00Z");
        HttpCookie cookie = new HttpCookie("sid", "abc");
        cookie.setDomain("example.com");
        cookie.setPath("/");
        cookie.setMaxAge(120);
        cookie.setSecure(true);
        cookie.setHttpOnly(true);

        StoredCookie stored = StoredCookie.from(cookie, URI.create("https://example.com/login"), received);
        HttpCookie rebuilt = stored.toHttpCookie(received.plusSeconds(20));

        assertThat(stored.getExpiresAt()).isEqualTo(received.plusSeconds(120));
        assertThat(stored.origin()).isEqualTo(URI.create("https://example.com/login"));
        assertThat(rebuilt).isEqualTo(cookie);
        assertThat(rebuilt.getValue()).isEqualTo("abc");
        assertThat(rebuilt.getMaxAge()).isEqualTo(100);
        assertThat(rebuilt.getSecure()).isTrue();
        assertThat(rebuilt.isHttpOnly()).isTrue();
    }

    @Test
    void sessionCookieNeverExpires() {
        StoredCookie stored = StoredCookie.from(new HttpCookie("sid", "abc"), null, Instant.now());

        assertThat(stored.getExpiresAt()).isNull();
        assertThat(stored.isExpired(Instant.now().plus(Duration.ofDays(365)))).isFalse();
        assertThat(stored.toHttpCookie(Instant.now()).getMaxAge()).isEqualTo(-1);
    }
}
