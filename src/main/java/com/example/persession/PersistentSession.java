package com.example.persession;

import com.example.persession.http.HttpEngine;
import com.example.persession.http.ReactorHttpEngine;
import com.example.persession.http.Redirects;
import com.example.persession.logging.SessionLogFile;
import com.example.persession.models.CacheEvent;
import com.example.persession.models.CacheType;
import com.example.persession.models.LoginResponse;
import com.example.persession.services.CachePolicy;
import com.example.persession.services.LoginEvaluator;
import com.example.persession.services.SessionCacheStore;
import com.example.persession.services.TooManyRedirectsException;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.ref.Cleaner;
import java.net.HttpCookie;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An HTTP session whose cookies, default headers and proxies survive process restarts,
 * with a login helper.
 *
 * <pre>{@code
 * try (PersistentSession session = PersistentSession.builder()
 *         .cacheFilePath(Paths.get("cache.json"))
 *         .build()) {
 *     if (!session.isLoggedIn("https://e.com/login")) {
 *         LoginResponse res = session.login("https://e.com/login", Map.of("user", "user", "password", "pass"));
 *         log.info("{}", res.getLoginStatus());
 *     }
 *     ResponseEntity<String> data = session.get("https://e.com/data");
 * }
 * }</pre>
 *
 * When the cache file is younger than the cache timeout, construction restores the
 * saved state, including the saved cache timeout and cache type. Explicit proxies and
 * user agent given to the builder are applied on top of restored state.
 *
 * The {@link CacheType} decides when the state is written. For {@link CacheType#AT_EXIT}
 * use try-with-resources: if the session is never closed, a save is only attempted when
 * the session is garbage collected, which may never happen before the JVM exits.
 *
 * Instances are not thread-safe. Callers sharing one across threads must serialize
 * access themselves. Nothing locks the cache file; two processes using the same path
 * overwrite each other, the last write wins.
 */
public class PersistentSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PersistentSession.class);

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:68.0) Gecko/20100101 Firefox/68.0";
    public static final Duration DEFAULT_CACHE_TIMEOUT = Duration.ofHours(1);
    public static final CacheType DEFAULT_CACHE_TYPE = CacheType.AFTER_EACH_LOGIN;
    static final int MAX_REDIRECTS = 30;

    private static final Cleaner CLEANER = Cleaner.create();

    private final SessionContext context;
    private final SessionCacheStore cacheStore;
    private final CachePolicy cachePolicy;
    private final LoginEvaluator loginEvaluator;
    private final HttpEngine engine;
    private final ExitHook exitHook;
    private final Cleaner.Cleanable cleanable;

    /**
     * @param cacheFilePath cache file; a new temporary file when null
     * @param cacheTimeout  maximum cache file age for it to be loaded; one hour when null
     * @param cacheType     when to save; {@link CacheType#AFTER_EACH_LOGIN} when null
     * @param proxies       proxy URLs keyed by scheme ("http", "https", "all"), merged over restored ones
     * @param userAgent     User-Agent header, set over any restored one; {@link #DEFAULT_USER_AGENT}
     *                      when null, and an empty value keeps the restored header
     * @param verbose       print debug logs on the console
     * @param engine        transport; reactor-netty when null
     * @param cacheStore    snapshot reader/writer; JSON files when null
     * @param clock         time source for cache expiry; system clock when null
     */
    @Builder
    private PersistentSession(Path cacheFilePath, Duration cacheTimeout, CacheType cacheType,
                              Map<String, String> proxies, String userAgent, boolean verbose,
                              HttpEngine engine, SessionCacheStore cacheStore, Clock clock) {
        SessionLogFile.init(verbose);
        this.cacheStore = cacheStore != null ? cacheStore : new SessionCacheStore();
        this.cachePolicy = new CachePolicy(clock != null ? clock : Clock.systemDefaultZone());
        this.context = new SessionContext(
                cacheFilePath != null ? cacheFilePath : allocateCacheFile(),
                cacheTimeout != null ? cacheTimeout : DEFAULT_CACHE_TIMEOUT,
                cacheType != null ? cacheType : DEFAULT_CACHE_TYPE);
        context.headers.set(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT);
        context.headers.set(HttpHeaders.ACCEPT, "*/*");

        loadSession();
        if (proxies != null) {
            context.proxies.putAll(proxies);
        }
        String effectiveUserAgent = userAgent != null ? userAgent : DEFAULT_USER_AGENT;
        if (StringUtils.isNotEmpty(effectiveUserAgent)) {
            context.headers.set(HttpHeaders.USER_AGENT, effectiveUserAgent);
        }

        this.engine = engine != null ? engine : new ReactorHttpEngine(context::getProxies);
        this.loginEvaluator = new LoginEvaluator(this::send);
        this.exitHook = new ExitHook(context, this.cacheStore, cachePolicy, this.engine);
        this.cleanable = CLEANER.register(this, exitHook);
    }

    /**
     * POSTs {@code payload} as a form to {@code url} and checks the result with
     * {@link #isLoggedIn(String)} on the same url.
     *
     * The login url doubles as the probe url: this works for sites whose login page
     * redirects (302) once the session is authenticated. Sites that signal a login
     * differently always produce {@link com.example.persession.models.LoginStatus#FAILURE}.
     */
    public LoginResponse login(String url, Map<String, String> payload) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        payload.forEach(form::add);
        return login(url, form, null);
    }

    public LoginResponse login(String url, MultiValueMap<String, String> payload, HttpHeaders extraHeaders) {
        LoginResponse response = loginEvaluator.login(url, payload, extraHeaders);
        if (response.isSuccess() && cachePolicy.shouldTriggerSave(context.cacheType, CacheEvent.loginSucceeded())) {
            cacheSession();
        }
        return response;
    }

    /**
     * @return true iff a GET of {@code loginUrl}, redirects disabled, answers 302 Found;
     * false without any request when {@code loginUrl} is null or empty
     */
    public boolean isLoggedIn(String loginUrl) {
        return loginEvaluator.isLoggedIn(loginUrl);
    }

    public ResponseEntity<String> get(String url) {
        return send(ClientRequest.create(HttpMethod.GET, URI.create(url)).build());
    }

    public ResponseEntity<String> post(String url, MultiValueMap<String, String> form) {
        return send(ClientRequest.create(HttpMethod.POST, URI.create(url))
                .body(BodyInserters.fromFormData(form))
                .build());
    }

    public ResponseEntity<String> send(ClientRequest request) {
        return send(request, true);
    }

    /**
     * Sends {@code request} with the session's cookies and default headers. Every hop of
     * a redirect chain is a separate exchange and is offered to the cache policy.
     *
     * @throws com.example.persession.services.SessionCacheException if a triggered save fails
     * @throws TooManyRedirectsException after {@value #MAX_REDIRECTS} redirects
     */
    public ResponseEntity<String> send(ClientRequest request, boolean followRedirects) {
        ResponseEntity<String> response = exchange(request);
        int redirects = 0;
        while (followRedirects) {
            URI location = Redirects.location(request, response);
            if (location == null) {
                break;
            }
            if (++redirects > MAX_REDIRECTS) {
                throw new TooManyRedirectsException(location, MAX_REDIRECTS);
            }
            log.debug("Following {} redirect to {}", response.getStatusCode().value(), location);
            request = Redirects.follow(request, response.getStatusCode().value(), location);
            response = exchange(request);
        }
        return response;
    }

    /**
     * Writes the session state to the cache file now, regardless of cache type.
     *
     * @throws com.example.persession.services.SessionCacheException if the file cannot be written
     */
    public void cacheSession() {
        log.info("Cache Session");
        cacheStore.write(context.cacheFilePath, context.snapshot());
    }

    /**
     * Saves the session if its cache type is {@link CacheType#AT_EXIT} and releases
     * the transport. Only the first call has an effect.
     */
    @Override
    public void close() {
        exitHook.saveOnExit();
        cleanable.clean();
    }

    public Path getCacheFilePath() {
        return context.cacheFilePath;
    }

    public Duration getCacheTimeout() {
        return context.cacheTimeout;
    }

    public CacheType getCacheType() {
        return context.cacheType;
    }

    public HttpHeaders getHeaders() {
        HttpHeaders copy = new HttpHeaders();
        context.headers.forEach((name, values) -> copy.put(name, new ArrayList<>(values)));
        return HttpHeaders.readOnlyHttpHeaders(copy);
    }

    public List<HttpCookie> getCookies() {
        return context.cookieJar.getCookies();
    }

    public Map<String, String> getProxies() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(context.proxies));
    }

    Runnable exitHook() {
        return exitHook;
    }

    private boolean loadSession() {
        log.info("Check session cache");
        if (!cachePolicy.shouldLoad(context.cacheFilePath, context.cacheTimeout)) {
            return false;
        }
        SessionCacheStore.ReadResult result = cacheStore.read(context.cacheFilePath);
        switch (result.getOutcome()) {
            case LOADED:
                context.adopt(result.getState());
                log.info("Cached session restored");
                return true;
            case CORRUPT:
                log.info("Cache file corrupted");
                return false;
            case NOT_FOUND:
            default:
                log.info("Cache file not found");
                return false;
        }
    }

    private ResponseEntity<String> exchange(ClientRequest request) {
        if (exitHook.isDone()) {
            throw new IllegalStateException("Session is closed");
        }
        URI uri = request.url();
        String cookieHeader = context.cookieJar.cookieHeader(uri);
        ClientRequest outbound = ClientRequest.from(request)
                .headers(headers -> {
                    context.headers.forEach((name, values) -> {
                        if (!headers.containsKey(name)) {
                            headers.put(name, new ArrayList<>(values));
                        }
                    });
                    if (cookieHeader != null && !headers.containsKey(HttpHeaders.COOKIE)) {
                        headers.set(HttpHeaders.COOKIE, cookieHeader);
                    }
                })
                .build();

        ResponseEntity<String> response = engine.exchange(outbound)
                .flatMap(clientResponse -> clientResponse.toEntity(String.class))
                .block();
        if (response == null) {
            throw new IllegalStateException("No response for " + request.method() + " " + uri);
        }
        context.cookieJar.store(uri, response.getHeaders());

        if (cachePolicy.shouldTriggerSave(context.cacheType, CacheEvent.requestSent(request.method().name()))) {
            cacheSession();
        }
        return response;
    }

    private static Path allocateCacheFile() {
        try {
            return Files.createTempFile(PersistentSession.class.getSimpleName(), ".dat");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not allocate a temporary cache file", e);
        }
    }

    /**
     * Saves on exit at most once, either from {@link #close()} or, as a fallback, when the
     * session becomes unreachable. Holds no reference to the session itself.
     */
    private static final class ExitHook implements Runnable {
        private final SessionContext context;
        private final SessionCacheStore cacheStore;
        private final CachePolicy cachePolicy;
        private final HttpEngine engine;
        private final AtomicBoolean done = new AtomicBoolean();

        ExitHook(SessionContext context, SessionCacheStore cacheStore, CachePolicy cachePolicy, HttpEngine engine) {
            this.context = context;
            this.cacheStore = cacheStore;
            this.cachePolicy = cachePolicy;
            this.engine = engine;
        }

        boolean isDone() {
            return done.get();
        }

        void saveOnExit() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            try {
                if (cachePolicy.shouldTriggerSave(context.cacheType, CacheEvent.scopeExit())) {
                    log.info("Cache Session");
                    cacheStore.write(context.cacheFilePath, context.snapshot());
                }
            } finally {
                engine.close();
            }
        }

        // Cleaner thread; nobody to report a failure to but the log
        @Override
        public void run() {
            try {
                saveOnExit();
            } catch (RuntimeException e) {
                log.error("Failed to save session on exit: {}", e.getMessage(), e);
            }
        }
    }
}
