package com.example.persession.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeFunctions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.ProxyProvider;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * {@link HttpEngine} over reactor-netty.
 *
 * Proxies are looked up per request from the session's current proxy map, so
 * changes to it apply to the next request. One exchange function is kept per
 * distinct proxy URL; all of them share a single connection pool.
 */
public class ReactorHttpEngine implements HttpEngine {
    private static final Logger log = LoggerFactory.getLogger(ReactorHttpEngine.class);
    private static final String DIRECT = "";

    private final Supplier<Map<String, String>> proxies;
    private final ConnectionProvider connectionProvider = ConnectionProvider.create("persession");
    private final Map<String, ExchangeFunction> exchangeFunctions = new ConcurrentHashMap<>();

    public ReactorHttpEngine(Supplier<Map<String, String>> proxies) {
        this.proxies = proxies;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        String proxyUrl = ProxySpec.select(proxies.get(), request.url());
        ExchangeFunction exchangeFunction = exchangeFunctions.computeIfAbsent(
                proxyUrl != null ? proxyUrl : DIRECT, this::createExchangeFunction);
        return exchangeFunction.exchange(request);
    }

    @Override
    public void close() {
        log.debug("Disposing connection pool");
        exchangeFunctions.clear();
        connectionProvider.dispose();
    }

    private ExchangeFunction createExchangeFunction(String proxyUrl) {
        // Redirects are followed by the session, hop by hop
        HttpClient httpClient = HttpClient.create(connectionProvider).followRedirect(false);
        if (!DIRECT.equals(proxyUrl)) {
            ProxySpec proxy = ProxySpec.parse(proxyUrl);
            log.debug("Using {} proxy {}:{}", proxy.getType(), proxy.getHost(), proxy.getPort());
            httpClient = httpClient.proxy(spec -> {
                ProxyProvider.Builder builder = spec.type(proxy.getType())
                        .host(proxy.getHost())
                        .port(proxy.getPort());
                if (proxy.getUsername() != null) {
                    builder.username(proxy.getUsername());
                }
                if (proxy.getPassword() != null) {
                    String password = proxy.getPassword();
                    builder.password(username -> password);
                }
            });
        }
        return ExchangeFunctions.create(new ReactorClientHttpConnector(httpClient))
                .filter(ExchangeLogging.filter());
    }
}
