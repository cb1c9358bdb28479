package com.example.persession.http;

import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

/**
 * The transport a session sends its requests through.
 *
 * An engine performs exactly one exchange per call and never follows redirects;
 * the session handles redirects itself so that cookies set on intermediate
 * responses end up in its jar.
 */
@FunctionalInterface
public interface HttpEngine {

    Mono<ClientResponse> exchange(ClientRequest request);

    /**
     * Releases pooled connections. The engine must not be used afterwards.
     */
    default void close() {
    }
}
