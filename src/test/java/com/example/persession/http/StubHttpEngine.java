package com.example.persession.http;

import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Records every request and answers with a canned response.
 */
public class StubHttpEngine implements HttpEngine {
    private final List<ClientRequest> requests = new ArrayList<>();
    private final Function<ClientRequest, ClientResponse> responder;
    private boolean closed;

    public StubHttpEngine(Function<ClientRequest, ClientResponse> responder) {
        this.responder = responder;
    }

    public static StubHttpEngine status(HttpStatus status) {
        return new StubHttpEngine(request -> ClientResponse.create(status).build());
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        return Mono.just(responder.apply(request));
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<ClientRequest> getRequests() {
        return requests;
    }

    public ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public boolean isClosed() {
        return closed;
    }
}
