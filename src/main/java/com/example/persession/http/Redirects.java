package com.example.persession.http;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.net.URI;
import java.util.Objects;

/**
 * Builds the next request of a redirect chain.
 */
public final class Redirects {

    private Redirects() {
    }

    /**
     * @return the absolute target of a 301/302/303/307/308 response, or null if
     * {@code response} is not a redirect or carries no Location header
     */
    public static URI location(ClientRequest request, ResponseEntity<?> response) {
        switch (response.getStatusCode().value()) {
            case 301:
            case 302:
            case 303:
            case 307:
            case 308:
                String location = response.getHeaders().getFirst(HttpHeaders.LOCATION);
                return location == null ? null : request.url().resolve(location);
            default:
                return null;
        }
    }

    /**
     * 302 and 303 switch to GET (HEAD stays HEAD), 301 switches POST to GET, 307 and
     * 308 repeat the request unchanged. Credentials are not forwarded to another host.
     */
    public static ClientRequest follow(ClientRequest request, int status, URI location) {
        HttpMethod method = request.method();
        boolean switchToGet = ((status == 302 || status == 303) && !HttpMethod.HEAD.equals(method))
                || (status == 301 && HttpMethod.POST.equals(method));
        boolean sameHost = Objects.equals(request.url().getHost(), location.getHost());

        ClientRequest.Builder builder = ClientRequest.from(request).url(location);
        if (switchToGet) {
            builder.method(HttpMethod.GET).body(BodyInserters.empty());
        }
        builder.headers(headers -> {
            // The session recomputes cookies for the new location
            headers.remove(HttpHeaders.COOKIE);
            if (switchToGet) {
                headers.remove(HttpHeaders.CONTENT_TYPE);
                headers.remove(HttpHeaders.CONTENT_LENGTH);
                headers.remove(HttpHeaders.TRANSFER_ENCODING);
            }
            if (!sameHost) {
                headers.remove(HttpHeaders.AUTHORIZATION);
            }
        });
        return builder.build();
    }
}
