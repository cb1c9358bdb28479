package com.example.persession.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Set;

/**
 * Debug logging of request and response lines with credential headers redacted.
 */
final class ExchangeLogging {
    private static final Logger log = LoggerFactory.getLogger(ExchangeLogging.class);

    static final String REDACTED = "###REDACTED###";

    private static final Set<String> SENSITIVE_HEADERS = Set.of(
            "cookie", "set-cookie", "authorization", "proxy-authorization");

    private ExchangeLogging() {
    }

    static ExchangeFilterFunction filter() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            if (log.isDebugEnabled()) {
                log.debug("Request: {} {}{}", request.method().name(), request.url(), describe(request.headers()));
            }
            return Mono.just(request);
        }).andThen(ExchangeFilterFunction.ofResponseProcessor(response -> {
            if (log.isDebugEnabled()) {
                log.debug("Response: {}{}", response.statusCode().value(), describe(response.headers().asHttpHeaders()));
            }
            return Mono.just(response);
        }));
    }

    static String describe(HttpHeaders headers) {
        StringBuilder builder = new StringBuilder();
        headers.forEach((name, values) -> {
            for (String value : values) {
                builder.append("\n  ").append(name).append(": ").append(redact(name, value));
            }
        });
        return builder.toString();
    }

    static String redact(String headerName, String value) {
        return SENSITIVE_HEADERS.contains(headerName.toLowerCase(Locale.ROOT)) ? REDACTED : value;
    }
}
