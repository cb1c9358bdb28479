package com.example.persession.services;

import com.example.persession.models.LoginResponse;
import com.example.persession.models.LoginStatus;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.net.URI;

/**
 * Infers login state from redirect behaviour.
 *
 * The rule is a heuristic for sites that redirect an authenticated visitor away
 * from their login page: a GET of the login URL with redirects disabled answering
 * exactly 302 Found means "logged in". Any other status, including the other
 * redirect codes (301, 303, 307, 308), means "not logged in". Sites that do not
 * behave this way always come out as not logged in.
 */
public class LoginEvaluator {
    private static final Logger log = LoggerFactory.getLogger(LoginEvaluator.class);

    private final RequestSender sender;

    public LoginEvaluator(RequestSender sender) {
        this.sender = sender;
    }

    public boolean isLoggedIn(String loginUrl) {
        log.debug("Check login - {}", loginUrl);
        if (StringUtils.isEmpty(loginUrl)) {
            return false;
        }
        ClientRequest probe = ClientRequest.create(HttpMethod.GET, URI.create(loginUrl)).build();
        ResponseEntity<String> response = sender.send(probe, false);
        if (response.getStatusCode().value() == HttpStatus.FOUND.value()) {
            log.info("Is logged in");
            return true;
        }
        log.info("Is not logged in");
        return false;
    }

    /**
     * POSTs {@code payload} as a form to {@code url}, then probes the same {@code url}
     * with {@link #isLoggedIn(String)}. Reusing the login URL as the probe is deliberate:
     * the login page itself is expected to redirect once the session is authenticated.
     */
    public LoginResponse login(String url, MultiValueMap<String, String> payload, HttpHeaders extraHeaders) {
        log.info("Try to Login - {}", url);
        ClientRequest.Builder request = ClientRequest.create(HttpMethod.POST, URI.create(url))
                .body(BodyInserters.fromFormData(payload));
        if (extraHeaders != null) {
            request.headers(headers -> headers.addAll(extraHeaders));
        }
        ResponseEntity<String> response = sender.send(request.build(), true);

        if (isLoggedIn(url)) {
            return new LoginResponse(LoginStatus.SUCCESS, response);
        }
        return new LoginResponse(LoginStatus.FAILURE, response);
    }
}
