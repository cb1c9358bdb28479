package com.example.persession.services;

import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.ClientRequest;

/**
 * Blocking request execution through a session, so cookies and cache triggers apply.
 */
@FunctionalInterface
public interface RequestSender {
    ResponseEntity<String> send(ClientRequest request, boolean followRedirects);
}
