package com.example.persession.services;

import java.net.URI;

public class TooManyRedirectsException extends RuntimeException {
    public TooManyRedirectsException(URI lastLocation, int limit) {
        super("Exceeded " + limit + " redirects, last location: " + lastLocation);
    }
}
