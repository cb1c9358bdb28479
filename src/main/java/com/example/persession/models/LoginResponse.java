package com.example.persession.models;

import lombok.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;

/**
 * Result of a login attempt: the response of the login POST together with
 * the status inferred by probing the login URL afterwards.
 */
@Value
public class LoginResponse {
    LoginStatus loginStatus;
    ResponseEntity<String> response;

    public boolean isSuccess() {
        return loginStatus == LoginStatus.SUCCESS;
    }

    public HttpStatusCode getStatusCode() {
        return response.getStatusCode();
    }

    public String getBody() {
        return response.getBody();
    }
}
