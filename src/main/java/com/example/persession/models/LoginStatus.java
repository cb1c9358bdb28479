package com.example.persession.models;

public enum LoginStatus {
    SUCCESS("Login Successful"),
    FAILURE("Login Failed");

    private final String description;

    LoginStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
