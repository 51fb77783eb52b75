package com.expirebot.expiry.appservice;

public class AppserviceAuthenticationException extends RuntimeException {

    private final boolean tokenPresent;

    public AppserviceAuthenticationException(String message, boolean tokenPresent) {
        super(message);
        this.tokenPresent = tokenPresent;
    }

    public boolean isTokenPresent() {
        return tokenPresent;
    }
}
