package com.sparky.suppress.web;

public class UnexpectedStatusCodeException extends RuntimeException {
    private final int statusCode;

    public UnexpectedStatusCodeException(int statusCode, String body) {
        super("Unexpected status code: " + statusCode + " : " + body);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
