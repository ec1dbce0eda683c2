package com.work.bonding.web.dto;

public class ErrorView {

    private final String error;
    private final String message;
    private final boolean retryable;

    public ErrorView(String error, String message, boolean retryable) {
        this.error = error;
        this.message = message;
        this.retryable = retryable;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
