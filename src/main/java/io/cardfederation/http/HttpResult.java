package io.cardfederation.http;

/**
 * Status and body of a completed HTTP exchange.
 */
public record HttpResult(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
