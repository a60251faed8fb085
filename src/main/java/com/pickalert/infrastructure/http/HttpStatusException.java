package com.pickalert.infrastructure.http;

import java.io.IOException;

/**
 * Non-2xx HTTP response.
 */
public class HttpStatusException extends IOException {

    private final int statusCode;

    public HttpStatusException(int statusCode, String url) {
        super("HTTP request to " + url + " failed with status " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
