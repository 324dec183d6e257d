package com.reliabledownloader.client;

import java.io.IOException;

public class RemoteStatusException extends IOException {

    private final int statusCode;

    public RemoteStatusException(String url, int statusCode) {
        super("Request for " + url + " failed, code:" + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
