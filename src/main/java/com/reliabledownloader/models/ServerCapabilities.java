package com.reliabledownloader.models;

import java.net.HttpURLConnection;
import java.util.OptionalLong;

// ServerCapabilities.java
public record ServerCapabilities(
        int httpStatus,
        long declaredContentLength,
        boolean supportsRangeRequests,
        byte[] declaredContentHash
) {
    public static final long UNKNOWN_LENGTH = -1;

    public ServerCapabilities {
        if (declaredContentLength < 0) declaredContentLength = UNKNOWN_LENGTH;
        if (declaredContentHash != null) declaredContentHash = declaredContentHash.clone();
    }

    public boolean isOk() {
        return httpStatus == HttpURLConnection.HTTP_OK;
    }

    public boolean hasKnownLength() {
        return declaredContentLength != UNKNOWN_LENGTH;
    }

    public OptionalLong contentLength() {
        return hasKnownLength() ? OptionalLong.of(declaredContentLength) : OptionalLong.empty();
    }

    public boolean hasDeclaredHash() {
        return declaredContentHash != null;
    }

    @Override
    public byte[] declaredContentHash() {
        return declaredContentHash == null ? null : declaredContentHash.clone();
    }
}
