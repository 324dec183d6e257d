package com.reliabledownloader.models;

import java.nio.file.Path;
import java.util.Objects;

public record TransferRequest(
        String url,
        Path destination
) {
    public TransferRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(destination, "destination");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
    }
}
