package com.reliabledownloader.models;

public record DownloadRequest(
        String url,
        String destinationPath
) {
}
