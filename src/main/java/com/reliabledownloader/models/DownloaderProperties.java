package com.reliabledownloader.models;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "downloader")
public record DownloaderProperties(
        String transport,
        int bufferSize,
        long chunkSize,
        Integer maxRetries,
        Duration initialBackoff,
        Duration maxBackoff,
        boolean keepPartialOnCancel,
        Duration connectTimeout,
        Duration readTimeout,
        String downloadDir
) {
    public static final String HTTP_TRANSPORT = "http";
    public static final String S3_TRANSPORT = "s3";

    public DownloaderProperties {
        if (transport == null) transport = HTTP_TRANSPORT;
        if (bufferSize <= 0) bufferSize = 8192;
        if (chunkSize <= 0) chunkSize = 1048576L; // 1MB ranges
        if (maxRetries == null || maxRetries < 0) maxRetries = 3;
        if (initialBackoff == null) initialBackoff = Duration.ofSeconds(1);
        if (maxBackoff == null) maxBackoff = Duration.ofSeconds(64);
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
        if (readTimeout == null) readTimeout = Duration.ofSeconds(30);
        if (downloadDir == null) downloadDir = "downloads";
    }

    public static DownloaderProperties defaults() {
        return new DownloaderProperties(null, 0, 0, null, null, null, false, null, null, null);
    }
}
