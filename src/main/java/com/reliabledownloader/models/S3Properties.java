package com.reliabledownloader.models;

import org.springframework.boot.context.properties.ConfigurationProperties;

// S3Properties.java
@ConfigurationProperties(prefix = "aws.s3")
public record S3Properties(
        String bucketName,
        String region,
        int maxRetries
) {
    public S3Properties {
        if (region == null) region = "us-east-1";
        if (maxRetries < 0) maxRetries = 0; // retries belong to the download orchestrator
    }
}
