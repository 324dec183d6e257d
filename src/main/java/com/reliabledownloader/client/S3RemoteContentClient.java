package com.reliabledownloader.client;

import com.reliabledownloader.utils.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.util.Base64;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads objects through the S3 API. URLs are {@code s3://bucket/key}, or a bare key resolved against
 * the default bucket.
 * <p>
 * S3 does not send {@code Content-MD5}; the ETag of a single-part upload is the hex MD5 of the object,
 * so it is exposed as one. Multipart ETags ({@code "<hex>-<parts>"}) are not content hashes and are dropped.
 */
@Slf4j
public class S3RemoteContentClient implements RemoteContentClient {

    private static final String SCHEME = "s3://";
    private static final Pattern SINGLE_PART_ETAG = Pattern.compile("[0-9a-fA-F]{32}");

    private final S3Client s3Client;
    private final String defaultBucket;

    public S3RemoteContentClient(S3Client s3Client, String defaultBucket) {
        this.s3Client = s3Client;
        this.defaultBucket = defaultBucket;
    }

    @Override
    public ProbeResponse probe(String url, CancellationSignal signal) throws IOException {
        signal.throwIfCancelled();
        ObjectLocation location = locate(url);
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .build();
        try {
            HeadObjectResponse metadata = s3Client.headObject(request);
            return new ProbeResponse(HttpURLConnection.HTTP_OK, headersOf(metadata));
        } catch (S3Exception e) {
            log.debug("HeadObject for {} failed with {}: {}", url, e.statusCode(), e.getMessage());
            return new ProbeResponse(e.statusCode(), Map.of());
        } catch (SdkClientException e) {
            throw new IOException("HeadObject failed for " + url, e);
        }
    }

    @Override
    public InputStream fetchAll(String url, CancellationSignal signal) throws IOException {
        signal.throwIfCancelled();
        ObjectLocation location = locate(url);
        return open(url, GetObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .build(), -1);
    }

    @Override
    public InputStream fetchRange(String url, long start, long end, CancellationSignal signal) throws IOException {
        signal.throwIfCancelled();
        ObjectLocation location = locate(url);
        return open(url, GetObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .range("bytes=" + start + "-" + end)
                .build(), end - start + 1);
    }

    private InputStream open(String url, GetObjectRequest request, long expectedLength) throws IOException {
        ResponseInputStream<GetObjectResponse> stream;
        try {
            stream = s3Client.getObject(request);
        } catch (S3Exception e) {
            throw new RemoteStatusException(url, e.statusCode());
        } catch (SdkClientException e) {
            throw new IOException("GetObject failed for " + url, e);
        }

        Long contentLength = stream.response().contentLength();
        if (expectedLength >= 0 && contentLength != null && contentLength != expectedLength) {
            stream.abort();
            throw new IOException("Range " + request.range() + " of " + url + " returned "
                    + contentLength + " bytes, expected " + expectedLength);
        }
        return stream;
    }

    ObjectLocation locate(String url) {
        if (url.startsWith(SCHEME)) {
            String path = url.substring(SCHEME.length());
            int slash = path.indexOf('/');
            if (slash <= 0 || slash == path.length() - 1) {
                throw new IllegalArgumentException("Expected s3://bucket/key but got " + url);
            }
            return new ObjectLocation(path.substring(0, slash), path.substring(slash + 1));
        }
        if (defaultBucket == null || defaultBucket.isBlank()) {
            throw new IllegalArgumentException("No bucket in " + url + " and aws.s3.bucket-name is not set");
        }
        return new ObjectLocation(defaultBucket, url.startsWith("/") ? url.substring(1) : url);
    }

    private static Map<String, List<String>> headersOf(HeadObjectResponse metadata) {
        Map<String, List<String>> headers = new HashMap<>();
        if (metadata.contentLength() != null) {
            headers.put(ProbeResponse.CONTENT_LENGTH, List.of(String.valueOf(metadata.contentLength())));
        }
        if (metadata.acceptRanges() != null) {
            headers.put(ProbeResponse.ACCEPT_RANGES, List.of(metadata.acceptRanges()));
        }
        String md5 = md5FromETag(metadata.eTag());
        if (md5 != null) {
            headers.put(ProbeResponse.CONTENT_MD5, List.of(md5));
        }
        return headers;
    }

    static String md5FromETag(String eTag) {
        if (eTag == null) {
            return null;
        }
        String unquoted = eTag.replace("\"", "");
        if (!SINGLE_PART_ETAG.matcher(unquoted).matches()) {
            return null;
        }
        return Base64.getEncoder().encodeToString(HexFormat.of().parseHex(unquoted));
    }

    record ObjectLocation(String bucket, String key) {
    }
}
