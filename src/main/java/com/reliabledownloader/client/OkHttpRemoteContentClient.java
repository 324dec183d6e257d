package com.reliabledownloader.client;

import com.reliabledownloader.utils.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;

/**
 * HTTP(S) client backed by OkHttp. Probes with {@code HEAD} and falls back to a {@code GET} whose body
 * is discarded when the server refuses {@code HEAD}.
 */
@Slf4j
public class OkHttpRemoteContentClient implements RemoteContentClient {

    private final OkHttpClient httpClient;

    public OkHttpRemoteContentClient(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ProbeResponse probe(String url, CancellationSignal signal) throws IOException {
        signal.throwIfCancelled();
        Request head = request(url).head().build();
        try (Response response = httpClient.newCall(head).execute()) {
            if (!headRejected(response.code())) {
                return new ProbeResponse(response.code(), response.headers().toMultimap());
            }
            log.debug("HEAD rejected with {} for {}, probing with GET", response.code(), url);
        }

        signal.throwIfCancelled();
        Request get = request(url).get().build();
        try (Response response = httpClient.newCall(get).execute()) {
            return new ProbeResponse(response.code(), response.headers().toMultimap());
        }
    }

    @Override
    public InputStream fetchAll(String url, CancellationSignal signal) throws IOException {
        signal.throwIfCancelled();
        Request request = request(url).get().build();
        return openBody(url, request, HttpURLConnection.HTTP_OK);
    }

    @Override
    public InputStream fetchRange(String url, long start, long end, CancellationSignal signal) throws IOException {
        signal.throwIfCancelled();
        Request request = request(url)
                .header("Range", "bytes=" + start + "-" + end)
                .build();
        return openBody(url, request, HttpURLConnection.HTTP_PARTIAL);
    }

    private InputStream openBody(String url, Request request, int expectedStatus) throws IOException {
        Response response = httpClient.newCall(request).execute();
        try {
            if (response.code() != expectedStatus) {
                throw new RemoteStatusException(url, response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Response body is null for " + url);
            }
            return body.byteStream();
        } catch (IOException | RuntimeException e) {
            response.close();
            throw e;
        }
    }

    // OkHttp otherwise asks for gzip and inflates transparently, which breaks Content-Length and Content-MD5
    private static Request.Builder request(String url) {
        return new Request.Builder().url(url).header("Accept-Encoding", "identity");
    }

    private static boolean headRejected(int code) {
        return code == HttpURLConnection.HTTP_BAD_METHOD || code == HttpURLConnection.HTTP_NOT_IMPLEMENTED;
    }
}
