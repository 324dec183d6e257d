package com.reliabledownloader.client;

import com.reliabledownloader.utils.CancellationSignal;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OkHttpRemoteContentClientTest {

    private MockWebServer server;
    private OkHttpRemoteContentClient client;
    private String url;

    static byte[] gzip(byte[] plain) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(plain);
        }
        return out.toByteArray();
    }

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OkHttpRemoteContentClient(new OkHttpClient.Builder()
                .readTimeout(5, TimeUnit.SECONDS)
                .build());
        url = server.url("/files/installer.msi").toString();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void probeUsesHeadAndExposesHeaders() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Length", "3")
                .setHeader("Accept-Ranges", "bytes")
                .setHeader("Content-MD5", "BAUG"));

        ProbeResponse response = client.probe(url, CancellationSignal.none());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.header("content-length")).isEqualTo("3");
        assertThat(response.header("Accept-Ranges")).isEqualTo("bytes");
        assertThat(response.header("content-md5")).isEqualTo("BAUG");
        assertThat(server.takeRequest().getMethod()).isEqualTo("HEAD");
    }

    @Test
    void probeReturnsNonOkStatusInsteadOfThrowing() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThat(client.probe(url, CancellationSignal.none()).statusCode()).isEqualTo(404);
    }

    @Test
    void probeFallsBackToGetWhenHeadIsRejected() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(405));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("abc"));

        ProbeResponse response = client.probe(url, CancellationSignal.none());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(server.takeRequest().getMethod()).isEqualTo("HEAD");
        assertThat(server.takeRequest().getMethod()).isEqualTo("GET");
    }

    @Test
    void fetchAllStreamsBody() throws Exception {
        server.enqueue(new MockResponse().setBody(new Buffer().write(new byte[]{1, 2, 3})));

        try (InputStream body = client.fetchAll(url, CancellationSignal.none())) {
            assertThat(body.readAllBytes()).containsExactly(1, 2, 3);
        }
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getHeader("Range")).isNull();
    }

    @Test
    void fetchRangeSendsRangeHeaderAndRequiresPartialContent() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(206)
                .setHeader("Content-Range", "bytes 2-3/10")
                .setBody(new Buffer().write(new byte[]{3, 4})));

        try (InputStream body = client.fetchRange(url, 2, 3, CancellationSignal.none())) {
            assertThat(body.readAllBytes()).containsExactly(3, 4);
        }
        assertThat(server.takeRequest().getHeader("Range")).isEqualTo("bytes=2-3");
    }

    @Test
    void fetchRangeRejectsIgnoredRangeHeader() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("whole body"));

        assertThatThrownBy(() -> client.fetchRange(url, 0, 1, CancellationSignal.none()))
                .isInstanceOf(RemoteStatusException.class)
                .satisfies(e -> assertThat(((RemoteStatusException) e).getStatusCode()).isEqualTo(200));
    }

    @Test
    void fetchAllFailsOnServerError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> client.fetchAll(url, CancellationSignal.none()))
                .isInstanceOf(RemoteStatusException.class)
                .hasMessageContaining("500");
    }

    @Test
    void encodedBodyIsDeliveredAsServed() throws Exception {
        byte[] gzipped = gzip("compressible compressible compressible".getBytes(StandardCharsets.UTF_8));
        server.enqueue(new MockResponse()
                .setHeader("Content-Encoding", "gzip")
                .setBody(new Buffer().write(gzipped)));

        try (InputStream body = client.fetchAll(url, CancellationSignal.none())) {
            assertThat(body.readAllBytes()).isEqualTo(gzipped);
        }
        assertThat(server.takeRequest().getHeader("Accept-Encoding")).isEqualTo("identity");
    }

    @Test
    void probeAsksForIdentityEncoding() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(405));
        server.enqueue(new MockResponse().setResponseCode(200));

        client.probe(url, CancellationSignal.none());

        assertThat(server.takeRequest().getHeader("Accept-Encoding")).isEqualTo("identity");
        assertThat(server.takeRequest().getHeader("Accept-Encoding")).isEqualTo("identity");
    }

    @Test
    void cancelledSignalPreventsRequest() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> client.fetchAll(url, signal)).isInstanceOf(CancellationException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
