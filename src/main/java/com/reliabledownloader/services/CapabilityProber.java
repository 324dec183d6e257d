package com.reliabledownloader.services;

import com.reliabledownloader.client.ProbeResponse;
import com.reliabledownloader.client.RemoteContentClient;
import com.reliabledownloader.models.ServerCapabilities;
import com.reliabledownloader.utils.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;

@Component
@Slf4j
public class CapabilityProber {

    private static final String BYTES_UNIT = "bytes";

    private final RemoteContentClient client;

    public CapabilityProber(RemoteContentClient client) {
        this.client = client;
    }

    public ServerCapabilities probe(String url, CancellationSignal signal) throws IOException {
        ProbeResponse response = client.probe(url, signal);
        ServerCapabilities capabilities = new ServerCapabilities(
                response.statusCode(),
                parseContentLength(response.header(ProbeResponse.CONTENT_LENGTH)),
                supportsByteRanges(response),
                parseContentMd5(response.header(ProbeResponse.CONTENT_MD5)));

        log.debug("Probed {}: status={}, length={}, ranges={}, hash={}", url, capabilities.httpStatus(),
                capabilities.declaredContentLength(), capabilities.supportsRangeRequests(),
                capabilities.hasDeclaredHash());
        return capabilities;
    }

    static long parseContentLength(String value) {
        if (value == null || value.isBlank()) {
            return ServerCapabilities.UNKNOWN_LENGTH;
        }
        try {
            long length = Long.parseLong(value.trim());
            return length < 0 ? ServerCapabilities.UNKNOWN_LENGTH : length;
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed Content-Length: {}", value);
            return ServerCapabilities.UNKNOWN_LENGTH;
        }
    }

    static boolean supportsByteRanges(ProbeResponse response) {
        for (String value : response.headerValues(ProbeResponse.ACCEPT_RANGES)) {
            for (String unit : value.split(",")) {
                if (BYTES_UNIT.equalsIgnoreCase(unit.trim())) {
                    return true;
                }
            }
        }
        return false;
    }

    static byte[] parseContentMd5(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(value.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed Content-MD5: {}", value);
            return null;
        }
    }
}
