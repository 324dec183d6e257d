package com.reliabledownloader.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// ProbeResponse.java
public record ProbeResponse(
        int statusCode,
        Map<String, List<String>> headers
) {
    public static final String CONTENT_LENGTH = "Content-Length";
    public static final String ACCEPT_RANGES = "Accept-Ranges";
    public static final String CONTENT_MD5 = "Content-MD5";

    public ProbeResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    copy.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values);
                }
            });
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public List<String> headerValues(String name) {
        return headers.getOrDefault(name, List.of());
    }
}
