package com.reliabledownloader.client;

import com.reliabledownloader.utils.CancellationSignal;

import java.io.IOException;
import java.io.InputStream;

public interface RemoteContentClient {

    // non-OK statuses are returned, not thrown
    ProbeResponse probe(String url, CancellationSignal signal) throws IOException;

    InputStream fetchAll(String url, CancellationSignal signal) throws IOException;

    // inclusive [start, end]; any other answer is an IOException
    InputStream fetchRange(String url, long start, long end, CancellationSignal signal) throws IOException;
}
