package com.convkit.http;

import java.util.concurrent.CompletableFuture;

/**
 * Executes requests. Implementations attach credentials and own connection handling,
 * timeouts and cancellation; network failures complete the future with
 * {@code TransportException}. Any HTTP status, including errors, is a normal completion.
 */
public interface HttpTransport {

    CompletableFuture<RawResponse> send(RequestDescriptor request);
}
