package com.convkit.http;

import com.convkit.auth.Credentials;
import com.convkit.shared.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** {@link HttpTransport} on the JDK {@link HttpClient}, fully asynchronous. */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;
    private final Credentials credentials;
    private final Duration requestTimeout;

    public JdkHttpTransport(Credentials credentials, Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .connectTimeout(connectTimeout)
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .build(),
                credentials, requestTimeout);
    }

    public JdkHttpTransport(HttpClient httpClient, Credentials credentials, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.credentials = credentials;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CompletableFuture<RawResponse> send(RequestDescriptor request) {
        HttpRequest httpReq;
        try {
            httpReq = toHttpRequest(request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new TransportException("Invalid request " + request + ": " + e.getMessage(), e));
        }

        return httpClient.sendAsync(httpReq, HttpResponse.BodyHandlers.ofByteArray())
                .handle((resp, error) -> {
                    if (error != null) throw toTransportError(request, error);
                    return new RawResponse(resp.statusCode(), resp.headers().map(), resp.body());
                });
    }

    private HttpRequest toHttpRequest(RequestDescriptor request) {
        var builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .timeout(requestTimeout);
        request.headers().forEach(builder::header);
        credentials.authorizationHeader().ifPresent(v -> builder.header("Authorization", v));

        var bodyPub = request.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                : HttpRequest.BodyPublishers.noBody();
        return builder.method(request.method().name(), bodyPub).build();
    }

    private static TransportException toTransportError(RequestDescriptor request, Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String reason;
        if (cause instanceof HttpTimeoutException) {
            reason = "timed out";
        } else if (cause instanceof ConnectException) {
            reason = "connection failed";
        } else if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            reason = "interrupted";
        } else {
            reason = cause.getClass().getSimpleName()
                    + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        }
        log.warn("Transport failure for {}: {}", request, reason);
        return new TransportException(request + " " + reason, cause);
    }
}
