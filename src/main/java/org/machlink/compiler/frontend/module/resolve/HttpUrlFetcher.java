package org.machlink.compiler.frontend.module.resolve;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link UrlFetcher} backed by the JDK HTTP client. No request timeout is applied;
 * callers needing one wrap the returned future.
 */
public class HttpUrlFetcher implements UrlFetcher {

    private final HttpClient client;

    public HttpUrlFetcher(Duration connectTimeout, boolean followRedirects) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(followRedirects ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .build());
    }

    public HttpUrlFetcher(HttpClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<FetchResult> fetch(URI url) {
        HttpRequest request = HttpRequest.newBuilder(url)
                .header("Accept", "text/plain, */*")
                .GET()
                .build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> new FetchResult(response.statusCode(), null, response.body()));
    }
}
