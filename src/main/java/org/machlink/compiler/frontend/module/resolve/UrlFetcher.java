package org.machlink.compiler.frontend.module.resolve;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Transport used by {@link UrlResolver}. Completes exceptionally only on transport failure;
 * HTTP error statuses are returned as a normal {@link FetchResult}.
 */
@FunctionalInterface
public interface UrlFetcher {

    CompletableFuture<FetchResult> fetch(URI url);

    /**
     * Response of a fetch.
     *
     * @param status     The HTTP status code.
     * @param reasonText The reason phrase, or {@code null} if the transport does not expose one.
     * @param body       The response body.
     */
    record FetchResult(int status, String reasonText, String body) {

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
