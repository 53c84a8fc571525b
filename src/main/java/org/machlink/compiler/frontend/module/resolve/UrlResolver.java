package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.io.SourceLoader;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.error.UrlImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Resolves {@code http://} and {@code https://} imports, plus relative imports written inside
 * a remote module, by fetching them over the network.
 *
 * <p>Successful fetches are memoized in the injected {@link ModuleCache} under the absolute URL.
 * Failures are never cached and never retried automatically: they complete with an empty result
 * and are reported as {@link UrlImportException} to the listener.</p>
 */
public class UrlResolver implements ModuleResolver {

    private static final Logger log = LoggerFactory.getLogger(UrlResolver.class);

    private final UrlFetcher fetcher;
    private final ModuleCache cache;
    private final ResolutionListener listener;

    public UrlResolver(UrlFetcher fetcher, ModuleCache cache, ResolutionListener listener) {
        this.fetcher = fetcher;
        this.cache = cache;
        this.listener = listener;
    }

    @Override
    public boolean canResolve(String importPath, ModuleId from) {
        if (SourceLoader.isHttpUrl(importPath)) {
            return true;
        }
        return from != null && from.isHttp()
                && (SourceLoader.isRelative(importPath) || SourceLoader.isAbsolutePath(importPath));
    }

    @Override
    public CompletableFuture<Optional<ResolvedModule>> resolve(String importPath, ModuleId from) {
        String url;
        URI uri;
        try {
            url = SourceLoader.isHttpUrl(importPath)
                    ? importPath
                    : SourceLoader.resolveHttpRelative(from.value(), importPath);
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            listener.onFailure(new UrlImportException(importPath, null, null, from, null, e));
            return CompletableFuture.completedFuture(Optional.empty());
        }

        Optional<ResolvedModule> cached = cache.get(url);
        if (cached.isPresent()) {
            log.debug("URL cache hit for {}", url);
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<UrlFetcher.FetchResult> fetch;
        try {
            fetch = fetcher.fetch(uri);
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        return fetch.handle((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                listener.onFailure(new UrlImportException(url, null, null, from, null, cause));
                return Optional.<ResolvedModule>empty();
            }
            if (!result.isSuccess()) {
                listener.onFailure(new UrlImportException(url, result.status(), result.reasonText(), from, null, null));
                return Optional.<ResolvedModule>empty();
            }
            ResolvedModule module = new ResolvedModule(ModuleId.ofUrl(url), importPath, url,
                    SourceLoader.normalizeLineEndings(result.body()));
            cache.put(url, module);
            log.debug("Fetched {} ({} chars)", url, result.body().length());
            return Optional.of(module);
        });
    }

    /**
     * Drops the cached entry for one URL.
     */
    public void clearCache(String url) {
        cache.evict(url);
    }

    public void clearCache() {
        cache.clear();
    }
}
