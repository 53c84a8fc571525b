package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.io.SourceLoader;
import org.machlink.compiler.frontend.module.ContentLoader;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.error.UrlImportException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * {@link ContentLoader} dispatching on the id scheme: {@code file} reads the disk,
 * {@code http(s)} goes through a {@link UrlFetcher}, {@code virtual} reads a {@link VirtualFileSystem}.
 * A non-2xx response fails the future with {@link UrlImportException}.
 */
public class DefaultContentLoader implements ContentLoader {

    private final VirtualFileSystem fileSystem;
    private final UrlFetcher fetcher;
    private final Executor executor;

    public DefaultContentLoader(VirtualFileSystem fileSystem, UrlFetcher fetcher, Executor executor) {
        this.fileSystem = fileSystem;
        this.fetcher = fetcher;
        this.executor = executor;
    }

    public DefaultContentLoader(VirtualFileSystem fileSystem, UrlFetcher fetcher) {
        this(fileSystem, fetcher, ForkJoinPool.commonPool());
    }

    @Override
    public CompletableFuture<String> load(ModuleId id) {
        if (id.isFile()) {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return SourceLoader.loadFile(id.toPath()).content();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, executor);
        }
        if (id.isVirtual()) {
            return fileSystem.read(id.path())
                    .map(CompletableFuture::completedFuture)
                    .orElseGet(() -> CompletableFuture.failedFuture(new NoSuchFileException(id.value())));
        }
        if (id.isHttp()) {
            return fetcher.fetch(id.toUri()).thenApply(result -> {
                if (!result.isSuccess()) {
                    throw new CompletionException(new UrlImportException(
                            id.value(), result.status(), result.reasonText(), null, null, null));
                }
                return SourceLoader.normalizeLineEndings(result.body());
            });
        }
        return CompletableFuture.failedFuture(
                new IllegalArgumentException("Unsupported module scheme: " + id.scheme()));
    }
}
