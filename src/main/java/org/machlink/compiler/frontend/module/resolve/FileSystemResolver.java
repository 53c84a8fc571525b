package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.io.SourceLoader;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.error.ModuleNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Resolves {@code ./x}, {@code ../x} and {@code /absolute} imports against the local disk.
 * Relative imports are only handled when the importing module is itself a local file.
 *
 * <p>An import without an extension is tried against each configured extension in order,
 * then as written; the first existing regular file wins. Results are never cached, so a
 * re-resolution always sees the current file content.</p>
 */
public class FileSystemResolver implements ModuleResolver {

    private static final Logger log = LoggerFactory.getLogger(FileSystemResolver.class);

    private final List<String> extensions;
    private final ResolutionListener listener;
    private final Executor executor;

    public FileSystemResolver(List<String> extensions, ResolutionListener listener, Executor executor) {
        this.extensions = List.copyOf(extensions);
        this.listener = listener;
        this.executor = executor;
    }

    public FileSystemResolver(List<String> extensions, ResolutionListener listener) {
        this(extensions, listener, ForkJoinPool.commonPool());
    }

    @Override
    public boolean canResolve(String importPath, ModuleId from) {
        if (SourceLoader.isAbsolutePath(importPath)) {
            return from == null || !from.isVirtual() && !from.isHttp();
        }
        return SourceLoader.isRelative(importPath) && (from == null || from.isFile());
    }

    @Override
    public CompletableFuture<Optional<ResolvedModule>> resolve(String importPath, ModuleId from) {
        return CompletableFuture.supplyAsync(() -> resolveNow(importPath, from), executor);
    }

    private Optional<ResolvedModule> resolveNow(String importPath, ModuleId from) {
        Path base;
        try {
            base = baseDirectory(importPath, from).resolve(
                    SourceLoader.isAbsolutePath(importPath) ? importPath.substring(1) : importPath).normalize();
        } catch (InvalidPathException e) {
            listener.onFailure(new ModuleNotFoundException(importPath, from, null, e));
            return Optional.empty();
        }

        for (Path candidate : candidates(base)) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            try {
                SourceLoader.LoadResult loaded = SourceLoader.loadFile(candidate);
                log.debug("Resolved '{}' from {} to {}", importPath, from, candidate);
                return Optional.of(new ResolvedModule(ModuleId.ofPath(candidate), importPath,
                        loaded.logicalName(), loaded.content()));
            } catch (IOException e) {
                listener.onFailure(new ModuleNotFoundException(importPath, from, null, e));
                return Optional.empty();
            }
        }
        listener.onFailure(new ModuleNotFoundException(importPath, from, null));
        return Optional.empty();
    }

    private static Path baseDirectory(String importPath, ModuleId from) {
        if (SourceLoader.isAbsolutePath(importPath)) {
            return Path.of("/").toAbsolutePath();
        }
        if (from == null) {
            return Path.of("").toAbsolutePath();
        }
        Path parent = from.toPath().getParent();
        return parent != null ? parent : from.toPath().getRoot();
    }

    private List<Path> candidates(Path base) {
        List<Path> candidates = new ArrayList<>();
        if (!SourceLoader.hasExtension(base.toString().replace('\\', '/'))) {
            for (String extension : extensions) {
                candidates.add(base.resolveSibling(base.getFileName() + extension));
            }
        }
        candidates.add(base);
        return candidates;
    }
}
