package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.io.SourceLoader;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.error.ModuleNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves imports written inside {@code virtual:} modules against a {@link VirtualFileSystem}.
 * Uses the same extension inference as {@link FileSystemResolver}; nothing is cached.
 */
public class VirtualFsResolver implements ModuleResolver {

    private final VirtualFileSystem fileSystem;
    private final List<String> extensions;
    private final ResolutionListener listener;

    public VirtualFsResolver(VirtualFileSystem fileSystem, List<String> extensions, ResolutionListener listener) {
        this.fileSystem = fileSystem;
        this.extensions = List.copyOf(extensions);
        this.listener = listener;
    }

    @Override
    public boolean canResolve(String importPath, ModuleId from) {
        return from != null && from.isVirtual()
                && (SourceLoader.isRelative(importPath) || SourceLoader.isAbsolutePath(importPath));
    }

    @Override
    public CompletableFuture<Optional<ResolvedModule>> resolve(String importPath, ModuleId from) {
        String base;
        try {
            base = ModuleId.ofVirtual(joinPath(from.path(), importPath)).path();
        } catch (IllegalArgumentException e) {
            listener.onFailure(new ModuleNotFoundException(importPath, from, null, e));
            return CompletableFuture.completedFuture(Optional.empty());
        }

        for (String candidate : candidates(base)) {
            Optional<String> content = fileSystem.read(candidate);
            if (content.isPresent()) {
                ModuleId id = ModuleId.ofVirtual(candidate);
                return CompletableFuture.completedFuture(Optional.of(
                        new ResolvedModule(id, importPath, id.path(), content.get())));
            }
        }
        listener.onFailure(new ModuleNotFoundException(importPath, from, null));
        return CompletableFuture.completedFuture(Optional.empty());
    }

    /**
     * Joins an import path to the directory of the importing module on decoded paths,
     * so names that are not legal in a raw URI (spaces, for instance) survive.
     */
    static String joinPath(String fromPath, String importPath) {
        if (SourceLoader.isAbsolutePath(importPath)) {
            return importPath;
        }
        return fromPath.substring(0, fromPath.lastIndexOf('/') + 1) + importPath;
    }

    private List<String> candidates(String base) {
        List<String> candidates = new ArrayList<>();
        if (!SourceLoader.hasExtension(base)) {
            for (String extension : extensions) {
                candidates.add(base + extension);
            }
        }
        candidates.add(base);
        return candidates;
    }
}
