package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.module.ModuleId;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Strategy that turns an import path, written inside some module, into resolved content.
 *
 * <p>Implementations never complete exceptionally for an ordinary not-found or a network
 * failure. Such cases complete with {@link Optional#empty()} and are reported to the
 * resolver's {@link ResolutionListener}.</p>
 */
public interface ModuleResolver {

    /**
     * Cheap syntactic check whether this resolver handles the given import.
     *
     * @param importPath The import path as written.
     * @param from       The importing module.
     * @return {@code true} if {@link #resolve} should be attempted.
     */
    boolean canResolve(String importPath, ModuleId from);

    /**
     * Resolves an import relative to the importing module.
     *
     * @param importPath The import path as written.
     * @param from       The importing module.
     * @return A future with the resolved module, or empty if it could not be located.
     */
    CompletableFuture<Optional<ResolvedModule>> resolve(String importPath, ModuleId from);
}
