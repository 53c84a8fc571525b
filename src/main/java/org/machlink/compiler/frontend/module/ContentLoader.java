package org.machlink.compiler.frontend.module;

import java.util.concurrent.CompletableFuture;

/**
 * Loads the raw content of a module by id. Used by
 * {@link WorkspaceManager#loadDocumentWithDependencies(ModuleId, ContentLoader)}.
 */
@FunctionalInterface
public interface ContentLoader {

    CompletableFuture<String> load(ModuleId id);
}
