package org.machlink.compiler.backend.link;

import org.machlink.compiler.frontend.module.SourceModule;

/**
 * Single-file reference resolution, wrapped by {@link CrossFileLinker}.
 */
@FunctionalInterface
public interface LocalReferenceResolver {

    LinkResult resolveLocal(Reference reference, SourceModule module);
}
