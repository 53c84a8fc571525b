package org.machlink.compiler.backend.link;

import org.machlink.compiler.frontend.module.SourceModule;
import org.machlink.compiler.frontend.semantics.DefinitionLookup;

/**
 * Resolves a reference against the definitions of its own file, by qualified path or simple name.
 */
public class ScopedLocalResolver implements LocalReferenceResolver {

    @Override
    public LinkResult resolveLocal(Reference reference, SourceModule module) {
        return DefinitionLookup.find(module.ast(), reference.text())
                .map(match -> LinkResult.resolved(match.definition(), module.id()))
                .orElseGet(() -> LinkResult.unresolved(
                        "Could not resolve reference to \"" + reference.text() + "\""));
    }
}
