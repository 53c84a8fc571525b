package org.machlink.compiler.frontend.module;

import org.machlink.compiler.frontend.module.error.ImportException;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;

import java.util.List;
import java.util.Optional;

/**
 * Per-module workspace entry.
 *
 * @param module           The loaded module.
 * @param dependencies     Distinct resolved dependency ids in import order.
 * @param resolvedImports  One entry per import statement, in source order.
 * @param resolutionErrors Failures encountered while resolving this module's imports.
 */
public record ModuleInfo(
        SourceModule module,
        List<ModuleId> dependencies,
        List<ResolvedImport> resolvedImports,
        List<ImportException> resolutionErrors
) {

    public ModuleInfo {
        dependencies = List.copyOf(dependencies);
        resolvedImports = List.copyOf(resolvedImports);
        resolutionErrors = List.copyOf(resolutionErrors);
    }

    public ModuleId id() {
        return module.id();
    }

    /**
     * Returns the module the given import statement of this module resolved to.
     */
    public Optional<ModuleId> targetOf(ImportStatement statement) {
        for (ResolvedImport resolved : resolvedImports) {
            if (resolved.statement() == statement) {
                return resolved.targetId();
            }
        }
        return Optional.empty();
    }
}
