package org.machlink.compiler.backend.link;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.ModuleInfo;
import org.machlink.compiler.frontend.module.SourceModule;
import org.machlink.compiler.frontend.module.WorkspaceManager;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;
import org.machlink.compiler.frontend.semantics.DefinitionLookup;

import java.util.Optional;

/**
 * Resolves references local-first, then through the imports of the referencing module.
 *
 * <p>If local resolution fails, the imports are searched in source order for a symbol whose
 * effective name equals the reference. The first such symbol whose origin module is loaded and
 * defines the symbol provides the target. If no import claims the name, the local failure is
 * returned unchanged.</p>
 */
public class CrossFileLinker {

    private final WorkspaceManager workspace;
    private final LocalReferenceResolver localResolver;

    public CrossFileLinker(WorkspaceManager workspace, LocalReferenceResolver localResolver) {
        this.workspace = workspace;
        this.localResolver = localResolver;
    }

    public CrossFileLinker(WorkspaceManager workspace) {
        this(workspace, new ScopedLocalResolver());
    }

    /**
     * @param reference A reference inside a loaded module.
     * @return The resolved target, or the local failure.
     * @throws IllegalArgumentException If the referencing module is not loaded.
     */
    public LinkResult link(Reference reference) {
        ModuleInfo info = workspace.getModuleInfo(reference.module())
                .orElseThrow(() -> new IllegalArgumentException("Module not loaded: " + reference.module()));

        LinkResult local = localResolver.resolveLocal(reference, info.module());
        if (local.isResolved()) {
            return local;
        }

        for (ImportStatement statement : info.module().importStatements()) {
            for (ImportedSymbol symbol : statement.symbols()) {
                if (!symbol.effectiveName().equals(reference.text())) {
                    continue;
                }
                Optional<LinkResult> imported = resolveImported(info, statement, symbol);
                if (imported.isPresent()) {
                    return imported.get();
                }
            }
        }
        return local;
    }

    private Optional<LinkResult> resolveImported(ModuleInfo info, ImportStatement statement, ImportedSymbol symbol) {
        Optional<ModuleId> target = info.targetOf(statement);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        Optional<SourceModule> origin = workspace.getModule(target.get());
        return origin.flatMap(module -> DefinitionLookup.find(module.ast(), symbol.name()))
                .map(match -> LinkResult.resolved(match.definition(), target.get()));
    }
}
