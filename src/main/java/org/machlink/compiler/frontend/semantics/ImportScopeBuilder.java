package org.machlink.compiler.frontend.semantics;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.ModuleInfo;
import org.machlink.compiler.frontend.module.SourceModule;
import org.machlink.compiler.frontend.module.WorkspaceManager;
import org.machlink.compiler.frontend.module.error.SymbolCollisionException;
import org.machlink.compiler.frontend.module.error.SymbolNotFoundException;
import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the {@link ImportScope} of a loaded module.
 *
 * <p>Imports fill gaps, they never shadow: an imported name equal to a local definition's name is
 * reported as a collision and the local definition stays in effect. Two imports producing the same
 * name collide unless they denote the same definition of the same module (a diamond); the first
 * registration wins. Every problem is collected, processing never stops at the first one.</p>
 */
public class ImportScopeBuilder {

    private final WorkspaceManager workspace;

    public ImportScopeBuilder(WorkspaceManager workspace) {
        this.workspace = workspace;
    }

    /**
     * @param moduleId A loaded module.
     * @return The computed scope.
     * @throws IllegalArgumentException If the module is not loaded.
     */
    public ImportScope build(ModuleId moduleId) {
        ModuleInfo info = workspace.getModuleInfo(moduleId)
                .orElseThrow(() -> new IllegalArgumentException("Module not loaded: " + moduleId));

        Set<String> localNames = localNames(info.module());
        LinkedHashMap<String, SymbolEntry> entries = new LinkedHashMap<>();
        List<SymbolCollisionException> collisions = new ArrayList<>();
        List<SymbolNotFoundException> missing = new ArrayList<>();
        List<ImportScope.Ambiguity> ambiguities = new ArrayList<>();

        for (ImportStatement statement : info.module().importStatements()) {
            Optional<ModuleId> target = info.targetOf(statement);
            if (target.isEmpty()) {
                continue;
            }
            Optional<SourceModule> origin = workspace.getModule(target.get());
            if (origin.isEmpty()) {
                continue;
            }

            for (ImportedSymbol symbol : statement.symbols()) {
                String effectiveName = symbol.effectiveName();
                if (symbol.name().isEmpty() || effectiveName.isEmpty()) {
                    continue;
                }
                Optional<DefinitionLookup.Match> match = DefinitionLookup.find(origin.get().ast(), symbol.name());
                if (match.isEmpty()) {
                    missing.add(new SymbolNotFoundException(symbol.name(), statement.path(), moduleId, symbol));
                    continue;
                }
                if (match.get().isAmbiguous()) {
                    ambiguities.add(new ImportScope.Ambiguity(symbol, statement, match.get()));
                }

                DefinitionNode definition = match.get().definition();
                SymbolEntry entry = new SymbolEntry(effectiveName, target.get(), definition.qualifiedName(),
                        definition, symbol, statement);

                if (localNames.contains(effectiveName)) {
                    collisions.add(new SymbolCollisionException(effectiveName, moduleId.toString(),
                            statement.path(), moduleId, symbol));
                    continue;
                }
                SymbolEntry existing = entries.get(effectiveName);
                if (existing != null) {
                    if (!existing.sameDefinitionAs(entry)) {
                        collisions.add(new SymbolCollisionException(effectiveName, existing.statement().path(),
                                statement.path(), moduleId, symbol));
                    }
                    continue;
                }
                entries.put(effectiveName, entry);
            }
        }
        return new ImportScope(moduleId, entries, collisions, missing, ambiguities);
    }

    /**
     * Names that local references resolve to: every simple and every qualified definition name.
     */
    static Set<String> localNames(SourceModule module) {
        Set<String> names = new HashSet<>();
        for (DefinitionNode definition : DefinitionLookup.allDefinitions(module.ast())) {
            names.add(definition.name());
            names.add(definition.qualifiedName());
        }
        return names;
    }
}
