package org.machlink.compiler.frontend.semantics;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.error.SymbolCollisionException;
import org.machlink.compiler.frontend.module.error.SymbolNotFoundException;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The imported symbols visible in one module, together with every problem found while computing them.
 * Built by {@link ImportScopeBuilder}.
 */
public final class ImportScope {

    /**
     * An imported name that matched several definitions of its origin module.
     *
     * @param symbol    The imported symbol.
     * @param statement The import statement.
     * @param match     The lookup result; {@link DefinitionLookup.Match#definition()} is the one used.
     */
    public record Ambiguity(ImportedSymbol symbol, ImportStatement statement, DefinitionLookup.Match match) {}

    private final ModuleId moduleId;
    private final Map<String, SymbolEntry> entries;
    private final List<SymbolCollisionException> collisions;
    private final List<SymbolNotFoundException> missingSymbols;
    private final List<Ambiguity> ambiguities;

    ImportScope(ModuleId moduleId, LinkedHashMap<String, SymbolEntry> entries,
                List<SymbolCollisionException> collisions, List<SymbolNotFoundException> missingSymbols,
                List<Ambiguity> ambiguities) {
        this.moduleId = moduleId;
        this.entries = Collections.unmodifiableMap(entries);
        this.collisions = List.copyOf(collisions);
        this.missingSymbols = List.copyOf(missingSymbols);
        this.ambiguities = List.copyOf(ambiguities);
    }

    public ModuleId moduleId() {
        return moduleId;
    }

    public Optional<SymbolEntry> lookup(String effectiveName) {
        return Optional.ofNullable(entries.get(effectiveName));
    }

    /**
     * Returns the visible symbols keyed by effective name, in import order.
     */
    public Map<String, SymbolEntry> entries() {
        return entries;
    }

    public List<SymbolCollisionException> collisions() {
        return collisions;
    }

    public List<SymbolNotFoundException> missingSymbols() {
        return missingSymbols;
    }

    public List<Ambiguity> ambiguities() {
        return ambiguities;
    }

    public boolean hasProblems() {
        return !collisions.isEmpty() || !missingSymbols.isEmpty();
    }
}
