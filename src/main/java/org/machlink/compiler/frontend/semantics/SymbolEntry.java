package org.machlink.compiler.frontend.semantics;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;

/**
 * An imported symbol visible in a module.
 *
 * @param effectiveName  The name the symbol is known by in the importing module.
 * @param originModuleId The module that defines it.
 * @param originalName   The qualified name of the definition in the origin module.
 * @param node           The definition in the origin module. Owned by that module; never mutated.
 * @param declaration    The imported-symbol entry that brought it into scope.
 * @param statement      The import statement containing {@code declaration}.
 */
public record SymbolEntry(
        String effectiveName,
        ModuleId originModuleId,
        String originalName,
        DefinitionNode node,
        ImportedSymbol declaration,
        ImportStatement statement
) {

    /**
     * Returns whether both entries denote the same definition of the same module.
     */
    public boolean sameDefinitionAs(SymbolEntry other) {
        return originModuleId.equals(other.originModuleId) && originalName.equals(other.originalName);
    }
}
