package org.machlink.compiler.frontend.module.error;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * The imported module was resolved but has no definition with the requested name.
 */
public class SymbolNotFoundException extends ImportException {

    private final String symbolName;

    public SymbolNotFoundException(String symbolName, String importPath, ModuleId origin, AstNode node) {
        super("Symbol \"" + symbolName + "\" not found in module \"" + importPath + "\"", importPath, origin, node);
        this.symbolName = symbolName;
    }

    public String symbolName() {
        return symbolName;
    }

    @Override
    public String code() {
        return "SymbolNotFoundError";
    }
}
