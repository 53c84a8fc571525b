package org.machlink.compiler.frontend.module.error;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * Two imports, or an import and a local definition, share the same effective name.
 */
public class SymbolCollisionException extends ImportException {

    private final String symbolName;
    private final String firstSource;
    private final String secondSource;

    /**
     * @param symbolName   The colliding effective name.
     * @param firstSource  Where the name was registered first (an import path, or the local file).
     * @param secondSource Where the colliding registration comes from.
     * @param origin       The importing module.
     * @param node         The later of the two colliding AST nodes.
     */
    public SymbolCollisionException(String symbolName, String firstSource, String secondSource,
                                    ModuleId origin, AstNode node) {
        super(message(symbolName, firstSource, secondSource, origin), secondSource, origin, node);
        this.symbolName = symbolName;
        this.firstSource = firstSource;
        this.secondSource = secondSource;
    }

    private static String message(String symbolName, String firstSource, String secondSource, ModuleId origin) {
        if (origin != null && firstSource.equals(origin.toString())) {
            return "Imported symbol \"" + symbolName + "\" from \"" + secondSource
                    + "\" collides with local node \"" + symbolName + "\"";
        }
        return "Symbol \"" + symbolName + "\" is imported from both \"" + firstSource + "\" and \"" + secondSource + "\"";
    }

    public String symbolName() {
        return symbolName;
    }

    public String firstSource() {
        return firstSource;
    }

    public String secondSource() {
        return secondSource;
    }

    /**
     * Returns whether the collision is with a definition of the importing file itself.
     */
    public boolean isLocalCollision() {
        return origin() != null && firstSource.equals(origin().toString());
    }

    @Override
    public String code() {
        return "SymbolCollisionError";
    }
}
