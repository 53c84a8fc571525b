package org.machlink.compiler.frontend.module.error;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * No resolver located the target of an import.
 */
public class ModuleNotFoundException extends ImportException {

    public ModuleNotFoundException(String importPath, ModuleId origin, AstNode node) {
        super("Cannot resolve module: \"" + importPath + "\"", importPath, origin, node);
    }

    public ModuleNotFoundException(String importPath, ModuleId origin, AstNode node, Throwable cause) {
        super("Cannot resolve module: \"" + importPath + "\"", importPath, origin, node, cause);
    }

    @Override
    public String code() {
        return "ModuleNotFoundError";
    }
}
