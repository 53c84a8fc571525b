package org.machlink.compiler.frontend.module.error;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * Resolved content could not be parsed.
 */
public class ModuleParseException extends ImportException {

    public ModuleParseException(String importPath, Throwable parseError, ModuleId origin, AstNode node) {
        super("Failed to parse module \"" + importPath + "\": " + parseError.getMessage(),
                importPath, origin, node, parseError);
    }

    @Override
    public String code() {
        return "ModuleParseError";
    }
}
