package org.machlink.compiler.frontend.module.error;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * Base class of all import-system failures.
 * <p>
 * Every failure carries the offending import path, the module the import was written in
 * (when known) and the AST node that triggered it (when available), so it can be turned
 * into a diagnostic attached to the right place.
 */
public class ImportException extends Exception {

    private final String importPath;
    private final transient ModuleId origin;
    private final transient AstNode node;

    /**
     * @param message    Description of the failure.
     * @param importPath The import path involved.
     * @param origin     The importing module, or {@code null}.
     * @param node       The triggering AST node, or {@code null}.
     */
    public ImportException(String message, String importPath, ModuleId origin, AstNode node) {
        this(message, importPath, origin, node, null);
    }

    public ImportException(String message, String importPath, ModuleId origin, AstNode node, Throwable cause) {
        super(message, cause);
        this.importPath = importPath;
        this.origin = origin;
        this.node = node;
    }

    public String importPath() {
        return importPath;
    }

    public ModuleId origin() {
        return origin;
    }

    public AstNode node() {
        return node;
    }

    /**
     * Returns the diagnostic code for this failure, e.g. {@code ModuleNotFoundError}.
     */
    public String code() {
        return "ImportError";
    }
}
