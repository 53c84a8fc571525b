package org.machlink.compiler.frontend.module.error;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * Fetching a remote module failed, either with an HTTP error status or at the transport level.
 */
public class UrlImportException extends ImportException {

    private final Integer statusCode;
    private final String statusText;

    /**
     * @param importPath The URL that was fetched.
     * @param statusCode The HTTP status, or {@code null} for transport failures.
     * @param statusText The reason text, or {@code null}.
     * @param origin     The importing module, or {@code null}.
     * @param node       The triggering AST node, or {@code null}.
     * @param cause      The transport failure, or {@code null}.
     */
    public UrlImportException(String importPath, Integer statusCode, String statusText,
                              ModuleId origin, AstNode node, Throwable cause) {
        super("Failed to fetch module from URL \"" + importPath + "\"" + detail(statusCode, statusText, cause),
                importPath, origin, node, cause);
        this.statusCode = statusCode;
        this.statusText = statusText;
    }

    private static String detail(Integer statusCode, String statusText, Throwable cause) {
        if (statusCode != null) {
            return " (" + statusCode + (statusText != null ? " " + statusText : "") + ")";
        }
        if (cause != null && cause.getMessage() != null) {
            return ": " + cause.getMessage();
        }
        return "";
    }

    public Integer statusCode() {
        return statusCode;
    }

    public String statusText() {
        return statusText;
    }

    @Override
    public String code() {
        return "URLImportError";
    }
}
