package org.machlink.compiler.diagnostics;

import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * A single reported finding.
 *
 * @param severity   The severity.
 * @param message    The message text.
 * @param sourcePath The file the finding belongs to, or {@code null} if unknown.
 * @param line       The 1-based line, or 0 if unknown.
 * @param node       The AST node the finding is attached to, or {@code null}.
 * @param property   The node property the finding refers to, or {@code null}.
 */
public record Diagnostic(
        Severity severity,
        String message,
        String sourcePath,
        int line,
        AstNode node,
        String property
) {

    @Override
    public String toString() {
        String location = sourcePath == null ? "" : sourcePath + (line > 0 ? ":" + line : "") + ": ";
        return "[" + severity + "] " + location + message;
    }
}
