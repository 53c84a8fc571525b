package org.machlink.compiler.diagnostics;

import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * Receives validation findings. Validators report every issue through this channel
 * instead of stopping at the first one.
 */
@FunctionalInterface
public interface DiagnosticAcceptor {

    /**
     * Accepts a single finding.
     *
     * @param severity The severity of the finding.
     * @param message  The human-readable message.
     * @param node     The AST node the finding is attached to, or {@code null}.
     * @param property The property of {@code node} the finding refers to (e.g. {@code "path"}), or {@code null}.
     */
    void accept(Severity severity, String message, AstNode node, String property);
}
