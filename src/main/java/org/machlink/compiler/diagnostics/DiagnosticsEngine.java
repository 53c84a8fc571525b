package org.machlink.compiler.diagnostics;

import org.machlink.compiler.frontend.module.error.ImportException;
import org.machlink.compiler.frontend.parser.ast.AstNode;
import org.machlink.compiler.frontend.parser.ast.SourceLocatable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics produced by validation, linking and loading.
 * This is the standard {@link DiagnosticAcceptor}: all findings are kept in report order.
 */
public class DiagnosticsEngine implements DiagnosticAcceptor {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void accept(Severity severity, String message, AstNode node, String property) {
        String sourcePath = null;
        int line = 0;
        if (node instanceof SourceLocatable locatable) {
            sourcePath = locatable.getSourceFileName();
            line = locatable.getLine();
        }
        diagnostics.add(new Diagnostic(severity, message, sourcePath, line, node, property));
    }

    public void reportError(String message, String sourcePath, int line) {
        diagnostics.add(new Diagnostic(Severity.ERROR, message, sourcePath, line, null, null));
    }

    public void reportWarning(String message, String sourcePath, int line) {
        diagnostics.add(new Diagnostic(Severity.WARNING, message, sourcePath, line, null, null));
    }

    /**
     * Reports a typed import failure as an error, keeping its node and origin.
     * @param error The failure to report.
     */
    public void report(ImportException error) {
        AstNode node = error.node();
        if (node instanceof SourceLocatable locatable) {
            diagnostics.add(new Diagnostic(Severity.ERROR, error.getMessage(),
                    locatable.getSourceFileName(), locatable.getLine(), node, null));
        } else {
            String origin = error.origin() != null ? error.origin().toString() : null;
            diagnostics.add(new Diagnostic(Severity.ERROR, error.getMessage(), origin, 0, node, null));
        }
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.WARNING);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.ERROR).toList();
    }

    public void clear() {
        diagnostics.clear();
    }

    /**
     * Renders all diagnostics, one per line, in report order.
     * @return The summary text, empty if nothing was reported.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
