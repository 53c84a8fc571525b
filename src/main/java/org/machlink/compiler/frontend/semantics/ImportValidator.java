package org.machlink.compiler.frontend.semantics;

import org.machlink.compiler.diagnostics.DiagnosticAcceptor;
import org.machlink.compiler.diagnostics.Severity;
import org.machlink.compiler.frontend.io.SourceLoader;
import org.machlink.compiler.frontend.module.CircularDependency;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.ModuleInfo;
import org.machlink.compiler.frontend.module.SourceModule;
import org.machlink.compiler.frontend.module.WorkspaceManager;
import org.machlink.compiler.frontend.module.error.ImportException;
import org.machlink.compiler.frontend.module.error.SymbolCollisionException;
import org.machlink.compiler.frontend.module.error.SymbolNotFoundException;
import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates the imports of loaded modules and reports every finding to a {@link DiagnosticAcceptor}.
 *
 * <p>Checks, per import statement: empty path, empty symbol list, empty symbol name, empty alias,
 * duplicate effective name within the statement, plain {@code http://} (warning) and bare absolute
 * paths (warning). Per module: unresolved imports, missing symbols, collisions, ambiguous short
 * names (warning) and participation in import cycles.</p>
 */
public class ImportValidator {

    private final WorkspaceManager workspace;
    private final ImportScopeBuilder scopeBuilder;

    public ImportValidator(WorkspaceManager workspace) {
        this.workspace = workspace;
        this.scopeBuilder = new ImportScopeBuilder(workspace);
    }

    /**
     * Validates every loaded module in registration order.
     */
    public void validateWorkspace(DiagnosticAcceptor acceptor) {
        for (SourceModule module : workspace.getAllModules()) {
            checkImports(module.id(), acceptor);
        }
    }

    /**
     * Validates one loaded module.
     *
     * @param moduleId The module to validate.
     * @param acceptor Receives every finding.
     * @throws IllegalArgumentException If the module is not loaded.
     */
    public void checkImports(ModuleId moduleId, DiagnosticAcceptor acceptor) {
        ModuleInfo info = workspace.getModuleInfo(moduleId)
                .orElseThrow(() -> new IllegalArgumentException("Module not loaded: " + moduleId));

        for (ImportStatement statement : info.module().importStatements()) {
            checkStatement(statement, acceptor);
        }
        for (ImportException error : info.resolutionErrors()) {
            acceptor.accept(Severity.ERROR, error.getMessage(), error.node(), "path");
        }

        ImportScope scope = scopeBuilder.build(moduleId);
        for (SymbolNotFoundException missing : scope.missingSymbols()) {
            acceptor.accept(Severity.ERROR, missing.getMessage(), missing.node(), "name");
        }
        for (SymbolCollisionException collision : scope.collisions()) {
            ImportedSymbol symbol = (ImportedSymbol) collision.node();
            acceptor.accept(Severity.ERROR, collision.getMessage(), symbol, symbol.hasAlias() ? "alias" : "name");
        }
        for (ImportScope.Ambiguity ambiguity : scope.ambiguities()) {
            DefinitionLookup.Match match = ambiguity.match();
            String alternatives = match.alternatives().stream()
                    .map(DefinitionNode::qualifiedName)
                    .collect(Collectors.joining(", "));
            acceptor.accept(Severity.WARNING,
                    "Symbol \"" + ambiguity.symbol().name() + "\" matches several nodes in \""
                            + ambiguity.statement().path() + "\"; using \"" + match.definition().qualifiedName()
                            + "\" (also: " + alternatives + ")",
                    ambiguity.symbol(), "name");
        }

        for (CircularDependency cycle : workspace.getCircularDependencies()) {
            if (cycle.contains(moduleId)) {
                acceptor.accept(Severity.ERROR, "Circular dependency detected: " + cycle.describe(),
                        info.module().ast(), "imports");
            }
        }
    }

    private static void checkStatement(ImportStatement statement, DiagnosticAcceptor acceptor) {
        String path = statement.path();
        if (path == null || path.isBlank()) {
            acceptor.accept(Severity.ERROR, "Import path cannot be empty", statement, "path");
        } else if (path.startsWith("http://")) {
            acceptor.accept(Severity.WARNING, "HTTP imports are insecure. Consider using HTTPS.", statement, "path");
        } else if (SourceLoader.isAbsolutePath(path)) {
            acceptor.accept(Severity.WARNING,
                    "Absolute paths may not be portable. Consider using relative paths.", statement, "path");
        }

        if (statement.symbols().isEmpty()) {
            acceptor.accept(Severity.ERROR, "Import must specify at least one symbol", statement, "symbols");
            return;
        }

        Set<String> seen = new HashSet<>();
        for (ImportedSymbol symbol : statement.symbols()) {
            if (symbol.name() == null || symbol.name().isBlank()) {
                acceptor.accept(Severity.ERROR, "Symbol name cannot be empty", symbol, "name");
                continue;
            }
            if (symbol.alias() != null && symbol.alias().isBlank()) {
                acceptor.accept(Severity.ERROR, "Alias cannot be empty", symbol, "alias");
                continue;
            }
            if (!seen.add(symbol.effectiveName())) {
                acceptor.accept(Severity.ERROR,
                        "Duplicate alias \"" + symbol.effectiveName() + "\" in import statement",
                        symbol, symbol.hasAlias() ? "alias" : "name");
            }
        }
    }
}
