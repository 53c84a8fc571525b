package org.machlink.compiler.frontend.module;

import org.machlink.compiler.frontend.parser.ast.ImportStatement;

import java.util.Optional;

/**
 * An import statement together with the module it resolved to.
 *
 * @param statement The import statement.
 * @param target    The resolved module, or {@code null} if resolution failed.
 */
public record ResolvedImport(ImportStatement statement, ModuleId target) {

    public boolean isResolved() {
        return target != null;
    }

    public Optional<ModuleId> targetId() {
        return Optional.ofNullable(target);
    }
}
