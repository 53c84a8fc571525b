package org.machlink.compiler.frontend.module.error;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A reachable import cycle exists, so the workspace cannot be linked or merged.
 */
public class CircularDependencyException extends ImportException {

    private final transient List<ModuleId> cycle;

    /**
     * @param cycle  The closed walk, first element repeated at the end.
     * @param origin The module the failure is reported for, or {@code null}.
     * @param node   The triggering AST node, or {@code null}.
     */
    public CircularDependencyException(List<ModuleId> cycle, ModuleId origin, AstNode node) {
        super("Circular dependency detected: "
                        + cycle.stream().map(ModuleId::toString).collect(Collectors.joining(" -> ")),
                cycle.isEmpty() ? "" : cycle.get(0).toString(), origin, node);
        this.cycle = List.copyOf(cycle);
    }

    public List<ModuleId> cycle() {
        return cycle;
    }

    @Override
    public String code() {
        return "CircularDependencyError";
    }
}
