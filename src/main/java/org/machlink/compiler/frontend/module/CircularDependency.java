package org.machlink.compiler.frontend.module;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A cycle in the module dependency graph, as a closed walk: the first id is repeated at the end.
 * A module importing itself yields {@code [A, A]}.
 *
 * @param cycle The ids along the cycle.
 */
public record CircularDependency(List<ModuleId> cycle) {

    public CircularDependency {
        cycle = List.copyOf(cycle);
    }

    public boolean contains(ModuleId id) {
        return cycle.contains(id);
    }

    /**
     * Renders the cycle as {@code a.dygram → b.dygram → a.dygram}.
     */
    public String describe() {
        return cycle.stream().map(ModuleId::fileName).collect(Collectors.joining(" → "));
    }
}
