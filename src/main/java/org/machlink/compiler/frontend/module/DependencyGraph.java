package org.machlink.compiler.frontend.module;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Directed graph of "module A imports from module B" edges.
 *
 * <p>Every edge {@code A -> B} is stored twice: in A's dependencies and in B's dependents.
 * All mutators keep both sides in sync. Iteration order is insertion order, so every query
 * is deterministic for a given sequence of mutations.</p>
 *
 * <p>Not thread-safe; the owning {@link WorkspaceManager} serializes access.</p>
 */
public final class DependencyGraph {

    /**
     * A node of the graph with both edge directions.
     */
    private static final class DependencyNode {
        private final Set<ModuleId> dependencies = new LinkedHashSet<>();
        private final Set<ModuleId> dependents = new LinkedHashSet<>();
    }

    private final Map<ModuleId, DependencyNode> nodes = new LinkedHashMap<>();

    /**
     * Adds a module without edges. Adding an existing module is a no-op.
     */
    public void addModule(ModuleId id) {
        nodes.computeIfAbsent(id, k -> new DependencyNode());
    }

    /**
     * Adds the edge {@code from -> to}, creating missing nodes.
     *
     * @param from The importing module.
     * @param to   The imported module.
     */
    public void addDependency(ModuleId from, ModuleId to) {
        addModule(from);
        addModule(to);
        nodes.get(from).dependencies.add(to);
        nodes.get(to).dependents.add(from);
    }

    /**
     * Removes the edge {@code from -> to} if present.
     */
    public void removeDependency(ModuleId from, ModuleId to) {
        DependencyNode fromNode = nodes.get(from);
        DependencyNode toNode = nodes.get(to);
        if (fromNode != null) {
            fromNode.dependencies.remove(to);
        }
        if (toNode != null) {
            toNode.dependents.remove(from);
        }
    }

    /**
     * Removes a module and retracts every edge touching it from its neighbors.
     */
    public void removeModule(ModuleId id) {
        DependencyNode node = nodes.remove(id);
        if (node == null) {
            return;
        }
        for (ModuleId dependency : node.dependencies) {
            DependencyNode dependencyNode = nodes.get(dependency);
            if (dependencyNode != null) {
                dependencyNode.dependents.remove(id);
            }
        }
        for (ModuleId dependent : node.dependents) {
            DependencyNode dependentNode = nodes.get(dependent);
            if (dependentNode != null) {
                dependentNode.dependencies.remove(id);
            }
        }
    }

    /**
     * Returns the direct dependencies of a module, empty if the module is unknown.
     */
    public Set<ModuleId> getDependencies(ModuleId id) {
        DependencyNode node = nodes.get(id);
        return node == null ? Set.of() : Collections.unmodifiableSet(node.dependencies);
    }

    /**
     * Returns the modules that directly depend on a module, empty if the module is unknown.
     */
    public Set<ModuleId> getDependents(ModuleId id) {
        DependencyNode node = nodes.get(id);
        return node == null ? Set.of() : Collections.unmodifiableSet(node.dependents);
    }

    /**
     * Breadth-first reachability over dependency edges. A module always reaches itself.
     */
    public boolean hasPath(ModuleId from, ModuleId to) {
        Set<ModuleId> visited = new HashSet<>();
        Queue<ModuleId> queue = new ArrayDeque<>();
        queue.add(from);
        while (!queue.isEmpty()) {
            ModuleId current = queue.poll();
            if (current.equals(to)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            DependencyNode node = nodes.get(current);
            if (node != null) {
                queue.addAll(node.dependencies);
            }
        }
        return false;
    }

    /**
     * Finds cycles with a depth-first search over dependency edges.
     *
     * <p>When the search reaches a module that is still on the recursion stack, the stack slice
     * from that module's position to the current module, closed by the module itself, is
     * recorded. The search then continues, so independent cycles are all reported. A self-import
     * is reported as a cycle of length one ({@code [A, A]}).</p>
     *
     * @return The cycles found, empty for an acyclic graph.
     */
    public List<CircularDependency> detectCycles() {
        List<CircularDependency> cycles = new ArrayList<>();
        Set<ModuleId> visited = new HashSet<>();
        Set<ModuleId> onStack = new HashSet<>();
        List<ModuleId> path = new ArrayList<>();

        for (ModuleId id : nodes.keySet()) {
            if (!visited.contains(id)) {
                visitForCycles(id, visited, onStack, path, cycles);
            }
        }
        return cycles;
    }

    private void visitForCycles(ModuleId id, Set<ModuleId> visited, Set<ModuleId> onStack,
                                List<ModuleId> path, List<CircularDependency> cycles) {
        visited.add(id);
        onStack.add(id);
        path.add(id);

        DependencyNode node = nodes.get(id);
        if (node != null) {
            for (ModuleId dependency : node.dependencies) {
                if (!visited.contains(dependency)) {
                    visitForCycles(dependency, visited, onStack, path, cycles);
                } else if (onStack.contains(dependency)) {
                    List<ModuleId> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                    cycle.add(dependency);
                    cycles.add(new CircularDependency(cycle));
                }
            }
        }

        path.remove(path.size() - 1);
        onStack.remove(id);
    }

    /**
     * Orders all modules so that every module comes after all of its dependencies
     * (depth-first post-order over dependency edges).
     *
     * <p>The cycle check runs first and is authoritative: if {@link #detectCycles()} reports
     * anything, no order exists and the result is empty.</p>
     *
     * @return The order, or empty if the graph is cyclic.
     */
    public Optional<List<ModuleId>> topologicalSort() {
        if (!detectCycles().isEmpty()) {
            return Optional.empty();
        }
        List<ModuleId> sorted = new ArrayList<>(nodes.size());
        Set<ModuleId> visited = new HashSet<>();
        for (ModuleId id : nodes.keySet()) {
            visitInOrder(id, visited, sorted);
        }
        return Optional.of(sorted);
    }

    private void visitInOrder(ModuleId id, Set<ModuleId> visited, List<ModuleId> sorted) {
        if (!visited.add(id)) {
            return;
        }
        DependencyNode node = nodes.get(id);
        if (node != null) {
            for (ModuleId dependency : node.dependencies) {
                visitInOrder(dependency, visited, sorted);
            }
        }
        sorted.add(id);
    }

    public List<ModuleId> getAllModules() {
        return List.copyOf(nodes.keySet());
    }

    public boolean hasModule(ModuleId id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public void clear() {
        nodes.clear();
    }
}
