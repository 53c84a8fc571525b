package org.machlink.compiler.frontend.semantics;

import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;
import org.machlink.compiler.frontend.parser.ast.MachineNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds definitions by name inside one parsed file.
 *
 * <p>Lookup order: an exact match of the qualified path ({@code Group.Child}) first, then a match of
 * the last name segment against every definition's simple name in document pre-order. When the
 * second step finds several definitions, the first one wins and the match is flagged ambiguous.</p>
 */
public final class DefinitionLookup {

    /**
     * Result of a lookup.
     *
     * @param definition   The chosen definition.
     * @param alternatives Other definitions that matched the same short name, in document order.
     */
    public record Match(DefinitionNode definition, List<DefinitionNode> alternatives) {

        public Match {
            alternatives = List.copyOf(alternatives);
        }

        public boolean isAmbiguous() {
            return !alternatives.isEmpty();
        }
    }

    private DefinitionLookup() {
    }

    /**
     * Returns every definition of the file, nested ones included, in document pre-order.
     */
    public static List<DefinitionNode> allDefinitions(MachineNode machine) {
        List<DefinitionNode> result = new ArrayList<>();
        for (DefinitionNode definition : machine.definitions()) {
            collect(definition, result);
        }
        return result;
    }

    private static void collect(DefinitionNode definition, List<DefinitionNode> result) {
        result.add(definition);
        for (DefinitionNode child : definition.children()) {
            collect(child, result);
        }
    }

    public static Optional<Match> find(MachineNode machine, String name) {
        return find(allDefinitions(machine), name);
    }

    public static Optional<Match> find(List<DefinitionNode> definitions, String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        for (DefinitionNode definition : definitions) {
            if (definition.qualifiedName().equals(name)) {
                return Optional.of(new Match(definition, List.of()));
            }
        }
        String shortName = ImportedSymbol.shortName(name);
        List<DefinitionNode> candidates = new ArrayList<>();
        for (DefinitionNode definition : definitions) {
            if (definition.name().equals(shortName)) {
                candidates.add(definition);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Match(candidates.get(0), candidates.subList(1, candidates.size())));
    }
}
