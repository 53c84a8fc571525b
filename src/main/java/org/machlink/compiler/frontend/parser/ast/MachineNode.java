package org.machlink.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of a parsed machine file.
 *
 * @param title       The machine title, or {@code null} if the file declares none.
 * @param imports     Import statements in source order.
 * @param attributes  Top-level {@code key: value} attributes.
 * @param definitions Top-level definitions in source order.
 * @param edges       Top-level edges in source order.
 * @param sourceFile  The canonical id of the file.
 */
public record MachineNode(
        String title,
        List<ImportStatement> imports,
        Map<String, String> attributes,
        List<DefinitionNode> definitions,
        List<EdgeNode> edges,
        String sourceFile
) implements AstNode, SourceLocatable {

    public MachineNode {
        imports = List.copyOf(imports);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        definitions = List.copyOf(definitions);
        edges = List.copyOf(edges);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> nodes = new ArrayList<>(imports);
        nodes.addAll(definitions);
        nodes.addAll(edges);
        return nodes;
    }

    @Override
    public String getSourceFileName() {
        return sourceFile;
    }

    @Override
    public int getLine() {
        return 1;
    }
}
