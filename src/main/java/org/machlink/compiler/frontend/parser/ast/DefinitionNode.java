package org.machlink.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named definition (state, task, context, ...), possibly containing nested definitions.
 *
 * <p>The enclosing definition is referenced by name only ({@link #containerPath()}), never by
 * object, so a copy of a definition never drags its enclosing file along.</p>
 *
 * @param name          The simple name.
 * @param type          The declared kind (e.g. {@code state}, {@code task}), or {@code null} if untyped.
 * @param title         The optional quoted title, or {@code null}.
 * @param attributes    {@code key: value} attributes in source order.
 * @param children      Nested definitions in source order.
 * @param edges         Edges declared inside this definition's block.
 * @param containerPath The qualified name of the enclosing definition, or {@code null} at top level.
 * @param sourceFile    The file containing the definition.
 * @param line          The 1-based source line.
 */
public record DefinitionNode(
        String name,
        String type,
        String title,
        Map<String, String> attributes,
        List<DefinitionNode> children,
        List<EdgeNode> edges,
        String containerPath,
        String sourceFile,
        int line
) implements AstNode, SourceLocatable {

    public DefinitionNode {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
        edges = List.copyOf(edges);
    }

    /**
     * Returns the dotted path from the top level of the file, e.g. {@code Group.Child}.
     */
    public String qualifiedName() {
        return containerPath == null ? name : containerPath + "." + name;
    }

    /**
     * Creates a deep copy detached from its container, optionally renamed.
     * Nested definitions are copied recursively and re-rooted under the new name.
     *
     * @param newName The name of the copy.
     * @return A new, top-level definition sharing no node instances with this one.
     */
    public DefinitionNode deepCopy(String newName) {
        return copyUnder(newName, null);
    }

    private DefinitionNode copyUnder(String newName, String newContainer) {
        String newQualified = newContainer == null ? newName : newContainer + "." + newName;
        List<DefinitionNode> copiedChildren = new ArrayList<>(children.size());
        for (DefinitionNode child : children) {
            copiedChildren.add(child.copyUnder(child.name, newQualified));
        }
        List<EdgeNode> copiedEdges = new ArrayList<>(edges.size());
        for (EdgeNode edge : edges) {
            copiedEdges.add(new EdgeNode(edge.source(), edge.target(), edge.arrow(), edge.sourceFile(), edge.line()));
        }
        return new DefinitionNode(newName, type, title, attributes, copiedChildren, copiedEdges,
                newContainer, sourceFile, line);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> nodes = new ArrayList<>(children);
        nodes.addAll(edges);
        return nodes;
    }

    @Override
    public String getSourceFileName() {
        return sourceFile;
    }

    @Override
    public int getLine() {
        return line;
    }
}
