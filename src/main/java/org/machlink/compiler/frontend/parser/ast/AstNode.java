package org.machlink.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Base type of every node in a parsed machine file.
 * Only owning parent-to-child edges are exposed here; container back-references
 * are carried as names (see {@link DefinitionNode#containerPath()}).
 */
public interface AstNode {

    /**
     * Returns the owned child nodes in source order.
     * @return The children, empty for leaf nodes.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
