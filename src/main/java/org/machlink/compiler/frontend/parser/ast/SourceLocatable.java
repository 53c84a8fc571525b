package org.machlink.compiler.frontend.parser.ast;

/**
 * Capability interface for AST nodes that originate from a specific source file.
 * Used to attach diagnostics to a file and line.
 */
public interface SourceLocatable {

    /**
     * Returns the canonical id of the file this node was parsed from.
     *
     * @return The source file, never null for nodes implementing this interface.
     */
    String getSourceFileName();

    /**
     * Returns the 1-based line the node starts on, or 0 for synthetic nodes.
     */
    int getLine();
}
