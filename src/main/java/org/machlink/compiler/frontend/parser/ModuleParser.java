package org.machlink.compiler.frontend.parser;

import org.machlink.compiler.frontend.parser.ast.MachineNode;

/**
 * Turns the text of one machine file into its AST.
 * The workspace depends only on this contract; the full language grammar plugs in here.
 */
@FunctionalInterface
public interface ModuleParser {

    /**
     * Parses one file.
     *
     * @param content    The file content.
     * @param sourceFile The canonical id of the file, recorded on every produced node.
     * @return The parsed machine.
     * @throws SyntaxException If the content is not well-formed.
     */
    MachineNode parse(String content, String sourceFile) throws SyntaxException;
}
