package org.machlink.compiler.frontend.parser.ast;

/**
 * A single directed edge between two named definitions. A chain such as
 * {@code A -> B -> C} is parsed into two edges.
 *
 * @param source     The referenced source definition name.
 * @param target     The referenced target definition name.
 * @param arrow      The arrow token as written ({@code ->}, {@code -->} or {@code =>}).
 * @param sourceFile The file containing the edge.
 * @param line       The 1-based source line.
 */
public record EdgeNode(
        String source,
        String target,
        String arrow,
        String sourceFile,
        int line
) implements AstNode, SourceLocatable {

    @Override
    public String getSourceFileName() {
        return sourceFile;
    }

    @Override
    public int getLine() {
        return line;
    }
}
