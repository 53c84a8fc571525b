package org.machlink.compiler.frontend.parser;

/**
 * Thrown by a {@link ModuleParser} when content is not well-formed.
 */
public class SyntaxException extends Exception {

    private final String sourceFile;
    private final int line;

    /**
     * @param message    Description of the problem.
     * @param sourceFile The file being parsed.
     * @param line       The 1-based line of the problem.
     */
    public SyntaxException(String message, String sourceFile, int line) {
        super(sourceFile + ":" + line + ": " + message);
        this.sourceFile = sourceFile;
        this.line = line;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public int getLine() {
        return line;
    }
}
