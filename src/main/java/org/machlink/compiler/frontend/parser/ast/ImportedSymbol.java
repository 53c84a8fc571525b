package org.machlink.compiler.frontend.parser.ast;

/**
 * One entry of an import's symbol list, e.g. {@code Start as StartA} or {@code Group.Child}.
 *
 * @param name       The (possibly dotted) name of the definition in the imported file.
 * @param alias      The explicit local alias, or {@code null}.
 * @param sourceFile The file containing the import.
 * @param line       The 1-based source line.
 */
public record ImportedSymbol(
        String name,
        String alias,
        String sourceFile,
        int line
) implements AstNode, SourceLocatable {

    /**
     * Returns the name the symbol is known by in the importing file:
     * the alias if present, otherwise the last {@code .}-separated segment of {@link #name()}.
     */
    public String effectiveName() {
        return alias != null ? alias : shortName(name);
    }

    public boolean hasAlias() {
        return alias != null;
    }

    /**
     * Returns the last {@code .}-separated segment of a qualified name.
     * @param qualifiedName A simple or dotted name.
     * @return The last segment.
     */
    public static String shortName(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
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
