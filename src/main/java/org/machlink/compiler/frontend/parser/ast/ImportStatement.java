package org.machlink.compiler.frontend.parser.ast;

import java.util.List;

/**
 * AST node for an import statement.
 *
 * <p>Syntax: {@code import { Name [as Alias], ... } from "path"}
 *
 * @param path       The import path exactly as written.
 * @param symbols    The imported symbols in source order.
 * @param sourceFile The file containing the import.
 * @param line       The 1-based source line.
 */
public record ImportStatement(
        String path,
        List<ImportedSymbol> symbols,
        String sourceFile,
        int line
) implements AstNode, SourceLocatable {

    public ImportStatement {
        symbols = List.copyOf(symbols);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(symbols);
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
