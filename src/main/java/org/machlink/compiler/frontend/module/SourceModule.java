package org.machlink.compiler.frontend.module;

import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.MachineNode;

import java.util.List;

/**
 * One loaded source file: its parsed definitions plus its import statements.
 * Instances are never mutated; an edited file is represented by a new instance.
 *
 * @param id               The module identity.
 * @param ast              The parsed machine.
 * @param importStatements The import statements in source order.
 * @param rawContent       The text the AST was parsed from.
 */
public record SourceModule(
        ModuleId id,
        MachineNode ast,
        List<ImportStatement> importStatements,
        String rawContent
) {

    public SourceModule {
        importStatements = List.copyOf(importStatements);
    }

    public static SourceModule of(ModuleId id, MachineNode ast, String rawContent) {
        return new SourceModule(id, ast, ast.imports(), rawContent);
    }
}
