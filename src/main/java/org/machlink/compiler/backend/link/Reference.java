package org.machlink.compiler.backend.link;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.AstNode;

/**
 * A by-name reference to a definition, e.g. one endpoint of an edge.
 *
 * @param text      The referenced name as written.
 * @param module    The module containing the reference.
 * @param container The AST node holding the reference.
 * @param property  The property of {@code container} holding the reference (e.g. {@code source}).
 */
public record Reference(String text, ModuleId module, AstNode container, String property) {
}
