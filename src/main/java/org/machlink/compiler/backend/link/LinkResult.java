package org.machlink.compiler.backend.link;

import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.parser.ast.DefinitionNode;

/**
 * Outcome of linking one {@link Reference}.
 *
 * @param target         The definition the reference denotes, or {@code null} if unresolved.
 * @param origin         The module defining {@code target}, or {@code null} if unresolved.
 * @param failureMessage Why the reference is unresolved, or {@code null} on success.
 */
public record LinkResult(DefinitionNode target, ModuleId origin, String failureMessage) {

    public static LinkResult resolved(DefinitionNode target, ModuleId origin) {
        return new LinkResult(target, origin, null);
    }

    public static LinkResult unresolved(String failureMessage) {
        return new LinkResult(null, null, failureMessage);
    }

    public boolean isResolved() {
        return target != null;
    }

    /**
     * Returns whether the target lives in a different module than {@code referencing}.
     */
    public boolean isCrossFile(ModuleId referencing) {
        return isResolved() && !origin.equals(referencing);
    }
}
