package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.module.ModuleId;

/**
 * Output of a successful resolution. Folded into a {@link org.machlink.compiler.frontend.module.SourceModule}
 * by the workspace and not retained afterwards.
 *
 * @param id               The canonical id of the resolved module.
 * @param importPath       The import path as written.
 * @param resolvedLocation The concrete location that was read (file path, URL or virtual path).
 * @param content          The loaded content, or {@code null} if the resolver only located the module.
 */
public record ResolvedModule(
        ModuleId id,
        String importPath,
        String resolvedLocation,
        String content
) {
}
