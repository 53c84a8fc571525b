package org.machlink.compiler.backend.merge;

import org.machlink.compiler.frontend.parser.ast.MachineNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One consolidated machine built from an entry module and its transitive imports.
 *
 * @param machine     The merged machine. It has no imports; every definition is a fresh copy.
 * @param sourceMap   Provenance keyed by merged (effective) name, in merge order.
 * @param sourceFiles The contributing files, entry first.
 */
public record MergedMachine(
        MachineNode machine,
        Map<String, SourceMetadata> sourceMap,
        List<String> sourceFiles
) {

    public MergedMachine {
        sourceMap = Collections.unmodifiableMap(new LinkedHashMap<>(sourceMap));
        sourceFiles = List.copyOf(sourceFiles);
    }

    public String entryPoint() {
        return sourceFiles.get(0);
    }
}
