package org.machlink.compiler.backend.merge;

import org.machlink.compiler.frontend.module.CircularDependency;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.ModuleInfo;
import org.machlink.compiler.frontend.module.SourceModule;
import org.machlink.compiler.frontend.module.WorkspaceManager;
import org.machlink.compiler.frontend.module.error.CircularDependencyException;
import org.machlink.compiler.frontend.module.error.ImportException;
import org.machlink.compiler.frontend.module.error.ModuleNotFoundException;
import org.machlink.compiler.frontend.module.error.SymbolNotFoundException;
import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.EdgeNode;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;
import org.machlink.compiler.frontend.parser.ast.MachineNode;
import org.machlink.compiler.frontend.semantics.DefinitionLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flattens an entry module and its transitive imports into one {@link MergedMachine}.
 *
 * <p>The entry's own definitions and edges come first. Then, per import statement and recursively
 * per imported module, every imported definition is deep-copied under its effective name. Each
 * module is walked once, so in a diamond every definition is contributed once. A name that is
 * already taken, by a local definition or an earlier import of a different definition, keeps its
 * first owner. Top-level edges of an imported module are carried over when both endpoints were
 * merged.</p>
 *
 * <p>The original ASTs are never modified and never aliased by the result.</p>
 */
public class ModuleMerger {

    private static final Logger log = LoggerFactory.getLogger(ModuleMerger.class);

    private final WorkspaceManager workspace;

    public ModuleMerger(WorkspaceManager workspace) {
        this.workspace = workspace;
    }

    /**
     * Merges the workspace starting at an entry module.
     *
     * @param entryPoint The entry module: a canonical id, a path, or a unique suffix of a loaded id
     *                   such as {@code app.dygram}.
     * @return The merged machine with provenance.
     * @throws CircularDependencyException If the workspace contains an import cycle.
     * @throws ModuleNotFoundException     If the entry point or an imported module is not loaded.
     * @throws SymbolNotFoundException     If an imported module lacks a requested symbol.
     */
    public MergedMachine mergeMachines(String entryPoint) throws ImportException {
        if (workspace.getDocumentsInOrder().isEmpty()) {
            List<CircularDependency> cycles = workspace.getCircularDependencies();
            throw new CircularDependencyException(cycles.get(0).cycle(), null, null);
        }
        ModuleInfo entry = findEntry(entryPoint);
        MergeRun run = new MergeRun(entry);
        run.mergeImports(entry);
        MergedMachine merged = run.result();
        log.info("Merged {} files into {} definitions for {}",
                merged.sourceFiles().size(), merged.machine().definitions().size(), entry.id());
        return merged;
    }

    private ModuleInfo findEntry(String entryPoint) throws ModuleNotFoundException {
        try {
            Optional<ModuleInfo> exact = workspace.getModuleInfo(ModuleId.of(entryPoint));
            if (exact.isPresent()) {
                return exact.get();
            }
        } catch (IllegalArgumentException e) {
            log.debug("Entry point '{}' is not a module id, trying suffix match", entryPoint);
        }

        String suffix = entryPoint.startsWith("/") ? entryPoint : "/" + entryPoint;
        List<ModuleInfo> candidates = new ArrayList<>();
        for (SourceModule module : workspace.getAllModules()) {
            if (module.id().value().equals(entryPoint) || module.id().value().endsWith(suffix)) {
                workspace.getModuleInfo(module.id()).ifPresent(candidates::add);
            }
        }
        if (candidates.size() != 1) {
            throw new ModuleNotFoundException(entryPoint, null, null);
        }
        return candidates.get(0);
    }

    /**
     * State of a single merge.
     */
    private final class MergeRun {
        private final ModuleId entryId;
        private final MachineNode entryAst;
        private final List<DefinitionNode> definitions = new ArrayList<>();
        private final List<EdgeNode> edges = new ArrayList<>();
        private final Map<String, SourceMetadata> sourceMap = new LinkedHashMap<>();
        private final List<String> sourceFiles = new ArrayList<>();
        private final Set<ModuleId> visited = new HashSet<>();
        /** Effective name to "module#qualifiedName" of the definition that owns it. */
        private final Map<String, String> owners = new LinkedHashMap<>();
        /** Per imported module: qualified name to merged name. */
        private final Map<ModuleId, Map<String, String>> mergedNames = new LinkedHashMap<>();

        MergeRun(ModuleInfo entry) {
            this.entryId = entry.id();
            this.entryAst = entry.module().ast();
            sourceFiles.add(entryId.value());
            for (DefinitionNode definition : entryAst.definitions()) {
                definitions.add(definition.deepCopy(definition.name()));
            }
            for (DefinitionNode definition : DefinitionLookup.allDefinitions(entryAst)) {
                String key = entryId + "#" + definition.qualifiedName();
                owners.putIfAbsent(definition.name(), key);
                owners.putIfAbsent(definition.qualifiedName(), key);
                sourceMap.putIfAbsent(definition.qualifiedName(), SourceMetadata.of(entryId.value()));
            }
            for (EdgeNode edge : entryAst.edges()) {
                edges.add(new EdgeNode(edge.source(), edge.target(), edge.arrow(), edge.sourceFile(), edge.line()));
            }
        }

        void mergeImports(ModuleInfo module) throws ImportException {
            if (!visited.add(module.id())) {
                return;
            }
            for (ImportStatement statement : module.module().importStatements()) {
                mergeImport(module, statement);
            }
        }

        private void mergeImport(ModuleInfo module, ImportStatement statement) throws ImportException {
            ModuleId targetId = module.targetOf(statement)
                    .orElseThrow(() -> new ModuleNotFoundException(statement.path(), module.id(), statement));
            ModuleInfo target = workspace.getModuleInfo(targetId)
                    .orElseThrow(() -> new ModuleNotFoundException(statement.path(), module.id(), statement));

            if (!sourceFiles.contains(targetId.value())) {
                sourceFiles.add(targetId.value());
            }

            for (ImportedSymbol symbol : statement.symbols()) {
                DefinitionNode definition = DefinitionLookup.find(target.module().ast(), symbol.name())
                        .map(DefinitionLookup.Match::definition)
                        .orElseThrow(() -> new SymbolNotFoundException(
                                symbol.name(), statement.path(), module.id(), symbol));
                String effectiveName = symbol.effectiveName();
                String key = targetId + "#" + definition.qualifiedName();

                String owner = owners.get(effectiveName);
                if (owner != null) {
                    if (!owner.equals(key)) {
                        log.debug("Skipping '{}' from {}: name already taken by {}", effectiveName, targetId, owner);
                    }
                    continue;
                }
                owners.put(effectiveName, key);
                definitions.add(definition.deepCopy(effectiveName));
                mergedNames.computeIfAbsent(targetId, k -> new LinkedHashMap<>())
                        .put(definition.qualifiedName(), effectiveName);
                sourceMap.put(effectiveName, new SourceMetadata(targetId.value(),
                        definition.qualifiedName().equals(effectiveName) ? null : definition.qualifiedName()));
            }

            mergeImports(target);
        }

        MergedMachine result() {
            for (Map.Entry<ModuleId, Map<String, String>> entry : mergedNames.entrySet()) {
                if (entry.getKey().equals(entryId)) {
                    continue;
                }
                Optional<SourceModule> origin = workspace.getModule(entry.getKey());
                if (origin.isEmpty()) {
                    continue;
                }
                carryEdges(origin.get().ast(), entry.getValue());
            }
            MachineNode machine = new MachineNode(entryAst.title(), List.of(), entryAst.attributes(),
                    definitions, edges, entryId.value());
            return new MergedMachine(machine, sourceMap, sourceFiles);
        }

        private void carryEdges(MachineNode origin, Map<String, String> names) {
            for (EdgeNode edge : origin.edges()) {
                String source = mergedName(origin, edge.source(), names);
                String target = mergedName(origin, edge.target(), names);
                if (source == null || target == null) {
                    continue;
                }
                EdgeNode carried = new EdgeNode(source, target, edge.arrow(), edge.sourceFile(), edge.line());
                if (!edges.contains(carried)) {
                    edges.add(carried);
                }
            }
        }

        private String mergedName(MachineNode origin, String reference, Map<String, String> names) {
            return DefinitionLookup.find(origin, reference)
                    .map(match -> names.get(match.definition().qualifiedName()))
                    .orElse(null);
        }
    }
}
