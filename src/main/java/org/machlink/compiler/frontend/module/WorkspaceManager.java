package org.machlink.compiler.frontend.module;

import org.machlink.compiler.frontend.module.error.ImportException;
import org.machlink.compiler.frontend.module.error.ModuleNotFoundException;
import org.machlink.compiler.frontend.module.error.ModuleParseException;
import org.machlink.compiler.frontend.module.resolve.ModuleResolver;
import org.machlink.compiler.frontend.module.resolve.ResolvedModule;
import org.machlink.compiler.frontend.parser.ModuleParser;
import org.machlink.compiler.frontend.parser.SyntaxException;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the set of loaded modules and the {@link DependencyGraph} between them.
 *
 * <p>All structural change goes through {@link #addDocument}, {@link #updateDocument} and
 * {@link #removeDocument}. Graph edges only ever connect loaded modules: a module importing a file
 * that is not loaded yet keeps the target in its {@link ModuleInfo#dependencies()}, and the edge is
 * added as soon as the target is loaded. This keeps the graph and the module map in one-to-one
 * correspondence at all times.</p>
 *
 * <p>Import resolution is asynchronous; registration of the resolved result is serialized on this
 * instance. Callers are expected to serialize batches of edits and rerun linking or merging
 * afterwards.</p>
 */
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final ModuleResolver resolver;
    private final ModuleParser parser;
    private final Map<ModuleId, ModuleInfo> modules = new LinkedHashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private final Map<ModuleId, ImportException> loadFailures = new ConcurrentHashMap<>();
    /** Remote content fetched during resolution of modules not loaded yet; consumed by the load pass. */
    private final Map<ModuleId, String> prefetched = new ConcurrentHashMap<>();

    public WorkspaceManager(ModuleResolver resolver, ModuleParser parser) {
        this.resolver = resolver;
        this.parser = parser;
    }

    /**
     * Resolves every import of a module and registers the module with its dependency edges.
     * A module with the same id that is already loaded is replaced.
     *
     * <p>The returned future never completes exceptionally because of a failed import: the failure
     * is recorded in {@link ModuleInfo#resolutionErrors()} and the import is left unresolved.</p>
     *
     * @param module The parsed module.
     * @return A future with the registered entry.
     */
    public CompletableFuture<ModuleInfo> addDocument(SourceModule module) {
        ModuleId id = module.id();
        List<ImportStatement> statements = module.importStatements();
        List<CompletableFuture<ResolvedImport>> pending = new ArrayList<>(statements.size());
        List<ImportException> errors = Collections.synchronizedList(new ArrayList<>());

        for (ImportStatement statement : statements) {
            pending.add(resolveImport(statement, id, errors));
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<ResolvedImport> resolved = new ArrayList<>(pending.size());
                    Set<ModuleId> dependencies = new LinkedHashSet<>();
                    for (CompletableFuture<ResolvedImport> future : pending) {
                        ResolvedImport resolvedImport = future.join();
                        resolved.add(resolvedImport);
                        resolvedImport.targetId().ifPresent(dependencies::add);
                    }
                    List<ImportException> orderedErrors;
                    synchronized (errors) {
                        orderedErrors = new ArrayList<>(errors);
                    }
                    orderedErrors.sort((a, b) -> Integer.compare(lineOf(a), lineOf(b)));
                    return register(new ModuleInfo(module, new ArrayList<>(dependencies), resolved, orderedErrors));
                });
    }

    private CompletableFuture<ResolvedImport> resolveImport(ImportStatement statement, ModuleId from,
                                                            List<ImportException> errors) {
        String path = statement.path();
        if (path == null || path.isBlank()) {
            return CompletableFuture.completedFuture(new ResolvedImport(statement, null));
        }
        CompletableFuture<Optional<ResolvedModule>> resolution;
        try {
            resolution = resolver.resolve(path, from);
        } catch (RuntimeException e) {
            resolution = CompletableFuture.failedFuture(e);
        }
        return resolution.handle((result, error) -> {
            if (error != null) {
                errors.add(new ModuleNotFoundException(path, from, statement, unwrap(error)));
                return new ResolvedImport(statement, null);
            }
            if (result.isEmpty()) {
                errors.add(new ModuleNotFoundException(path, from, statement));
                return new ResolvedImport(statement, null);
            }
            ResolvedModule resolvedModule = result.get();
            if (resolvedModule.id().isHttp() && resolvedModule.content() != null && !hasModule(resolvedModule.id())) {
                prefetched.putIfAbsent(resolvedModule.id(), resolvedModule.content());
            }
            return new ResolvedImport(statement, resolvedModule.id());
        });
    }

    private synchronized ModuleInfo register(ModuleInfo info) {
        ModuleId id = info.id();
        if (modules.containsKey(id)) {
            removeDocument(id);
        }
        modules.put(id, info);
        graph.addModule(id);
        for (ModuleId dependency : info.dependencies()) {
            if (modules.containsKey(dependency)) {
                graph.addDependency(id, dependency);
            }
        }
        for (ModuleInfo other : modules.values()) {
            if (other.dependencies().contains(id)) {
                graph.addDependency(other.id(), id);
            }
        }
        loadFailures.remove(id);
        prefetched.remove(id);
        log.debug("Added module {} with {} dependencies ({} unresolved imports)",
                id, info.dependencies().size(), info.resolutionErrors().size());
        return info;
    }

    /**
     * Parses content and adds the resulting module.
     *
     * @param id      The id of the module.
     * @param content The raw content.
     * @return A future with the registered entry, failed with {@link ModuleParseException} on a syntax error.
     */
    public CompletableFuture<ModuleInfo> addSource(ModuleId id, String content) {
        try {
            return addDocument(SourceModule.of(id, parser.parse(content, id.value()), content));
        } catch (SyntaxException e) {
            return CompletableFuture.failedFuture(new ModuleParseException(id.value(), e, id, null));
        }
    }

    /**
     * Replaces a module: the old entry and all its edges are removed, then the new one is added.
     */
    public CompletableFuture<ModuleInfo> updateDocument(SourceModule module) {
        removeDocument(module.id());
        log.debug("Updating module {}", module.id());
        return addDocument(module);
    }

    /**
     * Removes a module and every edge referencing it in either direction.
     *
     * @return {@code true} if the module was loaded.
     */
    public synchronized boolean removeDocument(ModuleId id) {
        ModuleInfo removed = modules.remove(id);
        graph.removeModule(id);
        if (removed != null) {
            log.debug("Removed module {}", id);
        }
        return removed != null;
    }

    /**
     * Returns all loaded modules in dependency order.
     *
     * @return The modules, dependencies first, or empty if the workspace contains a cycle.
     *         An empty result means the workspace must not be linked or merged.
     */
    public synchronized Optional<List<SourceModule>> getDocumentsInOrder() {
        return graph.topologicalSort().map(order -> {
            List<SourceModule> ordered = new ArrayList<>(order.size());
            for (ModuleId id : order) {
                ordered.add(modules.get(id).module());
            }
            return ordered;
        });
    }

    /**
     * Loads an entry module and its transitive import closure, depth-first.
     *
     * <p>Every id is visited at most once, so import cycles do not stall loading; a fully loaded
     * workspace may still be cyclic and therefore unlinkable. Modules that are already loaded are
     * not reloaded. A dependency that fails to load or parse is recorded in
     * {@link #getLoadFailures()} and loading continues.</p>
     *
     * @param entry  The entry module.
     * @param loader Supplies the content of each module.
     * @return A future that fails only if the entry itself cannot be loaded or parsed.
     */
    public CompletableFuture<Void> loadDocumentWithDependencies(ModuleId entry, ContentLoader loader) {
        log.debug("Loading {} with dependencies", entry);
        return load(entry, loader, ConcurrentHashMap.newKeySet(), true);
    }

    private CompletableFuture<Void> load(ModuleId id, ContentLoader loader, Set<ModuleId> visited, boolean isEntry) {
        if (!visited.add(id)) {
            return CompletableFuture.completedFuture(null);
        }
        Optional<ModuleInfo> existing = getModuleInfo(id);
        CompletableFuture<ModuleInfo> loaded;
        if (existing.isPresent()) {
            loaded = CompletableFuture.completedFuture(existing.get());
        } else {
            String known = prefetched.remove(id);
            CompletableFuture<String> content;
            if (known != null) {
                log.debug("Using content fetched during resolution for {}", id);
                content = CompletableFuture.completedFuture(known);
            } else {
                try {
                    content = loader.load(id);
                } catch (RuntimeException e) {
                    content = CompletableFuture.failedFuture(e);
                }
            }
            loaded = content
                    .handle((text, error) -> {
                        if (error != null) {
                            Throwable cause = unwrap(error);
                            throw new CompletionException(cause instanceof ImportException
                                    ? cause
                                    : new ModuleNotFoundException(id.value(), null, null, cause));
                        }
                        return text;
                    })
                    .thenCompose(text -> addSource(id, text));
        }

        return loaded.handle((info, error) -> {
            if (error == null) {
                return loadDependencies(info, loader, visited);
            }
            Throwable cause = unwrap(error);
            if (isEntry) {
                return CompletableFuture.<Void>failedFuture(cause);
            }
            ImportException failure = cause instanceof ImportException importException
                    ? importException
                    : new ModuleNotFoundException(id.value(), null, null, cause);
            loadFailures.put(id, failure);
            log.debug("Failed to load dependency {}: {}", id, failure.getMessage());
            return CompletableFuture.<Void>completedFuture(null);
        }).thenCompose(next -> next);
    }

    private CompletableFuture<Void> loadDependencies(ModuleInfo info, ContentLoader loader, Set<ModuleId> visited) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ModuleId dependency : info.dependencies()) {
            chain = chain.thenCompose(ignored -> load(dependency, loader, visited, false));
        }
        return chain;
    }

    public synchronized Optional<ModuleInfo> getModuleInfo(ModuleId id) {
        return Optional.ofNullable(modules.get(id));
    }

    public synchronized Optional<SourceModule> getModule(ModuleId id) {
        return getModuleInfo(id).map(ModuleInfo::module);
    }

    /**
     * Returns all loaded modules in registration order.
     */
    public synchronized List<SourceModule> getAllModules() {
        return modules.values().stream().map(ModuleInfo::module).toList();
    }

    public synchronized boolean hasModule(ModuleId id) {
        return modules.containsKey(id);
    }

    /**
     * Returns the graph owned by this workspace. Callers must not mutate it.
     */
    public DependencyGraph getDependencyGraph() {
        return graph;
    }

    public synchronized boolean hasCircularDependencies() {
        return !graph.detectCycles().isEmpty();
    }

    public synchronized List<CircularDependency> getCircularDependencies() {
        return graph.detectCycles();
    }

    /**
     * Returns every loaded module reachable from {@code id} through dependency edges,
     * excluding {@code id} unless it lies on a cycle.
     */
    public synchronized Set<ModuleId> getAllDependencies(ModuleId id) {
        Set<ModuleId> reachable = new LinkedHashSet<>();
        Deque<ModuleId> stack = new ArrayDeque<>(graph.getDependencies(id));
        while (!stack.isEmpty()) {
            ModuleId current = stack.pop();
            if (reachable.add(current)) {
                stack.addAll(graph.getDependencies(current));
            }
        }
        return reachable;
    }

    /**
     * Returns dependency ids that some loaded module imports but which are not loaded themselves.
     */
    public synchronized Set<ModuleId> getMissingDependencies() {
        Set<ModuleId> missing = new LinkedHashSet<>();
        for (ModuleInfo info : modules.values()) {
            for (ModuleId dependency : info.dependencies()) {
                if (!modules.containsKey(dependency)) {
                    missing.add(dependency);
                }
            }
        }
        return missing;
    }

    /**
     * Returns dependencies that could not be loaded by {@link #loadDocumentWithDependencies}.
     */
    public Map<ModuleId, ImportException> getLoadFailures() {
        return Map.copyOf(loadFailures);
    }

    public synchronized int size() {
        return modules.size();
    }

    public synchronized void clear() {
        modules.clear();
        graph.clear();
        loadFailures.clear();
        prefetched.clear();
        log.debug("Workspace cleared");
    }

    private static int lineOf(ImportException error) {
        return error.node() instanceof ImportStatement statement ? statement.line() : 0;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
