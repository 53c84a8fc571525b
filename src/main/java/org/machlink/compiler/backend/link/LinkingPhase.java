package org.machlink.compiler.backend.link;

import org.machlink.compiler.diagnostics.DiagnosticAcceptor;
import org.machlink.compiler.diagnostics.Severity;
import org.machlink.compiler.frontend.module.CircularDependency;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.SourceModule;
import org.machlink.compiler.frontend.module.WorkspaceManager;
import org.machlink.compiler.frontend.module.error.CircularDependencyException;
import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.EdgeNode;
import org.machlink.compiler.frontend.semantics.DefinitionLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Links every edge endpoint of every loaded module, dependencies first.
 * A cyclic workspace is rejected as a whole; there is no partial linking.
 */
public class LinkingPhase {

    private static final Logger log = LoggerFactory.getLogger(LinkingPhase.class);

    private final WorkspaceManager workspace;
    private final CrossFileLinker linker;
    private final DiagnosticAcceptor diagnostics;

    public LinkingPhase(WorkspaceManager workspace, CrossFileLinker linker, DiagnosticAcceptor diagnostics) {
        this.workspace = workspace;
        this.linker = linker;
        this.diagnostics = diagnostics;
    }

    /**
     * @return The report of all resolved and unresolved references.
     * @throws CircularDependencyException If the workspace contains an import cycle.
     */
    public LinkReport linkAll() throws CircularDependencyException {
        Optional<List<SourceModule>> ordered = workspace.getDocumentsInOrder();
        if (ordered.isEmpty()) {
            List<CircularDependency> cycles = workspace.getCircularDependencies();
            throw new CircularDependencyException(cycles.get(0).cycle(), null, null);
        }

        List<LinkReport.Link> links = new ArrayList<>();
        List<Reference> unresolved = new ArrayList<>();
        List<ModuleId> order = new ArrayList<>();

        for (SourceModule module : ordered.get()) {
            order.add(module.id());
            for (EdgeNode edge : edgesOf(module)) {
                link(new Reference(edge.source(), module.id(), edge, "source"), links, unresolved);
                link(new Reference(edge.target(), module.id(), edge, "target"), links, unresolved);
            }
        }

        LinkReport report = new LinkReport(order, links, unresolved);
        log.debug("Linked {} modules: {} references resolved ({} cross-file), {} unresolved",
                order.size(), links.size(), report.crossFileLinkCount(), unresolved.size());
        return report;
    }

    private void link(Reference reference, List<LinkReport.Link> links, List<Reference> unresolved) {
        LinkResult result = linker.link(reference);
        if (result.isResolved()) {
            links.add(new LinkReport.Link(reference, result));
        } else {
            unresolved.add(reference);
            diagnostics.accept(Severity.ERROR, result.failureMessage(), reference.container(), reference.property());
        }
    }

    /**
     * Returns the top-level edges and the edges of every nested block, in document order.
     */
    static List<EdgeNode> edgesOf(SourceModule module) {
        List<EdgeNode> edges = new ArrayList<>(module.ast().edges());
        for (DefinitionNode definition : DefinitionLookup.allDefinitions(module.ast())) {
            edges.addAll(definition.edges());
        }
        return edges;
    }
}
