package org.machlink.compiler.backend.link;

import org.machlink.compiler.VirtualWorkspace;
import org.machlink.compiler.diagnostics.Diagnostic;
import org.machlink.compiler.diagnostics.DiagnosticsEngine;
import org.machlink.compiler.frontend.module.error.CircularDependencyException;
import org.machlink.compiler.frontend.parser.ast.EdgeNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LinkingPhaseTest {

    @Test
    void linksDependenciesFirstAndReportsUnresolvedEndpoints() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Start\nstate Next\nStart -> Next")
                .file("/app.dygram", String.join("\n",
                        "import { Start } from \"./lib\"",
                        "state End",
                        "Start -> End",
                        "Group {",
                        "  state Inner",
                        "  Inner -> Ghost",
                        "}"));
        fixture.load("/app.dygram");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        LinkReport report = new LinkingPhase(fixture.workspace(), new CrossFileLinker(fixture.workspace()), diagnostics)
                .linkAll();

        assertThat(report.order()).containsExactly(
                VirtualWorkspace.id("/lib.dygram"), VirtualWorkspace.id("/app.dygram"));
        assertThat(report.links()).hasSize(5);
        assertThat(report.crossFileLinkCount()).isEqualTo(1);
        assertThat(report.isComplete()).isFalse();
        assertThat(report.unresolved()).singleElement()
                .satisfies(r -> assertThat(r.text()).isEqualTo("Ghost"));

        Diagnostic error = diagnostics.getErrors().get(0);
        assertThat(error.message()).isEqualTo("Could not resolve reference to \"Ghost\"");
        assertThat(error.property()).isEqualTo("target");
        assertThat(error.node()).isInstanceOf(EdgeNode.class);
        assertThat(error.line()).isEqualTo(6);
    }

    @Test
    void cleanWorkspaceLinksCompletely() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/app.dygram", "state A\nstate B\nA -> B --> A");
        fixture.load("/app.dygram");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        LinkReport report = new LinkingPhase(fixture.workspace(), new CrossFileLinker(fixture.workspace()), diagnostics)
                .linkAll();

        assertThat(report.isComplete()).isTrue();
        assertThat(report.links()).hasSize(4);
        assertThat(report.crossFileLinkCount()).isZero();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void rejectsCyclicWorkspace() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/a.dygram", "import { B } from \"./b\"\nstate A\nA -> B")
                .file("/b.dygram", "import { A } from \"./a\"\nstate B");
        fixture.load("/a.dygram");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        LinkingPhase phase = new LinkingPhase(fixture.workspace(), new CrossFileLinker(fixture.workspace()), diagnostics);

        assertThatThrownBy(phase::linkAll).isInstanceOf(CircularDependencyException.class);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }
}
