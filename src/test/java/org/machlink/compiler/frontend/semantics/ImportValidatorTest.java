package org.machlink.compiler.frontend.semantics;

import org.machlink.compiler.VirtualWorkspace;
import org.machlink.compiler.diagnostics.Diagnostic;
import org.machlink.compiler.diagnostics.DiagnosticsEngine;
import org.machlink.compiler.diagnostics.Severity;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.SourceModule;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;
import org.machlink.compiler.frontend.parser.ast.MachineNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ImportValidatorTest {

    private static List<String> messages(DiagnosticsEngine diagnostics, Severity severity) {
        return diagnostics.getDiagnostics().stream()
                .filter(d -> d.severity() == severity)
                .map(Diagnostic::message)
                .toList();
    }

    private static DiagnosticsEngine validate(VirtualWorkspace fixture, ModuleId id) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new ImportValidator(fixture.workspace()).checkImports(id, diagnostics);
        return diagnostics;
    }

    @Test
    void cleanImportsProduceNoDiagnostics() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Start")
                .file("/app.dygram", "import { Start as Begin } from \"./lib\"\nstate End\nBegin -> End");
        ModuleId app = fixture.load("/app.dygram");

        assertThat(validate(fixture, app).getDiagnostics()).isEmpty();
    }

    @Test
    void reportsEmptyAliasAndEmptySymbolList() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Start")
                .file("/app.dygram", "import { Start as } from \"./lib\"\nimport { } from \"./lib\"");
        ModuleId app = fixture.load("/app.dygram");

        assertThat(messages(validate(fixture, app), Severity.ERROR))
                .containsExactly("Alias cannot be empty", "Import must specify at least one symbol");
    }

    @Test
    void reportsEmptyPathAndEmptySymbolName() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace();
        ModuleId id = VirtualWorkspace.id("/handmade.dygram");
        ImportStatement statement = new ImportStatement("",
                List.of(new ImportedSymbol("", null, id.value(), 1)), id.value(), 1);
        MachineNode machine = new MachineNode(null, List.of(statement), Map.of(), List.of(), List.of(), id.value());
        fixture.workspace().addDocument(SourceModule.of(id, machine, "")).get(5, TimeUnit.SECONDS);

        DiagnosticsEngine diagnostics = validate(fixture, id);

        assertThat(messages(diagnostics, Severity.ERROR))
                .containsExactly("Import path cannot be empty", "Symbol name cannot be empty");
        assertThat(diagnostics.getDiagnostics().get(0).property()).isEqualTo("path");
        assertThat(diagnostics.getDiagnostics().get(0).node()).isSameAs(statement);
    }

    @Test
    void reportsDuplicateAliasWithinStatement() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state A\nstate B")
                .file("/app.dygram", "import { A as X, B as X } from \"./lib\"");
        ModuleId app = fixture.load("/app.dygram");

        assertThat(messages(validate(fixture, app), Severity.ERROR))
                .contains("Duplicate alias \"X\" in import statement");
    }

    @Test
    void reportsLocalCollision() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Start")
                .file("/app.dygram", "import { Start as StartA } from \"./lib.dygram\"\nstate StartA");
        ModuleId app = fixture.load("/app.dygram");

        DiagnosticsEngine diagnostics = validate(fixture, app);

        assertThat(diagnostics.getErrors()).singleElement().satisfies(d -> {
            assertThat(d.message()).contains("collides with local node \"StartA\"");
            assertThat(d.property()).isEqualTo("alias");
            assertThat(d.line()).isEqualTo(1);
        });
    }

    @Test
    void reportsUnresolvedModuleAndMissingSymbol() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Present")
                .file("/app.dygram", "import { X } from \"./nowhere\"\nimport { Missing } from \"./lib\"");
        ModuleId app = fixture.load("/app.dygram");

        assertThat(messages(validate(fixture, app), Severity.ERROR)).containsExactly(
                "Cannot resolve module: \"./nowhere\"",
                "Symbol \"Missing\" not found in module \"./lib\"");
    }

    @Test
    void warnsAboutInsecureAndAbsoluteImports() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/shared/lib.dygram", "state Start")
                .file("/app.dygram", "import { Start } from \"/shared/lib\"\nimport { Remote } from \"http://example.com/r.dygram\"");
        ModuleId app = fixture.load("/app.dygram");

        DiagnosticsEngine diagnostics = validate(fixture, app);

        assertThat(messages(diagnostics, Severity.WARNING)).containsExactly(
                "Absolute paths may not be portable. Consider using relative paths.",
                "HTTP imports are insecure. Consider using HTTPS.");
    }

    @Test
    void warnsAboutAmbiguousShortNames() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "Left { state Child }\nRight { state Child }")
                .file("/app.dygram", "import { Child } from \"./lib\"");
        ModuleId app = fixture.load("/app.dygram");

        assertThat(messages(validate(fixture, app), Severity.WARNING)).singleElement()
                .satisfies(m -> assertThat(m).contains("Left.Child").contains("Right.Child"));
    }

    @Test
    void reportsCycleAsFileNameChainForEachParticipant() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/a.dygram", "import { B } from \"./b\"\nstate A")
                .file("/b.dygram", "import { A } from \"./a\"\nstate B");
        ModuleId a = fixture.load("/a.dygram");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new ImportValidator(fixture.workspace()).validateWorkspace(diagnostics);

        assertThat(messages(diagnostics, Severity.ERROR))
                .containsExactly(
                        "Circular dependency detected: a.dygram → b.dygram → a.dygram",
                        "Circular dependency detected: a.dygram → b.dygram → a.dygram");
        assertThat(validate(fixture, a).hasErrors()).isTrue();
    }
}
