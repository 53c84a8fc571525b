package org.machlink.compiler.frontend.semantics;

import org.machlink.compiler.VirtualWorkspace;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.error.SymbolCollisionException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ImportScopeBuilderTest {

    @Test
    void registersSymbolsUnderEffectiveNames() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Start\nGroup { state Inner }")
                .file("/app.dygram", "import { Start as Begin, Group.Inner } from \"./lib\"");
        ModuleId app = fixture.load("/app.dygram");

        ImportScope scope = new ImportScopeBuilder(fixture.workspace()).build(app);

        assertThat(scope.entries()).containsOnlyKeys("Begin", "Inner");
        SymbolEntry begin = scope.lookup("Begin").orElseThrow();
        assertThat(begin.originalName()).isEqualTo("Start");
        assertThat(begin.originModuleId()).isEqualTo(VirtualWorkspace.id("/lib.dygram"));
        assertThat(scope.lookup("Inner").orElseThrow().originalName()).isEqualTo("Group.Inner");
        assertThat(scope.hasProblems()).isFalse();
    }

    @Test
    void localDefinitionWinsAndCollisionIsReported() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Start")
                .file("/app.dygram", "import { Start as StartA } from \"./lib.dygram\"\nstate StartA");
        ModuleId app = fixture.load("/app.dygram");

        ImportScope scope = new ImportScopeBuilder(fixture.workspace()).build(app);

        assertThat(scope.lookup("StartA")).isEmpty();
        assertThat(scope.collisions()).singleElement().satisfies(collision -> {
            assertThat(collision.isLocalCollision()).isTrue();
            assertThat(collision.getMessage()).contains("collides with local node \"StartA\"");
        });
    }

    @Test
    void everyCollisionIsCollectedAndFirstImportWins() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/a.dygram", "state X\nstate Y")
                .file("/b.dygram", "state X\nstate Y")
                .file("/app.dygram", "import { X, Y } from \"./a\"\nimport { X, Y } from \"./b\"");
        ModuleId app = fixture.load("/app.dygram");

        ImportScope scope = new ImportScopeBuilder(fixture.workspace()).build(app);

        assertThat(scope.collisions()).extracting(SymbolCollisionException::symbolName).containsExactly("X", "Y");
        assertThat(scope.collisions().get(0).getMessage())
                .isEqualTo("Symbol \"X\" is imported from both \"./a\" and \"./b\"");
        assertThat(scope.lookup("X").orElseThrow().originModuleId()).isEqualTo(VirtualWorkspace.id("/a.dygram"));
    }

    @Test
    void sameDefinitionThroughTwoImportsIsNotACollision() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Shared")
                .file("/app.dygram", "import { Shared } from \"./lib\"\nimport { Shared } from \"./lib.dygram\"");
        ModuleId app = fixture.load("/app.dygram");

        ImportScope scope = new ImportScopeBuilder(fixture.workspace()).build(app);

        assertThat(scope.collisions()).isEmpty();
        assertThat(scope.entries()).containsOnlyKeys("Shared");
    }

    @Test
    void missingSymbolIsReported() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "state Present")
                .file("/app.dygram", "import { Missing, Present } from \"./lib\"");
        ModuleId app = fixture.load("/app.dygram");

        ImportScope scope = new ImportScopeBuilder(fixture.workspace()).build(app);

        assertThat(scope.missingSymbols()).singleElement()
                .satisfies(missing -> assertThat(missing.symbolName()).isEqualTo("Missing"));
        assertThat(scope.entries()).containsOnlyKeys("Present");
    }

    @Test
    void ambiguousShortNameUsesFirstDeclaration() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "Left { state Child }\nRight { state Child }")
                .file("/app.dygram", "import { Child } from \"./lib\"");
        ModuleId app = fixture.load("/app.dygram");

        ImportScope scope = new ImportScopeBuilder(fixture.workspace()).build(app);

        assertThat(scope.lookup("Child").orElseThrow().originalName()).isEqualTo("Left.Child");
        assertThat(scope.ambiguities()).singleElement().satisfies(ambiguity ->
                assertThat(ambiguity.match().alternatives()).extracting(d -> d.qualifiedName())
                        .containsExactly("Right.Child"));
    }

    @Test
    void unknownModuleIsRejected() {
        ImportScopeBuilder builder = new ImportScopeBuilder(new VirtualWorkspace().workspace());

        assertThatThrownBy(() -> builder.build(VirtualWorkspace.id("/nope.dygram")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
