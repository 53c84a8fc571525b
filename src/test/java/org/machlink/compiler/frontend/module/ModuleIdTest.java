package org.machlink.compiler.frontend.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModuleIdTest {

    @TempDir
    Path tempDir;

    @Test
    void equalPathsGiveEqualIds() {
        ModuleId direct = ModuleId.ofPath(tempDir.resolve("app.dygram"));
        ModuleId roundabout = ModuleId.ofPath(tempDir.resolve("sub/../app.dygram"));

        assertThat(roundabout).isEqualTo(direct);
        assertThat(direct.isFile()).isTrue();
        assertThat(direct.toPath()).isEqualTo(tempDir.resolve("app.dygram").toAbsolutePath().normalize());
    }

    @Test
    void parsesEveryTextualForm() {
        assertThat(ModuleId.of("https://example.com/lib/a.dygram").isHttp()).isTrue();
        assertThat(ModuleId.of("virtual:/lib/a.dygram").isVirtual()).isTrue();
        assertThat(ModuleId.of(tempDir.resolve("a.dygram").toString()))
                .isEqualTo(ModuleId.ofPath(tempDir.resolve("a.dygram")));
        assertThat(ModuleId.of(tempDir.resolve("a.dygram").toUri().toString()))
                .isEqualTo(ModuleId.ofPath(tempDir.resolve("a.dygram")));
    }

    @Test
    void virtualIdsAreNormalized() {
        assertThat(ModuleId.ofVirtual("lib/./a.dygram")).isEqualTo(ModuleId.ofVirtual("/lib/a.dygram"));
        assertThat(ModuleId.ofVirtual("/lib/a.dygram").value()).isEqualTo("virtual:/lib/a.dygram");
        assertThat(ModuleId.ofVirtual("/lib/a.dygram").path()).isEqualTo("/lib/a.dygram");
    }

    @Test
    void virtualIdsAcceptRawAndEncodedSpaces() {
        ModuleId spaced = ModuleId.ofVirtual("/my lib/a.dygram");

        assertThat(ModuleId.of("virtual:/my lib/a.dygram")).isEqualTo(spaced);
        assertThat(ModuleId.of("virtual:/my%20lib/a.dygram")).isEqualTo(spaced);
        assertThat(ModuleId.of("virtual:/my lib/../b.dygram")).isEqualTo(ModuleId.ofVirtual("/b.dygram"));
        assertThat(spaced.fileName()).isEqualTo("a.dygram");
    }

    @Test
    void fileNameIsLastSegment() {
        assertThat(ModuleId.ofUrl("https://example.com/lib/auth.dygram").fileName()).isEqualTo("auth.dygram");
        assertThat(ModuleId.ofVirtual("/x/y.mach").fileName()).isEqualTo("y.mach");
    }

    @Test
    void idsAreComparableByCanonicalForm() {
        ModuleId b = ModuleId.ofVirtual("/b.dygram");
        ModuleId a = ModuleId.ofVirtual("/a.dygram");

        assertThat(List.of(b, a).stream().sorted().toList()).containsExactly(a, b);
    }

    @Test
    void toPathRejectsNonFileIds() {
        assertThatThrownBy(() -> ModuleId.ofVirtual("/a.dygram").toPath())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cycleDescriptionUsesFileNames() {
        CircularDependency cycle = new CircularDependency(List.of(
                ModuleId.ofVirtual("/a.dygram"), ModuleId.ofVirtual("/lib/b.dygram"), ModuleId.ofVirtual("/a.dygram")));

        assertThat(cycle.describe()).isEqualTo("a.dygram → b.dygram → a.dygram");
    }
}
