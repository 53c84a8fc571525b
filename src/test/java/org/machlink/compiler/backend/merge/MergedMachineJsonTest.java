package org.machlink.compiler.backend.merge;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.machlink.compiler.VirtualWorkspace;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MergedMachineJsonTest {

    private static final Instant GENERATED_AT = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void rendersMergedMachineWithSourceMapAndMetadata() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace()
                .file("/lib.dygram", "task Start \"Begin <here>\" {\n  prompt: \"go\"\n  state Inner\n}")
                .file("/app.dygram", "machine \"App\"\nversion: 2\nimport { Start as S } from \"./lib\"\nstate End\nS -> End");
        fixture.load("/app.dygram");
        MergedMachine merged = new ModuleMerger(fixture.workspace()).mergeMachines("app.dygram");

        String json = MergedMachineJson.toJson(merged, GENERATED_AT);
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();

        assertThat(json).contains("Begin <here>");
        assertThat(root.get("title").getAsString()).isEqualTo("App");
        assertThat(root.getAsJsonObject("attributes").get("version").getAsString()).isEqualTo("2");

        JsonObject start = root.getAsJsonArray("nodes").get(1).getAsJsonObject();
        assertThat(start.get("name").getAsString()).isEqualTo("S");
        assertThat(start.get("type").getAsString()).isEqualTo("task");
        assertThat(start.getAsJsonObject("attributes").get("prompt").getAsString()).isEqualTo("go");
        assertThat(start.getAsJsonArray("nodes").get(0).getAsJsonObject().get("name").getAsString())
                .isEqualTo("Inner");

        JsonObject edge = root.getAsJsonArray("edges").get(0).getAsJsonObject();
        assertThat(edge.get("source").getAsString()).isEqualTo("S");
        assertThat(edge.get("arrow").getAsString()).isEqualTo("->");

        JsonObject sourceMap = root.getAsJsonObject("sourceMap");
        assertThat(sourceMap.getAsJsonObject("S").get("originalName").getAsString()).isEqualTo("Start");
        assertThat(sourceMap.getAsJsonObject("End").has("originalName")).isFalse();

        JsonObject metadata = root.getAsJsonObject("_metadata");
        assertThat(metadata.get("entryPoint").getAsString()).isEqualTo("virtual:/app.dygram");
        assertThat(metadata.get("generatedAt").getAsString()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(metadata.get("multiFile").getAsBoolean()).isTrue();
        assertThat(metadata.getAsJsonArray("sourceFiles")).hasSize(2);
    }

    @Test
    void singleFileMachineIsNotMultiFile() throws Exception {
        VirtualWorkspace fixture = new VirtualWorkspace().file("/solo.dygram", "state Only");
        fixture.load("/solo.dygram");
        MergedMachine merged = new ModuleMerger(fixture.workspace()).mergeMachines("solo.dygram");

        JsonObject root = MergedMachineJson.toJsonTree(merged, GENERATED_AT);

        assertThat(root.get("title").isJsonNull()).isTrue();
        assertThat(root.getAsJsonObject("_metadata").get("multiFile").getAsBoolean()).isFalse();
    }
}
