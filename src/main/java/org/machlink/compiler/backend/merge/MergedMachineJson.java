package org.machlink.compiler.backend.merge;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.EdgeNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link MergedMachine} as JSON for downstream tooling.
 *
 * <p>Shape: {@code title}, {@code attributes}, {@code nodes} (nested), {@code edges},
 * {@code sourceMap} and {@code _metadata} with {@code sourceFiles}, {@code entryPoint},
 * {@code generatedAt} and {@code multiFile}.</p>
 */
public final class MergedMachineJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private MergedMachineJson() {
    }

    public static String toJson(MergedMachine merged) {
        return toJson(merged, Instant.now());
    }

    public static String toJson(MergedMachine merged, Instant generatedAt) {
        return GSON.toJson(toJsonTree(merged, generatedAt));
    }

    public static JsonObject toJsonTree(MergedMachine merged, Instant generatedAt) {
        JsonObject root = new JsonObject();
        root.addProperty("title", merged.machine().title());
        root.add("attributes", attributes(merged.machine().attributes()));
        root.add("nodes", nodes(merged.machine().definitions()));
        root.add("edges", edges(merged.machine().edges()));

        JsonObject sourceMap = new JsonObject();
        for (Map.Entry<String, SourceMetadata> entry : merged.sourceMap().entrySet()) {
            JsonObject metadata = new JsonObject();
            metadata.addProperty("sourceFile", entry.getValue().sourceFile());
            if (entry.getValue().isRenamed()) {
                metadata.addProperty("originalName", entry.getValue().originalName());
            }
            sourceMap.add(entry.getKey(), metadata);
        }
        root.add("sourceMap", sourceMap);

        JsonObject metadata = new JsonObject();
        JsonArray sourceFiles = new JsonArray();
        merged.sourceFiles().forEach(sourceFiles::add);
        metadata.add("sourceFiles", sourceFiles);
        metadata.addProperty("entryPoint", merged.entryPoint());
        metadata.addProperty("generatedAt", generatedAt.toString());
        metadata.addProperty("multiFile", merged.sourceFiles().size() > 1);
        root.add("_metadata", metadata);
        return root;
    }

    private static JsonArray nodes(List<DefinitionNode> definitions) {
        JsonArray array = new JsonArray();
        for (DefinitionNode definition : definitions) {
            JsonObject node = new JsonObject();
            node.addProperty("name", definition.name());
            if (definition.type() != null) {
                node.addProperty("type", definition.type());
            }
            if (definition.title() != null) {
                node.addProperty("title", definition.title());
            }
            node.add("attributes", attributes(definition.attributes()));
            node.add("nodes", nodes(definition.children()));
            node.add("edges", edges(definition.edges()));
            array.add(node);
        }
        return array;
    }

    private static JsonArray edges(List<EdgeNode> edges) {
        JsonArray array = new JsonArray();
        for (EdgeNode edge : edges) {
            JsonObject object = new JsonObject();
            object.addProperty("source", edge.source());
            object.addProperty("target", edge.target());
            object.addProperty("arrow", edge.arrow());
            array.add(object);
        }
        return array;
    }

    private static JsonObject attributes(Map<String, String> attributes) {
        JsonObject object = new JsonObject();
        attributes.forEach(object::addProperty);
        return object;
    }
}
