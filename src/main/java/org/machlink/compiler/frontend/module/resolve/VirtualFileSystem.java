package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.module.ModuleId;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory path to content map, used by editors and tests in place of a real disk.
 * Paths are normalized to absolute form ({@code lib/a.dygram} and {@code /lib/./a.dygram}
 * are the same file).
 */
public class VirtualFileSystem {

    private final Map<String, String> files = new ConcurrentHashMap<>();

    public void setFile(String path, String content) {
        files.put(normalize(path), content);
    }

    public boolean removeFile(String path) {
        return files.remove(normalize(path)) != null;
    }

    public boolean hasFile(String path) {
        return files.containsKey(normalize(path));
    }

    public Optional<String> read(String path) {
        return Optional.ofNullable(files.get(normalize(path)));
    }

    /**
     * Returns all stored paths in sorted order.
     */
    public List<String> paths() {
        return files.keySet().stream().sorted().toList();
    }

    public void clear() {
        files.clear();
    }

    private static String normalize(String path) {
        return ModuleId.ofVirtual(path).path();
    }
}
