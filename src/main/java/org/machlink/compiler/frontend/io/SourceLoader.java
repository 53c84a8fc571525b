package org.machlink.compiler.frontend.io;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes local file loading and path classification for module resolution.
 * Remote content is fetched through {@link org.machlink.compiler.frontend.module.resolve.UrlFetcher}.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The canonical name used for deduplication and diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Checks whether the given path string represents an HTTP or HTTPS URL.
     */
    public static boolean isHttpUrl(String path) {
        return path != null && (path.startsWith("http://") || path.startsWith("https://"));
    }

    /**
     * Checks whether the given import path is relative ({@code ./x} or {@code ../x}).
     */
    public static boolean isRelative(String path) {
        return path != null && (path.startsWith("./") || path.startsWith("../"));
    }

    /**
     * Checks whether the given import path is a bare absolute path ({@code /x}, but not {@code //host}).
     */
    public static boolean isAbsolutePath(String path) {
        return path != null && path.startsWith("/") && !path.startsWith("//");
    }

    /**
     * Returns whether the last path segment carries a file extension.
     */
    public static boolean hasExtension(String path) {
        int slash = path.lastIndexOf('/');
        String last = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = last.lastIndexOf('.');
        return dot > 0 && dot < last.length() - 1;
    }

    /**
     * Loads content from a local filesystem path.
     *
     * @param resolvedPath The fully resolved, normalized path.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path resolvedPath) throws IOException {
        String logicalName = resolvedPath.toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(resolvedPath, StandardCharsets.UTF_8));
        return new LoadResult(content, logicalName);
    }

    /**
     * Resolves a relative path against a base URL, producing a new absolute URL.
     * For example, base {@code https://example.com/lib/auth.dygram} and relative
     * {@code ./session.dygram} yields {@code https://example.com/lib/session.dygram}.
     *
     * @param baseUrl      The base URL (the file that contains the import).
     * @param relativePath The relative path from the import.
     * @return The resolved absolute URL string.
     */
    public static String resolveHttpRelative(String baseUrl, String relativePath) {
        URI base = URI.create(baseUrl);
        URI resolved = base.resolve(relativePath);
        return resolved.toString();
    }

    public static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
