package org.machlink.compiler.frontend.module;

import org.machlink.compiler.frontend.io.SourceLoader;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies a module by its canonical URI string. Filesystem paths ({@code file:///...}),
 * remote URLs ({@code https://...}) and virtual paths ({@code virtual:/...}) share one
 * namespace; two ids are equal exactly when their canonical strings are equal.
 *
 * @param value The canonical URI string.
 */
public record ModuleId(String value) implements Comparable<ModuleId> {

    public static final String FILE_SCHEME = "file";
    public static final String VIRTUAL_SCHEME = "virtual";

    public ModuleId {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Creates the id of a local file. The path is made absolute and normalized.
     */
    public static ModuleId ofPath(Path path) {
        return new ModuleId(path.toAbsolutePath().normalize().toUri().toString());
    }

    /**
     * Creates the id of a remote module.
     */
    public static ModuleId ofUrl(String url) {
        return new ModuleId(URI.create(url).normalize().toString());
    }

    /**
     * Creates the id of a file in a virtual filesystem, e.g. {@code /lib/auth.dygram}.
     */
    public static ModuleId ofVirtual(String path) {
        String absolute = path.startsWith("/") ? path : "/" + path;
        try {
            return new ModuleId(new URI(VIRTUAL_SCHEME, null, absolute, null).normalize().toString());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid virtual path: " + path, e);
        }
    }

    /**
     * Parses any supported textual form: an {@code http(s)} URL, a {@code file:} or
     * {@code virtual:} URI, or a plain filesystem path.
     */
    public static ModuleId of(String text) {
        if (SourceLoader.isHttpUrl(text)) {
            return ofUrl(text);
        }
        if (text.startsWith(FILE_SCHEME + ":")) {
            return ofPath(Path.of(URI.create(text)));
        }
        if (text.startsWith(VIRTUAL_SCHEME + ":")) {
            String path;
            try {
                path = URI.create(text).getPath();
            } catch (IllegalArgumentException e) {
                path = text.substring(VIRTUAL_SCHEME.length() + 1);
            }
            return ofVirtual(path);
        }
        return ofPath(Path.of(text));
    }

    public URI toUri() {
        return URI.create(value);
    }

    public String scheme() {
        return toUri().getScheme();
    }

    public boolean isFile() {
        return FILE_SCHEME.equals(scheme());
    }

    public boolean isVirtual() {
        return VIRTUAL_SCHEME.equals(scheme());
    }

    public boolean isHttp() {
        return SourceLoader.isHttpUrl(value);
    }

    /**
     * Returns the local filesystem path of a {@code file:} id.
     * @throws IllegalStateException If this id is not a file id.
     */
    public Path toPath() {
        if (!isFile()) {
            throw new IllegalStateException("Not a file module: " + value);
        }
        return Path.of(toUri());
    }

    /**
     * Returns the decoded path component, e.g. {@code /lib/auth.dygram}.
     */
    public String path() {
        return toUri().getPath();
    }

    /**
     * Returns the last path segment, used in human-readable cycle chains.
     */
    public String fileName() {
        String path = path();
        if (path == null || path.isEmpty()) {
            return value;
        }
        int slash = path.lastIndexOf('/');
        String name = path.substring(slash + 1);
        return name.isEmpty() ? value : name;
    }

    @Override
    public int compareTo(ModuleId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
