package org.machlink.compiler.backend.merge;

/**
 * Provenance of a merged definition.
 *
 * @param sourceFile   The canonical id of the file the definition came from.
 * @param originalName The qualified name in that file, or {@code null} if it is unchanged.
 */
public record SourceMetadata(String sourceFile, String originalName) {

    public static SourceMetadata of(String sourceFile) {
        return new SourceMetadata(sourceFile, null);
    }

    public boolean isRenamed() {
        return originalName != null;
    }
}
