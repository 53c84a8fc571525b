package org.machlink.cli.commands;

import com.typesafe.config.Config;
import org.machlink.compiler.frontend.module.ModuleId;
import org.machlink.compiler.frontend.module.WorkspaceManager;
import org.machlink.compiler.frontend.module.error.ImportException;
import org.machlink.compiler.frontend.module.resolve.DefaultContentLoader;
import org.machlink.compiler.frontend.module.resolve.ModuleResolvers;
import org.machlink.compiler.frontend.module.resolve.VirtualFileSystem;
import org.machlink.compiler.frontend.parser.OutlineParser;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Loads an entry file and its import closure into a fresh workspace for the CLI commands.
 */
final class WorkspaceLoader {

    private static final String LOAD_TIMEOUT_PATH = "machlink.cli.load-timeout";

    /**
     * A loaded workspace.
     *
     * @param workspace The workspace.
     * @param entry     The id of the entry module.
     */
    record Loaded(WorkspaceManager workspace, ModuleId entry) {}

    private WorkspaceLoader() {
    }

    /**
     * @param config The application config.
     * @param file   A local path or an {@code http(s)} URL.
     * @return The loaded workspace.
     * @throws ImportException If the entry itself cannot be loaded or parsed.
     * @throws TimeoutException If loading exceeds {@code machlink.cli.load-timeout}.
     */
    static Loaded load(Config config, String file) throws ImportException, TimeoutException, InterruptedException {
        VirtualFileSystem fileSystem = new VirtualFileSystem();
        WorkspaceManager workspace = new WorkspaceManager(
                ModuleResolvers.fromConfig(config, fileSystem), new OutlineParser());
        DefaultContentLoader loader = new DefaultContentLoader(fileSystem, ModuleResolvers.createFetcher(config));
        ModuleId entry = ModuleId.of(file);
        long timeoutMillis = config.getDuration(LOAD_TIMEOUT_PATH, TimeUnit.MILLISECONDS);

        try {
            workspace.loadDocumentWithDependencies(entry, loader).get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ImportException importException) {
                throw importException;
            }
            throw new ImportException("Failed to load " + file + ": " + e.getCause().getMessage(),
                    file, null, null, e.getCause());
        }
        return new Loaded(workspace, entry);
    }

    /**
     * Prints dependencies that failed to load, one per line.
     *
     * @return {@code true} if there were any.
     */
    static boolean printLoadFailures(WorkspaceManager workspace, PrintWriter err) {
        Map<ModuleId, ImportException> failures = workspace.getLoadFailures();
        failures.forEach((id, failure) -> err.println("[ERROR] " + id + ": " + failure.getMessage()));
        return !failures.isEmpty();
    }
}
