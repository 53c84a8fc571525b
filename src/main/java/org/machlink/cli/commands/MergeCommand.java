package org.machlink.cli.commands;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

import org.machlink.cli.CommandLineInterface;
import org.machlink.compiler.backend.merge.MergedMachine;
import org.machlink.compiler.backend.merge.MergedMachineJson;
import org.machlink.compiler.backend.merge.ModuleMerger;
import org.machlink.compiler.backend.merge.SourceMetadata;
import org.machlink.compiler.diagnostics.DiagnosticsEngine;
import org.machlink.compiler.frontend.module.error.ImportException;
import org.machlink.compiler.frontend.semantics.ImportValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that merges an entry file and its imports into one machine.
 * The workspace is validated first; any error aborts the merge.
 */
@Command(
    name = "merge",
    description = "Merge an entry file and its transitive imports into a single machine"
)
public class MergeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    /**
     * Output formats.
     */
    enum Format { JSON, SUMMARY }

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Entry file (local path or http(s) URL)"
    )
    private String file;

    @Option(
        names = {"--format"},
        defaultValue = "JSON",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private Format format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            WorkspaceLoader.Loaded loaded = WorkspaceLoader.load(parent.getConfig(), file);

            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            new ImportValidator(loaded.workspace()).validateWorkspace(diagnostics);
            boolean loadFailed = WorkspaceLoader.printLoadFailures(loaded.workspace(), err);
            if (diagnostics.hasErrors() || loadFailed) {
                if (!diagnostics.summary().isEmpty()) {
                    err.println(diagnostics.summary());
                }
                err.println("Error: merge aborted due to import errors.");
                return 1;
            }

            MergedMachine merged = new ModuleMerger(loaded.workspace()).mergeMachines(loaded.entry().value());
            if (format == Format.SUMMARY) {
                printSummary(merged, out);
            } else {
                out.println(MergedMachineJson.toJson(merged));
            }
            out.flush();
            return 0;

        } catch (ImportException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: interrupted");
            return 1;
        } catch (Exception e) {
            log.error("Merge failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printSummary(MergedMachine merged, PrintWriter out) {
        out.printf("Machine: %s%n", merged.machine().title() != null ? merged.machine().title() : "(untitled)");
        out.printf("Files:   %d%n", merged.sourceFiles().size());
        for (String sourceFile : merged.sourceFiles()) {
            out.printf("  %s%n", sourceFile);
        }
        out.printf("Nodes:   %d%n", merged.machine().definitions().size());
        out.printf("Edges:   %d%n", merged.machine().edges().size());
        for (Map.Entry<String, SourceMetadata> entry : merged.sourceMap().entrySet()) {
            SourceMetadata metadata = entry.getValue();
            out.printf("  %s <- %s%s%n", entry.getKey(), metadata.sourceFile(),
                    metadata.isRenamed() ? " (" + metadata.originalName() + ")" : "");
        }
    }
}
