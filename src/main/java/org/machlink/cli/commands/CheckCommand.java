package org.machlink.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.machlink.cli.CommandLineInterface;
import org.machlink.compiler.backend.link.CrossFileLinker;
import org.machlink.compiler.backend.link.LinkReport;
import org.machlink.compiler.backend.link.LinkingPhase;
import org.machlink.compiler.diagnostics.Diagnostic;
import org.machlink.compiler.diagnostics.DiagnosticsEngine;
import org.machlink.compiler.frontend.module.WorkspaceManager;
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
 * CLI command that validates imports and links all references of an entry file's workspace.
 */
@Command(
    name = "check",
    description = "Validate imports and cross-file references"
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Entry file (local path or http(s) URL)"
    )
    private String file;

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
            WorkspaceManager workspace = loaded.workspace();

            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            new ImportValidator(workspace).validateWorkspace(diagnostics);
            boolean loadFailed = WorkspaceLoader.printLoadFailures(workspace, out);

            LinkReport report = null;
            if (!workspace.hasCircularDependencies()) {
                report = new LinkingPhase(workspace, new CrossFileLinker(workspace), diagnostics).linkAll();
            }

            for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
                out.println(diagnostic);
            }
            if (diagnostics.hasErrors() || loadFailed) {
                out.printf("%d error(s) in %d module(s).%n", diagnostics.getErrors().size(), workspace.size());
                out.flush();
                return 1;
            }
            out.printf("No problems found in %d module(s), %d reference(s) linked (%d cross-file).%n",
                    workspace.size(), report.links().size(), report.crossFileLinkCount());
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
            log.error("Check failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
