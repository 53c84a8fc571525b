package org.machlink.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.machlink.cli.CommandLineInterface;
import org.machlink.compiler.frontend.module.CircularDependency;
import org.machlink.compiler.frontend.module.SourceModule;
import org.machlink.compiler.frontend.module.WorkspaceManager;
import org.machlink.compiler.frontend.module.error.ImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints the dependency order of an entry file's workspace.
 */
@Command(
    name = "order",
    description = "Print modules in dependency order, or the import cycles preventing one"
)
public class OrderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OrderCommand.class);

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
            WorkspaceManager workspace = WorkspaceLoader.load(parent.getConfig(), file).workspace();
            Optional<List<SourceModule>> order = workspace.getDocumentsInOrder();
            if (order.isEmpty()) {
                err.println("Circular dependencies detected:");
                for (CircularDependency cycle : workspace.getCircularDependencies()) {
                    err.println("  " + cycle.describe());
                }
                return 1;
            }
            for (SourceModule module : order.get()) {
                out.println(module.id());
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
            log.error("Order failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
