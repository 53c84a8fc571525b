package org.machlink.cli.commands;

import org.machlink.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the order command.
 */
@Tag("unit")
public class OrderCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testPrintsDependenciesFirst() throws Exception {
        Files.writeString(tempDir.resolve("a.dygram"), "state Base\n");
        Files.writeString(tempDir.resolve("b.dygram"), "import { Base } from \"./a\"\nstate Mid\n");
        Path app = tempDir.resolve("app.dygram");
        Files.writeString(app, "import { Mid } from \"./b.dygram\"\n");

        int exitCode = run("order", "-f", app.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        String[] lines = out.toString().trim().split("\\R");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).startsWith("file:").endsWith("/a.dygram");
        assertThat(lines[1]).endsWith("/b.dygram");
        assertThat(lines[2]).endsWith("/app.dygram");
    }

    @Test
    void testReportsSelfImportCycle() throws Exception {
        Path self = tempDir.resolve("self.dygram");
        Files.writeString(self, "import { Loop } from \"./self\"\nstate Loop\n");

        int exitCode = run("order", "-f", self.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString())
            .contains("Circular dependencies detected:")
            .contains("self.dygram → self.dygram");
        assertThat(out.toString()).isEmpty();
    }
}
