package org.hexarena.cli.commands;

import org.hexarena.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the path command.
 */
@Tag("unit")
public class PathCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testHelpOutput() {
        run("path", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("--from");
        assertThat(output).contains("--to");
    }

    @Test
    void testPathAroundObstacles() {
        int exitCode = run("path", "--from", "6", "--to", "30", "-a", "arena-2");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).startsWith("Path: 6 -> ").contains("Length: 6");
    }

    @Test
    void testPathOnOpenArena() {
        int exitCode = run("path", "--from", "9", "--to", "37");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("Length: 4");
    }

    @Test
    void testBlockedGoalHasNoPath() {
        int exitCode = run("path", "--from", "6", "--to", "9", "-a", "arena-2");

        assertThat(exitCode).isEqualTo(3);
        assertThat(out.toString()).contains("No path from 6 to 9");
    }

    @Test
    void testOffBoardTile() {
        int exitCode = run("path", "--from", "6", "--to", "99");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("tile 99 is not on the board");
    }
}
