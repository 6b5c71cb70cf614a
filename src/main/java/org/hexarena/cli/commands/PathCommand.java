package org.hexarena.cli.commands;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.hexarena.cli.CommandLineInterface;
import org.hexarena.runtime.Battlefield;
import org.hexarena.runtime.model.BoardLayout;
import org.hexarena.runtime.model.HexCoordinate;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the shortest path between two tiles of the configured arena.
 */
@Command(
    name = "path",
    description = "Print the shortest path between two tiles"
)
public class PathCommand implements Callable<Integer> {

    @Option(names = {"--from"}, description = "Start tile id", required = true)
    private int from;

    @Option(names = {"--to"}, description = "Goal tile id", required = true)
    private int to;

    @Option(
        names = {"-a", "--arena"},
        description = "Arena key (default: hexarena.arena from configuration)"
    )
    private String arena;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        List<HexCoordinate> path;
        try {
            Battlefield battlefield = parent.createBattlefield();
            if (arena != null) {
                battlefield.selectArena(arena);
            }
            BoardLayout layout = battlefield.grid().getLayout();
            HexCoordinate start = layout.coordinateOf(from);
            HexCoordinate goal = layout.coordinateOf(to);
            if (start == null || goal == null) {
                err.println("Error: tile " + (start == null ? from : to) + " is not on the board");
                return 1;
            }
            path = battlefield.pathfinding().findPath(start, goal);
        } catch (IllegalArgumentException | com.typesafe.config.ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (path == null) {
            out.println("No path from " + from + " to " + to);
            return 3;
        }
        out.println("Path: " + path.stream().map(hex -> String.valueOf(hex.getId())).collect(Collectors.joining(" -> ")));
        out.println("Length: " + (path.size() - 1));
        return 0;
    }
}
