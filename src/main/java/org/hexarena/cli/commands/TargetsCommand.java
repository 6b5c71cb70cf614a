package org.hexarena.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.hexarena.cli.CommandLineInterface;
import org.hexarena.runtime.Battlefield;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.skill.SkillState;
import org.hexarena.runtime.targeting.TargetInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Places units on an arena and prints what every active skill targets, followed by the closest
 * target of every unit on both teams.
 */
@Command(
    name = "targets",
    description = "Place units and print skill targets and closest targets"
)
public class TargetsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TargetsCommand.class);

    @Option(
        names = {"-p", "--place"},
        description = "Placement as <tile>:<team>:<unit>, e.g. 9:ally:46 (repeatable)",
        required = true
    )
    private List<String> placements = new ArrayList<>();

    @Option(
        names = {"-a", "--arena"},
        description = "Arena key (default: hexarena.arena from configuration)"
    )
    private String arena;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    /**
     * A parsed {@code --place} value.
     */
    record Placement(int tileId, Team team, UnitId unit) {

        static Placement parse(String value) {
            String[] parts = value.split(":");
            if (parts.length != 3) {
                throw new IllegalArgumentException("Placement must be <tile>:<team>:<unit>, got '" + value + "'");
            }
            try {
                return new Placement(
                    Integer.parseInt(parts[0].trim()),
                    Team.valueOf(parts[1].trim().toUpperCase(Locale.ROOT)),
                    UnitId.main(Integer.parseInt(parts[2].trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Placement must be <tile>:<team>:<unit>, got '" + value + "'", e);
            }
        }
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        Battlefield battlefield;
        List<Placement> parsed = new ArrayList<>();
        try {
            battlefield = parent.createBattlefield();
            if (arena != null) {
                battlefield.selectArena(arena);
            }
            for (String value : placements) {
                parsed.add(Placement.parse(value));
            }
        } catch (IllegalArgumentException | com.typesafe.config.ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        int failed = 0;
        for (Placement placement : parsed) {
            if (!battlefield.transactions().place(placement.tileId(), placement.unit(), placement.team())) {
                err.printf("Could not place %s for %s on tile %d%n",
                    battlefield.nameOf(placement.unit()), placement.team(), placement.tileId());
                failed++;
            }
        }
        log.debug("Placed {} of {} units", parsed.size() - failed, parsed.size());

        out.println("=== Skill Targets ===");
        List<SkillState> states = battlefield.skills().getActiveStates();
        if (states.isEmpty()) {
            out.println("  (no active skills)");
        }
        for (SkillState state : states) {
            UnitId unit = state.getOwner().unit();
            Team team = state.getOwner().team();
            List<TargetInfo> targets = battlefield.skills().getTargets(unit, team);
            out.printf("  %s (%s, tile %d): %s%n", battlefield.nameOf(unit), team, state.getTileId(),
                targets.isEmpty() ? "no target" : describe(battlefield, targets));
        }

        printClosest(out, battlefield, Team.ALLY);
        printClosest(out, battlefield, Team.ENEMY);
        return failed == 0 ? 0 : 2;
    }

    private static void printClosest(PrintWriter out, Battlefield battlefield, Team source) {
        out.println("=== Closest Targets (" + source + " -> " + source.opposing() + ") ===");
        Map<Integer, TargetInfo> closest = battlefield.targets().closestTargetMap(source, source.opposing());
        if (closest.isEmpty()) {
            out.println("  (none)");
        }
        closest.forEach((sourceTile, target) -> out.printf("  %d -> %d (%s, %s moves)%n",
            sourceTile, target.targetTileId(), battlefield.nameOf(target.targetUnit()),
            target.metadata().get(TargetInfo.MOVEMENT_DISTANCE)));
    }

    private static String describe(Battlefield battlefield, List<TargetInfo> targets) {
        List<String> parts = new ArrayList<>();
        for (TargetInfo target : targets) {
            String name = target.targetUnit() == null ? "empty" : battlefield.nameOf(target.targetUnit());
            parts.add("tile " + target.targetTileId() + " (" + name + ")");
        }
        return String.join(", ", parts);
    }
}
