package org.hexarena.runtime.skill;

import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.targeting.ScanDirection;
import org.hexarena.runtime.targeting.TargetingMethod;

/**
 * One targeting clause of a skill descriptor.
 *
 * @param method            strategy used to select targets
 * @param side              whose units are eligible, relative to the caster
 * @param excludeSelf       whether the caster itself is left out of the pool
 * @param includeCompanions whether companion units are eligible
 * @param count             number of targets to select; more than one is only meaningful for
 *                          {@link TargetingMethod#REARMOST}
 * @param direction         ring visiting order for ring scans
 * @param maxDistance       furthest ring a ring scan examines; 0 for no limit
 */
public record TargetRule(TargetingMethod method, Side side, boolean excludeSelf, boolean includeCompanions, int count,
                         ScanDirection direction, int maxDistance) {

    public TargetRule {
        if (count < 1) {
            throw new IllegalArgumentException("Target count must be at least 1, got " + count);
        }
        if (count > 1 && method != TargetingMethod.REARMOST) {
            throw new IllegalArgumentException("Only REARMOST supports more than one target, got " + method);
        }
        if (maxDistance < 0) {
            throw new IllegalArgumentException("Max distance must not be negative, got " + maxDistance);
        }
        if (direction == null) {
            direction = ScanDirection.FRONTMOST;
        }
    }

    public TargetRule(TargetingMethod method, Side side, boolean excludeSelf, boolean includeCompanions, int count) {
        this(method, side, excludeSelf, includeCompanions, count, ScanDirection.FRONTMOST, 0);
    }

    /**
     * Reads a rule from a descriptor's {@code targets} entry. {@code exclude-self} defaults to true
     * for own-side rules. {@code exclude-companions} takes precedence over {@code include-companions}.
     */
    public static TargetRule fromConfig(com.typesafe.config.Config config) {
        TargetingMethod method = TargetingMethod.valueOf(enumValue(config.getString("method")));
        Side side = config.hasPath("side") ? Side.valueOf(enumValue(config.getString("side"))) : Side.OPPOSING;
        boolean excludeSelf = config.hasPath("exclude-self") ? config.getBoolean("exclude-self") : side == Side.OWN;
        boolean includeCompanions;
        if (config.hasPath("exclude-companions")) {
            includeCompanions = !config.getBoolean("exclude-companions");
        } else {
            includeCompanions = !config.hasPath("include-companions") || config.getBoolean("include-companions");
        }
        int count = config.hasPath("count") ? config.getInt("count") : 1;
        ScanDirection direction = config.hasPath("direction")
            ? ScanDirection.valueOf(enumValue(config.getString("direction")))
            : ScanDirection.FRONTMOST;
        int maxDistance = config.hasPath("max-distance") ? config.getInt("max-distance") : 0;
        return new TargetRule(method, side, excludeSelf, includeCompanions, count, direction, maxDistance);
    }

    private static String enumValue(String raw) {
        return raw.trim().toUpperCase().replace('-', '_');
    }

    public Team targetTeam(Team casterTeam) {
        return side == Side.OWN ? casterTeam : casterTeam.opposing();
    }

    /**
     * Target side relative to the caster.
     */
    public enum Side {
        OWN,
        OPPOSING
    }
}
