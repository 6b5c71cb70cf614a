package org.hexarena.runtime.skill;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.hexarena.runtime.model.Team;

/**
 * Data-driven description of a unit's skill, read from one entry of the {@code hexarena.skills} list:
 * <pre>
 * {
 *   unit = 46
 *   name = "Vala"
 *   kind = targeting
 *   targets = [ { method = furthest, side = opposing } ]
 *   colors { targeting = "#7c3aed" }
 * }
 * </pre>
 * Companion skills set {@code companions} (count) and optionally {@code companion-range}. Demolition
 * zones list their tiles per team under {@code zones.ally} and {@code zones.enemy}.
 *
 * @param unitId          main unit the skill belongs to
 * @param name            display name
 * @param kind            behavior
 * @param targets         targeting clauses, empty for kinds that do not use them
 * @param companionCount  companions spawned, 0 for non-companion kinds
 * @param companionRange  attack range of spawned companions, or 0 to use the caster's range
 * @param selfColor       color hint for the caster, or {@code null}
 * @param companionColor  color hint for companions, or {@code null}
 * @param targetingColor  color of the source-to-target indicator, or {@code null}
 * @param tileColor       color hint for marked tiles, or {@code null}
 * @param zones           tiles painted per caster team, empty for kinds other than demolition zones
 */
public record SkillDescriptor(
    int unitId,
    String name,
    SkillKind kind,
    List<TargetRule> targets,
    int companionCount,
    int companionRange,
    String selfColor,
    String companionColor,
    String targetingColor,
    String tileColor,
    Map<Team, DemolitionZone> zones
) {

    public SkillDescriptor {
        targets = List.copyOf(targets);
        zones = Map.copyOf(zones);
        if (kind == SkillKind.DEMOLITION_ZONE && zones.isEmpty()) {
            throw new IllegalArgumentException("Demolition zone of unit " + unitId + " needs tiles for at least one team");
        }
        if (kind == SkillKind.COMPANION && companionCount < 1) {
            throw new IllegalArgumentException("Companion skill of unit " + unitId + " must spawn at least one companion");
        }
        if (kind == SkillKind.TARGETING && targets.isEmpty()) {
            throw new IllegalArgumentException("Targeting skill of unit " + unitId + " needs at least one target rule");
        }
        if (companionRange < 0) {
            throw new IllegalArgumentException("Companion range of unit " + unitId + " must not be negative");
        }
    }

    public SkillDescriptor(int unitId, String name, SkillKind kind, List<TargetRule> targets, int companionCount,
                           int companionRange, String selfColor, String companionColor, String targetingColor,
                           String tileColor) {
        this(unitId, name, kind, targets, companionCount, companionRange, selfColor, companionColor, targetingColor,
            tileColor, Map.of());
    }

    /**
     * Parses one descriptor entry.
     *
     * @throws IllegalArgumentException           on unknown kinds or methods
     * @throws com.typesafe.config.ConfigException on missing or mistyped required keys
     */
    public static SkillDescriptor fromConfig(com.typesafe.config.Config config) {
        int unitId = config.getInt("unit");
        List<TargetRule> rules = new ArrayList<>();
        if (config.hasPath("targets")) {
            for (com.typesafe.config.Config rule : config.getConfigList("targets")) {
                rules.add(TargetRule.fromConfig(rule));
            }
        }
        Map<Team, DemolitionZone> zones = new EnumMap<>(Team.class);
        for (Team team : Team.values()) {
            String path = "zones." + team.name().toLowerCase();
            if (config.hasPath(path)) {
                zones.put(team, DemolitionZone.fromConfig(config.getConfig(path)));
            }
        }
        return new SkillDescriptor(
            unitId,
            config.hasPath("name") ? config.getString("name") : "Skill " + unitId,
            SkillKind.fromConfigValue(config.getString("kind")),
            rules,
            config.hasPath("companions") ? config.getInt("companions") : 0,
            config.hasPath("companion-range") ? config.getInt("companion-range") : 0,
            optionalString(config, "colors.self"),
            optionalString(config, "colors.companion"),
            optionalString(config, "colors.targeting"),
            optionalString(config, "colors.tile"),
            zones);
    }

    private static String optionalString(com.typesafe.config.Config config, String path) {
        return config.hasPath(path) ? config.getString(path) : null;
    }
}
