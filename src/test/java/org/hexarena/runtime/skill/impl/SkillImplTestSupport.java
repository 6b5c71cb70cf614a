package org.hexarena.runtime.skill.impl;

import org.hexarena.runtime.model.ArenaMap;
import org.hexarena.runtime.model.BoardLayout;
import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.pathfinding.NoOpPathfindingCache;
import org.hexarena.runtime.pathfinding.PathfindingEngine;
import org.hexarena.runtime.skill.SkillEngine;
import org.hexarena.runtime.skill.SkillRegistry;
import org.hexarena.runtime.spi.SeededRandomProvider;
import org.hexarena.runtime.targeting.TargetResolver;

import com.typesafe.config.ConfigFactory;

/**
 * Shared wiring for the skill behavior tests: a grid on the given arena and an engine with the
 * given descriptor list.
 */
final class SkillImplTestSupport {

    static final ArenaMap OPEN = ArenaMap.of("open",
        new int[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 12, 13, 16},
        new int[]{30, 33, 34, 36, 37, 38, 39, 40, 41, 42, 43, 44, 45},
        new int[0]);

    private SkillImplTestSupport() {}

    static SkillEngine engine(SpatialGrid grid, String skills, long seed) {
        SkillRegistry registry = SkillRegistry.fromConfig(ConfigFactory.parseString("skills = " + skills).getConfigList("skills"));
        TargetResolver resolver = new TargetResolver(grid, new PathfindingEngine(grid, new NoOpPathfindingCache()), unit -> 1);
        return new SkillEngine(registry, resolver, new SeededRandomProvider(seed));
    }

    static SpatialGrid grid(ArenaMap arena, int maxTeamSize) {
        return new SpatialGrid(BoardLayout.standard(), arena, maxTeamSize);
    }
}
