package org.hexarena.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.hexarena.runtime.catalog.ConfigUnitCatalog;
import org.hexarena.runtime.model.ArenaMap;
import org.hexarena.runtime.model.BoardLayout;
import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.pathfinding.IPathfindingCache;
import org.hexarena.runtime.pathfinding.LruPathfindingCache;
import org.hexarena.runtime.pathfinding.NoOpPathfindingCache;
import org.hexarena.runtime.pathfinding.PathfindingEngine;
import org.hexarena.runtime.skill.SkillEngine;
import org.hexarena.runtime.skill.SkillRegistry;
import org.hexarena.runtime.spi.IRandomProvider;
import org.hexarena.runtime.spi.IUnitCatalog;
import org.hexarena.runtime.spi.SeededRandomProvider;
import org.hexarena.runtime.targeting.IRangeProvider;
import org.hexarena.runtime.targeting.TargetResolver;
import org.hexarena.runtime.transaction.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One fully wired engine instance: grid, pathfinding, target resolution, skills and the
 * transaction coordinator, built from the {@code hexarena} configuration block.
 * <p>
 * Reads (path and target queries) go straight to the components; every mutation goes through
 * {@link #transactions()}.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Confine an instance to one thread.
 */
public class Battlefield {

    private static final Logger LOG = LoggerFactory.getLogger(Battlefield.class);

    private final Map<String, ArenaMap> arenas;
    private final IUnitCatalog catalog;
    private final SpatialGrid grid;
    private final PathfindingEngine pathfinding;
    private final TargetResolver targets;
    private final SkillEngine skills;
    private final TransactionCoordinator transactions;

    public Battlefield(BoardLayout layout, Map<String, ArenaMap> arenas, String arenaKey, int defaultMaxTeamSize,
                       IPathfindingCache cache, int maxNodesExplored, int maxMovementDistance,
                       IUnitCatalog catalog, SkillRegistry registry, IRandomProvider random) {
        ArenaMap arena = arenas.get(arenaKey);
        if (arena == null) {
            throw new IllegalArgumentException("Unknown arena '" + arenaKey + "', known: " + arenas.keySet());
        }
        this.arenas = Collections.unmodifiableMap(new LinkedHashMap<>(arenas));
        this.catalog = catalog;
        this.grid = new SpatialGrid(layout, arena, defaultMaxTeamSize);
        this.pathfinding = new PathfindingEngine(grid, cache, maxNodesExplored, maxMovementDistance);
        this.targets = new TargetResolver(grid, pathfinding, rangeProvider(catalog, registry));
        this.skills = new SkillEngine(registry, targets, random);
        this.transactions = new TransactionCoordinator(grid, pathfinding, skills, random);
    }

    /**
     * Builds a battlefield on the standard board from the root configuration.
     *
     * @param config configuration containing the {@code hexarena} block
     * @throws IllegalArgumentException               if the selected arena or a skill descriptor is invalid
     * @throws com.typesafe.config.ConfigException    if required keys are missing or mistyped
     */
    public static Battlefield fromConfig(com.typesafe.config.Config config) {
        com.typesafe.config.Config root = config.getConfig("hexarena");

        Map<String, ArenaMap> arenas = new LinkedHashMap<>();
        com.typesafe.config.Config arenasConfig = root.getConfig("arenas");
        for (String key : arenasConfig.root().keySet()) {
            arenas.put(key, ArenaMap.fromConfig(key, arenasConfig.getConfig(key)));
        }

        com.typesafe.config.Config pathConfig = root.getConfig("pathfinding");
        IPathfindingCache cache = pathConfig.getBoolean("cache-enabled")
            ? LruPathfindingCache.fromConfig(pathConfig)
            : new NoOpPathfindingCache();

        long seed = root.getLong("random-seed");
        Battlefield battlefield = new Battlefield(
            BoardLayout.standard(),
            arenas,
            root.getString("arena"),
            root.getInt("grid.default-max-team-size"),
            cache,
            pathConfig.getInt("max-nodes-explored"),
            pathConfig.getInt("max-movement-distance"),
            new ConfigUnitCatalog(root.getConfig("units")),
            SkillRegistry.fromConfig(root.getConfigList("skills")),
            new SeededRandomProvider(seed));
        LOG.info("Battlefield ready: arena '{}', {} units in catalog, {} skills, seed {}",
            battlefield.grid.getArena().getName(), battlefield.catalog.all().size(),
            battlefield.skills.getRegistry().size(), seed);
        return battlefield;
    }

    /**
     * Main units take their catalog range. Companions take the range declared by their owner's skill,
     * or the owner's catalog range if the skill declares none.
     */
    static IRangeProvider rangeProvider(IUnitCatalog catalog, SkillRegistry registry) {
        return unit -> {
            if (unit.isCompanion()) {
                int declared = registry.companionRange(unit);
                if (declared > 0) {
                    return declared;
                }
            }
            return catalog.rangeOf(unit.mainId(), Config.DEFAULT_UNIT_RANGE);
        };
    }

    /**
     * Clears the board and applies another configured arena.
     *
     * @throws IllegalArgumentException if no arena has that key
     */
    public boolean selectArena(String arenaKey) {
        ArenaMap arena = arenas.get(arenaKey);
        if (arena == null) {
            throw new IllegalArgumentException("Unknown arena '" + arenaKey + "', known: " + arenas.keySet());
        }
        return transactions.resetToArena(arena);
    }

    public Map<String, ArenaMap> arenas() {
        return arenas;
    }

    public IUnitCatalog catalog() {
        return catalog;
    }

    public SpatialGrid grid() {
        return grid;
    }

    public PathfindingEngine pathfinding() {
        return pathfinding;
    }

    public TargetResolver targets() {
        return targets;
    }

    public SkillEngine skills() {
        return skills;
    }

    public TransactionCoordinator transactions() {
        return transactions;
    }

    /**
     * @return the display name of a unit, falling back to its id
     */
    public String nameOf(UnitId unit) {
        String base = catalog.find(unit.mainId()).map(a -> a.name()).orElse("Unit " + unit.mainId());
        return unit.isCompanion() ? base + " #" + unit.sequence() : base;
    }
}
