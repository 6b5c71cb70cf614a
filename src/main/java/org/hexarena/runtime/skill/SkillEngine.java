package org.hexarena.runtime.skill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.TeamUnit;
import org.hexarena.runtime.model.UnitId;
import org.hexarena.runtime.spi.IRandomProvider;
import org.hexarena.runtime.targeting.TargetInfo;
import org.hexarena.runtime.targeting.TargetResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Per-unit skill state machine: Inactive, then Active after {@link #activate}, then Inactive again
 * after {@link #deactivate}.
 * <p>
 * The engine exclusively owns skill state, stored targets and the {@link VisualModifierRegistry}.
 * Grid entities are referenced by id only. Skill lookups go through the injected
 * {@link SkillRegistry}.
 * <p>
 * Activation is all-or-nothing: if a skill throws {@link SkillActivationException}, its
 * {@link ISkill#onDeactivate} runs to undo partial effects, all state for the unit is discarded and
 * {@code false} is returned so the enclosing transaction rolls back.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe.
 */
public class SkillEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SkillEngine.class);

    private final SkillRegistry registry;
    private final TargetResolver resolver;
    private final IRandomProvider random;
    private final SpatialGrid grid;
    private final Map<TeamUnit, SkillState> active = new LinkedHashMap<>();
    private final TreeMap<TargetSlotKey, TargetInfo> targets = new TreeMap<>();
    private final VisualModifierRegistry visuals = new VisualModifierRegistry();

    /**
     * @param registry skills by unit
     * @param resolver target selection; its grid is the grid this engine manages
     * @param random   randomness handed to skills
     */
    public SkillEngine(SkillRegistry registry, TargetResolver resolver, IRandomProvider random) {
        this.registry = registry;
        this.resolver = resolver;
        this.random = random;
        this.grid = resolver.getGrid();
    }

    public SkillRegistry getRegistry() {
        return registry;
    }

    public VisualModifierRegistry getVisualModifiers() {
        return visuals;
    }

    // ==================== Lifecycle ====================

    /**
     * Activates the unit's skill. Units without a skill activate trivially. An already active skill
     * for the same unit and team is deactivated first.
     *
     * @return {@code false} if the skill could not be activated; no skill state remains in that case
     */
    public boolean activate(int tileId, Team team, UnitId unit) {
        return activate(tileId, team, unit, Map.of());
    }

    /**
     * Activates the unit's skill again after a deactivation was rolled back. Companions are put back
     * on the tiles they held instead of on randomly drawn ones, so the random provider is not
     * consulted and a rolled-back transaction leaves the random stream where it was.
     *
     * @param companionTiles tile of each companion before the deactivation
     * @return {@code false} if the skill could not be activated
     */
    public boolean reactivate(int tileId, Team team, UnitId unit, Map<UnitId, Integer> companionTiles) {
        return activate(tileId, team, unit, companionTiles);
    }

    private boolean activate(int tileId, Team team, UnitId unit, Map<UnitId, Integer> companionTiles) {
        ISkill skill = registry.find(unit);
        if (skill == null) {
            return true;
        }
        TeamUnit owner = new TeamUnit(unit, team);
        if (active.containsKey(owner)) {
            deactivate(unit, team);
        }

        SkillState state = new SkillState(owner, skill, tileId);
        state.setRememberedCompanionTiles(companionTiles);
        active.put(owner, state);
        SkillContext context = contextFor(state);
        try {
            skill.onActivate(context);
        } catch (SkillActivationException e) {
            LOG.debug("Skill of {} failed to activate on tile {}: {}", owner, tileId, e.getMessage());
            active.remove(owner);
            skill.onDeactivate(context);
            clearTargets(unit, team);
            visuals.unregisterAll(owner);
            return false;
        }
        state.setRememberedCompanionTiles(Map.of());

        SkillDescriptor descriptor = skill.getDescriptor();
        if (descriptor.selfColor() != null) {
            visuals.setUnitColor(owner, owner, descriptor.selfColor());
        }
        if (descriptor.targetingColor() != null) {
            visuals.setTargetingColor(owner, descriptor.targetingColor());
        }
        LOG.debug("Activated {} skill '{}' for {}", descriptor.kind(), descriptor.name(), owner);
        return true;
    }

    /**
     * Deactivates the unit's skill: unregisters its visual hints, clears its targets and lets the
     * skill remove what it owns (companions, extra capacity). No-op if the skill is not active.
     */
    public void deactivate(UnitId unit, Team team) {
        TeamUnit owner = new TeamUnit(unit, team);
        SkillState state = active.remove(owner);
        if (state == null) {
            return;
        }
        state.getSkill().onDeactivate(contextFor(state));
        clearTargets(unit, team);
        visuals.unregisterAll(owner);
        LOG.debug("Deactivated skill of {}", owner);
    }

    /**
     * Deactivates every active skill, in activation order.
     */
    public void deactivateAll() {
        for (TeamUnit owner : new ArrayList<>(active.keySet())) {
            deactivate(owner.unit(), owner.team());
        }
    }

    /**
     * Tiles the unit's skill takes over for the team while active.
     *
     * @return an empty list for units without a skill
     */
    public IntList claimedTiles(UnitId unit, Team team) {
        ISkill skill = registry.find(unit);
        return skill == null ? IntLists.emptyList() : skill.claimedTiles(team);
    }

    /**
     * Re-locates every active skill's unit and recomputes its targets. Skills whose unit has left the
     * board are deactivated, so they still remove their companions and give back capacity.
     */
    public void update() {
        for (SkillState state : new ArrayList<>(active.values())) {
            TeamUnit owner = state.getOwner();
            if (!active.containsKey(owner)) {
                continue;
            }
            int tileId = grid.findUnitTile(owner.unit(), owner.team());
            if (tileId < 0) {
                LOG.debug("Deactivating skill of {}: unit is no longer on the board", owner);
                deactivate(owner.unit(), owner.team());
                continue;
            }
            state.setTileId(tileId);
            state.getSkill().onUpdate(contextFor(state));
        }
    }

    private SkillContext contextFor(SkillState state) {
        TeamUnit owner = state.getOwner();
        return new SkillContext(grid, state.getTileId(), owner.team(), owner.unit(), state, this, resolver, random);
    }

    // ==================== Queries ====================

    public boolean isActive(UnitId unit, Team team) {
        return active.containsKey(new TeamUnit(unit, team));
    }

    /**
     * @return the state of an active skill, or {@code null}
     */
    public SkillState getState(UnitId unit, Team team) {
        return active.get(new TeamUnit(unit, team));
    }

    public List<SkillState> getActiveStates() {
        return List.copyOf(active.values());
    }

    // ==================== Targets ====================

    /**
     * Replaces the unit's stored targets with {@code newTargets}, numbered by slot in list order.
     */
    public void setTargets(UnitId unit, Team team, List<TargetInfo> newTargets) {
        clearTargets(unit, team);
        for (int slot = 0; slot < newTargets.size(); slot++) {
            targets.put(new TargetSlotKey(unit, team, slot), newTargets.get(slot));
        }
    }

    public void clearTargets(UnitId unit, Team team) {
        targets.subMap(new TargetSlotKey(unit, team, 0), true, new TargetSlotKey(unit, team, Integer.MAX_VALUE), true).clear();
    }

    /**
     * @return the unit's slot-0 target, or {@code null}
     */
    public TargetInfo getTarget(UnitId unit, Team team) {
        return targets.get(new TargetSlotKey(unit, team, 0));
    }

    /**
     * @return the unit's targets in slot order
     */
    public List<TargetInfo> getTargets(UnitId unit, Team team) {
        return List.copyOf(targets.subMap(new TargetSlotKey(unit, team, 0), true,
            new TargetSlotKey(unit, team, Integer.MAX_VALUE), true).values());
    }

    /**
     * @return all stored targets ordered by unit, team and slot
     */
    public Map<TargetSlotKey, TargetInfo> getAllTargets() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }
}
