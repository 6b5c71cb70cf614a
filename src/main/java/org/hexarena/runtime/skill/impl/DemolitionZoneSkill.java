package org.hexarena.runtime.skill.impl;

import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.Tile;
import org.hexarena.runtime.model.TileState;
import org.hexarena.runtime.skill.DemolitionZone;
import org.hexarena.runtime.skill.ISkill;
import org.hexarena.runtime.skill.SkillActivationException;
import org.hexarena.runtime.skill.SkillContext;
import org.hexarena.runtime.skill.SkillDescriptor;
import org.hexarena.runtime.skill.SkillState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Paints the caster team's zone as Blocked (and Blocked-Breakable) while active and restores the
 * previous tile states on deactivation.
 * <p>
 * The zone must be empty when the skill activates; {@link #claimedTiles} tells the caller which
 * tiles to clear. A caster standing inside its own zone fails to activate.
 */
public class DemolitionZoneSkill implements ISkill {

    private static final Logger LOG = LoggerFactory.getLogger(DemolitionZoneSkill.class);

    private final SkillDescriptor descriptor;

    public DemolitionZoneSkill(SkillDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public SkillDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public IntList claimedTiles(Team team) {
        DemolitionZone zone = descriptor.zones().get(team);
        return zone == null ? IntLists.emptyList() : zone.tiles();
    }

    @Override
    public void onActivate(SkillContext context) throws SkillActivationException {
        DemolitionZone zone = descriptor.zones().get(context.team());
        if (zone == null) {
            throw new SkillActivationException("No demolition zone configured for " + context.team());
        }
        if (zone.contains(context.tileId())) {
            throw new SkillActivationException(context.unit() + " stands inside its own demolition zone");
        }
        SpatialGrid grid = context.grid();
        for (int i = 0; i < zone.blocked().size(); i++) {
            paint(grid, context.state(), zone.blocked().getInt(i), TileState.BLOCKED);
        }
        for (int i = 0; i < zone.breakable().size(); i++) {
            paint(grid, context.state(), zone.breakable().getInt(i), TileState.BLOCKED_BREAKABLE);
        }
    }

    private static void paint(SpatialGrid grid, SkillState state, int tileId, TileState target) throws SkillActivationException {
        Tile tile = grid.getTileById(tileId);
        if (tile.isOccupied()) {
            throw new SkillActivationException("Zone tile " + tileId + " is still occupied by " + tile.getOccupant());
        }
        state.rememberTileState(tileId, tile.getState());
        grid.setOccupancyState(tile.getCoordinate(), target);
    }

    @Override
    public void onUpdate(SkillContext context) {
        // the zone is painted once, on activation
    }

    @Override
    public void onDeactivate(SkillContext context) {
        SpatialGrid grid = context.grid();
        Int2ObjectMap<TileState> painted = context.state().getPaintedTiles();
        for (Int2ObjectMap.Entry<TileState> entry : painted.int2ObjectEntrySet()) {
            Tile tile = grid.getTileById(entry.getIntKey());
            if (!grid.setOccupancyState(tile.getCoordinate(), entry.getValue())) {
                LOG.warn("Failed to restore tile {} to {} for {}", tile.getId(), entry.getValue(), context.owner());
            }
        }
        painted.clear();
    }
}
