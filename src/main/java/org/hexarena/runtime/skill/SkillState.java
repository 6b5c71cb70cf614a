package org.hexarena.runtime.skill;

import java.util.Map;

import org.hexarena.runtime.model.TeamUnit;
import org.hexarena.runtime.model.TileState;
import org.hexarena.runtime.model.UnitId;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;

/**
 * Bookkeeping for one active skill. Exists only while the skill is active.
 */
public final class SkillState {

    private final TeamUnit owner;
    private final ISkill skill;
    private int tileId;
    private int capacityDelta;
    private final Int2ObjectLinkedOpenHashMap<TileState> paintedTiles = new Int2ObjectLinkedOpenHashMap<>();
    private Map<UnitId, Integer> rememberedCompanionTiles = Map.of();

    SkillState(TeamUnit owner, ISkill skill, int tileId) {
        this.owner = owner;
        this.skill = skill;
        this.tileId = tileId;
    }

    public TeamUnit getOwner() {
        return owner;
    }

    public ISkill getSkill() {
        return skill;
    }

    /**
     * @return the tile the unit stood on at the last activation or update
     */
    public int getTileId() {
        return tileId;
    }

    void setTileId(int tileId) {
        this.tileId = tileId;
    }

    /**
     * @return team capacity this skill has added and must give back on deactivation
     */
    public int getCapacityDelta() {
        return capacityDelta;
    }

    public void addCapacityDelta(int delta) {
        this.capacityDelta += delta;
    }

    /**
     * Records the state a tile had before this skill painted it. Only the first state recorded per
     * tile is kept.
     */
    public void rememberTileState(int tileId, TileState previous) {
        paintedTiles.putIfAbsent(tileId, previous);
    }

    /**
     * @return tiles this skill painted, mapped to the states to restore, in painting order
     */
    public Int2ObjectMap<TileState> getPaintedTiles() {
        return paintedTiles;
    }

    /**
     * Tiles companions held before a rolled-back deactivation. Empty for a fresh activation.
     */
    public Map<UnitId, Integer> getRememberedCompanionTiles() {
        return rememberedCompanionTiles;
    }

    void setRememberedCompanionTiles(Map<UnitId, Integer> companionTiles) {
        this.rememberedCompanionTiles = Map.copyOf(companionTiles);
    }

    @Override
    public String toString() {
        return "SkillState[" + owner + " on tile " + tileId + ", " + skill.getDescriptor().kind() + "]";
    }
}
