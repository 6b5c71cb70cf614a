package org.hexarena.runtime.skill;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.hexarena.runtime.model.TeamUnit;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;

/**
 * Color hints registered by active skills for a rendering collaborator: unit colors, tile colors
 * and the color of each skill's source-to-target indicator.
 * <p>
 * Every hint remembers the skill owner that registered it, so deactivating a skill removes exactly
 * its own hints. Several owners may color the same tile; the most recent registration is shown
 * and the earlier ones resurface when it is removed.
 */
public class VisualModifierRegistry {

    private record Hint(TeamUnit owner, String color) {}

    private final Map<TeamUnit, Hint> unitColors = new LinkedHashMap<>();
    private final Int2ObjectLinkedOpenHashMap<LinkedHashMap<TeamUnit, String>> tileColors = new Int2ObjectLinkedOpenHashMap<>();
    private final Map<TeamUnit, String> targetingColors = new LinkedHashMap<>();

    public void setUnitColor(TeamUnit owner, TeamUnit unit, String color) {
        unitColors.put(unit, new Hint(owner, Objects.requireNonNull(color)));
    }

    public void removeUnitColor(TeamUnit unit) {
        unitColors.remove(unit);
    }

    /**
     * Colors a tile on behalf of an owner. Re-registering for the same owner and tile moves the hint
     * to the top.
     */
    public void setTileColor(TeamUnit owner, int tileId, String color) {
        Objects.requireNonNull(color);
        LinkedHashMap<TeamUnit, String> owners = tileColors.get(tileId);
        if (owners == null) {
            owners = new LinkedHashMap<>();
            tileColors.put(tileId, owners);
        }
        owners.remove(owner);
        owners.put(owner, color);
    }

    public void setTargetingColor(TeamUnit owner, String color) {
        targetingColors.put(owner, Objects.requireNonNull(color));
    }

    /**
     * Removes every hint registered by the owner.
     */
    public void unregisterAll(TeamUnit owner) {
        unitColors.values().removeIf(hint -> hint.owner().equals(owner));
        unregisterTileColors(owner);
        targetingColors.remove(owner);
    }

    /**
     * Removes the tile hints registered by the owner, keeping its unit and indicator colors.
     */
    public void unregisterTileColors(TeamUnit owner) {
        tileColors.values().removeIf(owners -> {
            owners.remove(owner);
            return owners.isEmpty();
        });
    }

    /**
     * @return the color for the unit, or {@code null}
     */
    public String getUnitColor(TeamUnit unit) {
        Hint hint = unitColors.get(unit);
        return hint == null ? null : hint.color();
    }

    /**
     * @return the most recently registered color for the tile, or {@code null}
     */
    public String getTileColor(int tileId) {
        LinkedHashMap<TeamUnit, String> owners = tileColors.get(tileId);
        if (owners == null || owners.isEmpty()) {
            return null;
        }
        String latest = null;
        for (String color : owners.values()) {
            latest = color;
        }
        return latest;
    }

    /**
     * @return the indicator color of the owner's skill, or {@code null}
     */
    public String getTargetingColor(TeamUnit owner) {
        return targetingColors.get(owner);
    }

    public Map<TeamUnit, String> getUnitColors() {
        Map<TeamUnit, String> result = new LinkedHashMap<>();
        unitColors.forEach((unit, hint) -> result.put(unit, hint.color()));
        return Collections.unmodifiableMap(result);
    }

    public Map<Integer, String> getTileColors() {
        Map<Integer, String> result = new LinkedHashMap<>();
        for (Int2ObjectMap.Entry<LinkedHashMap<TeamUnit, String>> entry : tileColors.int2ObjectEntrySet()) {
            result.put(entry.getIntKey(), getTileColor(entry.getIntKey()));
        }
        return Collections.unmodifiableMap(result);
    }

    public boolean isEmpty() {
        return unitColors.isEmpty() && tileColors.isEmpty() && targetingColors.isEmpty();
    }

    public void clear() {
        unitColors.clear();
        tileColors.clear();
        targetingColors.clear();
    }
}
