package org.hexarena.runtime.spi;

/**
 * Static catalog entry for a unit. Faction and class are opaque to the engine.
 *
 * @param id      catalog id
 * @param name    display name
 * @param range   base attack range, at least 1
 * @param faction faction label, may be empty
 * @param unitClass class label, may be empty
 */
public record UnitAttributes(int id, String name, int range, String faction, String unitClass) {

    public UnitAttributes {
        if (range < 1) {
            throw new IllegalArgumentException("Unit " + id + " must have range >= 1, got " + range);
        }
    }
}
