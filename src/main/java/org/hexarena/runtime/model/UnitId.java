package org.hexarena.runtime.model;

import org.hexarena.runtime.Config;

/**
 * Identifier of a unit on the board.
 * <p>
 * A main unit is {@code UnitId(mainId, 0)}. A companion spawned by a main unit's skill is
 * {@code UnitId(mainId, sequence)} with {@code sequence >= 1}, so the relationship to its owner
 * is carried explicitly instead of being inferred from an id range.
 * <p>
 * {@link #encoded()} produces the legacy integer form ({@code sequence * 10000 + mainId}) used by
 * collaborators that exchange plain numeric ids.
 *
 * @param mainId   catalog id of the main unit, positive and below {@link Config#COMPANION_ID_OFFSET}
 * @param sequence 0 for the main unit, 1..n for companions
 */
public record UnitId(int mainId, int sequence) implements Comparable<UnitId> {

    public UnitId {
        if (mainId <= 0 || mainId >= Config.COMPANION_ID_OFFSET) {
            throw new IllegalArgumentException("Unit id must be in 1.." + (Config.COMPANION_ID_OFFSET - 1) + ", got " + mainId);
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("Companion sequence must not be negative, got " + sequence);
        }
    }

    public static UnitId main(int mainId) {
        return new UnitId(mainId, 0);
    }

    public static UnitId companion(int mainId, int sequence) {
        if (sequence < 1) {
            throw new IllegalArgumentException("Companion sequence starts at 1, got " + sequence);
        }
        return new UnitId(mainId, sequence);
    }

    /**
     * Decodes the legacy integer form.
     */
    public static UnitId fromEncoded(int encoded) {
        return new UnitId(encoded % Config.COMPANION_ID_OFFSET, encoded / Config.COMPANION_ID_OFFSET);
    }

    public boolean isCompanion() {
        return sequence > 0;
    }

    /**
     * @return the id of the main unit that owns this one (itself for main units)
     */
    public UnitId owner() {
        return sequence == 0 ? this : main(mainId);
    }

    public int encoded() {
        return sequence * Config.COMPANION_ID_OFFSET + mainId;
    }

    @Override
    public int compareTo(UnitId other) {
        int cmp = Integer.compare(mainId, other.mainId);
        return cmp != 0 ? cmp : Integer.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return sequence == 0 ? "Unit" + mainId : "Unit" + mainId + "#" + sequence;
    }
}
