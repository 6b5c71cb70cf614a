package org.hexarena.runtime.model;

/**
 * Occupancy state of a tile. The integer codes are stable and used by map data.
 */
public enum TileState {
    DEFAULT(0),
    AVAILABLE_ALLY(1),
    AVAILABLE_ENEMY(2),
    OCCUPIED_ALLY(3),
    OCCUPIED_ENEMY(4),
    BLOCKED(5),
    BLOCKED_BREAKABLE(6);

    private static final TileState[] BY_CODE = new TileState[values().length];

    static {
        for (TileState state : values()) {
            BY_CODE[state.code] = state;
        }
    }

    private final int code;

    TileState(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * @return the state for the given code, or {@code null} if the code is out of range
     */
    public static TileState fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return null;
        }
        return BY_CODE[code];
    }

    public boolean isOccupied() {
        return this == OCCUPIED_ALLY || this == OCCUPIED_ENEMY;
    }

    public boolean isAvailable() {
        return this == AVAILABLE_ALLY || this == AVAILABLE_ENEMY;
    }

    public boolean isBlocked() {
        return this == BLOCKED || this == BLOCKED_BREAKABLE;
    }

    /**
     * @return the team an Available or Occupied state belongs to, or {@code null} for neutral states
     */
    public Team team() {
        return switch (this) {
            case AVAILABLE_ALLY, OCCUPIED_ALLY -> Team.ALLY;
            case AVAILABLE_ENEMY, OCCUPIED_ENEMY -> Team.ENEMY;
            default -> null;
        };
    }
}
