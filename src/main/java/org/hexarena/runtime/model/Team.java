package org.hexarena.runtime.model;

/**
 * The two sides of the board. ALLY deploys from the low-id edge, ENEMY from the high-id edge.
 */
public enum Team {
    ALLY,
    ENEMY;

    public Team opposing() {
        return this == ALLY ? ENEMY : ALLY;
    }

    public TileState availableState() {
        return this == ALLY ? TileState.AVAILABLE_ALLY : TileState.AVAILABLE_ENEMY;
    }

    public TileState occupiedState() {
        return this == ALLY ? TileState.OCCUPIED_ALLY : TileState.OCCUPIED_ENEMY;
    }
}
