package org.hexarena.runtime.skill.impl;

import java.util.List;

import org.hexarena.runtime.model.BoardLayout;
import org.hexarena.runtime.model.HexCoordinate;
import org.hexarena.runtime.model.SpatialGrid;
import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.Tile;
import org.hexarena.runtime.skill.ISkill;
import org.hexarena.runtime.skill.SkillContext;
import org.hexarena.runtime.skill.SkillDescriptor;
import org.hexarena.runtime.targeting.TargetInfo;

/**
 * Links an adjacent own unit with the opposing unit standing on that unit's mirror tile.
 * <p>
 * When several own units are adjacent, the neighbor direction decides. Directions are indexed as in
 * {@link HexCoordinate#neighbor(int)}; ALLY casters prefer the directions facing the enemy side
 * first, ENEMY casters use the 180-degree rotation of that order.
 * <p>
 * On a match the skill stores two targets, the own unit in slot 0 and the opposing unit in slot 1,
 * and marks both tiles with the descriptor's tile color. Without a match both are cleared.
 */
public class MirrorLinkSkill implements ISkill {

    private static final int[] ALLY_DIRECTION_PRIORITY = {3, 4, 2, 1, 5, 0};
    private static final int[] ENEMY_DIRECTION_PRIORITY = {0, 5, 1, 2, 4, 3};

    private final SkillDescriptor descriptor;

    public MirrorLinkSkill(SkillDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public SkillDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public void onActivate(SkillContext context) {
        refresh(context);
    }

    @Override
    public void onUpdate(SkillContext context) {
        refresh(context);
    }

    @Override
    public void onDeactivate(SkillContext context) {
        context.visuals().unregisterTileColors(context.owner());
        context.engine().clearTargets(context.unit(), context.team());
    }

    private void refresh(SkillContext context) {
        context.visuals().unregisterTileColors(context.owner());

        Tile partner = adjacentPartner(context);
        Tile opponent = partner == null ? null : mirroredOpponent(context, partner);
        if (opponent == null) {
            context.engine().clearTargets(context.unit(), context.team());
            return;
        }

        context.engine().setTargets(context.unit(), context.team(), List.of(
            new TargetInfo(partner.getId(), partner.getOccupant())
                .with(TargetInfo.SOURCE_TILE, context.tileId())
                .with(TargetInfo.MIRROR_TILE, opponent.getId()),
            new TargetInfo(opponent.getId(), opponent.getOccupant())
                .with(TargetInfo.SOURCE_TILE, context.tileId())
                .with(TargetInfo.MIRROR_TILE, partner.getId())));

        if (descriptor.tileColor() != null) {
            context.visuals().setTileColor(context.owner(), partner.getId(), descriptor.tileColor());
            context.visuals().setTileColor(context.owner(), opponent.getId(), descriptor.tileColor());
        }
    }

    /**
     * @return the occupied own-team neighbor in the best direction, or {@code null}
     */
    private static Tile adjacentPartner(SkillContext context) {
        SpatialGrid grid = context.grid();
        BoardLayout layout = grid.getLayout();
        HexCoordinate center = layout.coordinateOf(context.tileId());
        int[] priority = context.team() == Team.ALLY ? ALLY_DIRECTION_PRIORITY : ENEMY_DIRECTION_PRIORITY;
        for (int direction : priority) {
            int neighborId = layout.idOf(center.neighbor(direction));
            if (neighborId < 0) {
                continue;
            }
            Tile neighbor = grid.getTileById(neighborId);
            if (neighbor.isOccupied() && neighbor.getOccupantTeam() == context.team()) {
                return neighbor;
            }
        }
        return null;
    }

    private static Tile mirroredOpponent(SkillContext context, Tile partner) {
        SpatialGrid grid = context.grid();
        int mirrorId = grid.getLayout().mirrorOf(partner.getId());
        if (mirrorId < 0) {
            return null;
        }
        Tile mirror = grid.getTileById(mirrorId);
        return mirror.isOccupied() && mirror.getOccupantTeam() == context.team().opposing() ? mirror : null;
    }
}
