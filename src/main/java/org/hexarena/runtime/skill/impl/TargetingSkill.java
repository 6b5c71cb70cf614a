package org.hexarena.runtime.skill.impl;

import java.util.ArrayList;
import java.util.List;

import org.hexarena.runtime.model.Team;
import org.hexarena.runtime.model.Tile;
import org.hexarena.runtime.skill.ISkill;
import org.hexarena.runtime.skill.SkillContext;
import org.hexarena.runtime.skill.SkillDescriptor;
import org.hexarena.runtime.skill.TargetRule;
import org.hexarena.runtime.targeting.TargetInfo;
import org.hexarena.runtime.targeting.TargetResolver;
import org.hexarena.runtime.targeting.TargetingMethod;

/**
 * Skill that keeps one or more targets up to date.
 * <p>
 * Each {@link TargetRule} contributes its targets in order, so a descriptor with one rule of
 * {@code count = 2} fills slots 0 and 1, and a descriptor with two single-target rules fills slot 0
 * from the first rule and slot 1 from the second. Slots only shift when an earlier rule finds
 * fewer targets than requested.
 * <p>
 * The first rule anchors the skill: if it finds nothing, later rules are not evaluated and the
 * skill has no targets. A descriptor with a tile color marks the tiles of the current targets.
 */
public class TargetingSkill implements ISkill {

    private final SkillDescriptor descriptor;

    public TargetingSkill(SkillDescriptor descriptor) {
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
        context.engine().clearTargets(context.unit(), context.team());
    }

    private void refresh(SkillContext context) {
        TargetResolver resolver = context.resolver();
        List<TargetInfo> found = new ArrayList<>();
        List<TargetRule> rules = descriptor.targets();
        for (int i = 0; i < rules.size(); i++) {
            if (i > 0 && found.isEmpty()) {
                break;
            }
            TargetRule rule = rules.get(i);
            Team targetTeam = rule.targetTeam(context.team());
            List<Tile> pool = resolver.candidates(targetTeam, rule.excludeSelf() ? context.unit() : null, rule.includeCompanions());
            if (rule.method() == TargetingMethod.REARMOST) {
                for (TargetInfo target : resolver.rearmost(targetTeam, pool, rule.count())) {
                    found.add(target.with(TargetInfo.SOURCE_TILE, context.tileId()));
                }
                continue;
            }
            TargetInfo target = resolver.resolve(rule.method(), context.tileId(), context.team(), targetTeam, pool,
                resolver.rangeOf(context.unit()), rule.direction(), rule.maxDistance());
            if (target != null) {
                found.add(target.metadata().containsKey(TargetInfo.SOURCE_TILE)
                    ? target
                    : target.with(TargetInfo.SOURCE_TILE, context.tileId()));
            }
        }
        context.engine().setTargets(context.unit(), context.team(), found);

        if (descriptor.tileColor() != null) {
            context.visuals().unregisterTileColors(context.owner());
            for (TargetInfo target : found) {
                context.visuals().setTileColor(context.owner(), target.targetTileId(), descriptor.tileColor());
            }
        }
    }
}
