package org.hexarena.runtime.skill;

import org.hexarena.runtime.skill.impl.CompanionSkill;
import org.hexarena.runtime.skill.impl.DemolitionZoneSkill;
import org.hexarena.runtime.skill.impl.MirrorLinkSkill;
import org.hexarena.runtime.skill.impl.TargetingSkill;

/**
 * The closed set of skill behaviors. Each descriptor names one kind; the kind builds the behavior.
 */
public enum SkillKind {

    /** Re-derives one or more targets from {@link TargetRule}s after every board change. */
    TARGETING {
        @Override
        ISkill create(SkillDescriptor descriptor) {
            return new TargetingSkill(descriptor);
        }
    },

    /** Spawns linked companion units and raises team capacity while active. */
    COMPANION {
        @Override
        ISkill create(SkillDescriptor descriptor) {
            return new CompanionSkill(descriptor);
        }
    },

    /** Marks an adjacent own unit and the opposing unit on that unit's mirror tile. */
    MIRROR_LINK {
        @Override
        ISkill create(SkillDescriptor descriptor) {
            return new MirrorLinkSkill(descriptor);
        }
    },

    /** Blocks a fixed set of tiles on the caster's side while active. */
    DEMOLITION_ZONE {
        @Override
        ISkill create(SkillDescriptor descriptor) {
            return new DemolitionZoneSkill(descriptor);
        }
    };

    abstract ISkill create(SkillDescriptor descriptor);

    public static SkillKind fromConfigValue(String value) {
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
