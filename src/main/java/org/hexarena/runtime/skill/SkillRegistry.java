package org.hexarena.runtime.skill;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.hexarena.runtime.model.UnitId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;

/**
 * Maps main-unit ids to their skill. Built once at startup and injected into the
 * {@link SkillEngine}; there is no static registry.
 */
public class SkillRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SkillRegistry.class);

    private final Int2ObjectAVLTreeMap<ISkill> skills = new Int2ObjectAVLTreeMap<>();

    /**
     * Builds a registry from the {@code hexarena.skills} descriptor list.
     *
     * @throws IllegalArgumentException if a descriptor is invalid or two descriptors name the same unit
     */
    public static SkillRegistry fromConfig(List<? extends com.typesafe.config.Config> descriptors) {
        SkillRegistry registry = new SkillRegistry();
        for (com.typesafe.config.Config entry : descriptors) {
            SkillDescriptor descriptor = SkillDescriptor.fromConfig(entry);
            registry.register(descriptor.kind().create(descriptor));
        }
        LOG.debug("Registered {} skills", registry.size());
        return registry;
    }

    /**
     * @throws IllegalArgumentException if the unit already has a skill
     */
    public void register(ISkill skill) {
        int unitId = skill.getDescriptor().unitId();
        if (skills.containsKey(unitId)) {
            throw new IllegalArgumentException("Unit " + unitId + " already has a skill registered");
        }
        skills.put(unitId, skill);
    }

    /**
     * @return the skill of a main unit, or {@code null}; companions never carry skills
     */
    public ISkill find(UnitId unit) {
        return unit.isCompanion() ? null : skills.get(unit.mainId());
    }

    public boolean hasSkill(UnitId unit) {
        return find(unit) != null;
    }

    /**
     * @return the range declared for the companions of the unit's owner, or 0 if the owner's skill
     *         declares none and companions fight at the owner's range
     */
    public int companionRange(UnitId companion) {
        ISkill skill = skills.get(companion.mainId());
        return skill == null ? 0 : skill.getDescriptor().companionRange();
    }

    public Collection<ISkill> all() {
        return Collections.unmodifiableCollection(skills.values());
    }

    public int size() {
        return skills.size();
    }
}
