package org.hexarena.runtime.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;

import org.hexarena.runtime.Config;
import org.hexarena.runtime.spi.IUnitCatalog;
import org.hexarena.runtime.spi.UnitAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigObject;

import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;

/**
 * Unit catalog read from the {@code hexarena.units} configuration block.
 * <p>
 * Each entry is keyed by the unit id:
 * <pre>
 * units {
 *   46 { name = "Vala", range = 1, faction = "...", class = "..." }
 * }
 * </pre>
 * {@code range} defaults to 1; {@code faction} and {@code class} default to empty strings.
 */
public class ConfigUnitCatalog implements IUnitCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigUnitCatalog.class);

    private final Int2ObjectAVLTreeMap<UnitAttributes> units = new Int2ObjectAVLTreeMap<>();

    public ConfigUnitCatalog(com.typesafe.config.Config unitsConfig) {
        ConfigObject root = unitsConfig.root();
        for (String key : root.keySet()) {
            int id;
            try {
                id = Integer.parseInt(key);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Unit keys must be numeric ids, got '" + key + "'", e);
            }
            com.typesafe.config.Config entry = unitsConfig.getConfig("\"" + key + "\"");
            units.put(id, new UnitAttributes(
                id,
                entry.hasPath("name") ? entry.getString("name") : "Unit " + id,
                entry.hasPath("range") ? entry.getInt("range") : Config.DEFAULT_UNIT_RANGE,
                entry.hasPath("faction") ? entry.getString("faction") : "",
                entry.hasPath("class") ? entry.getString("class") : ""));
        }
        LOG.debug("Loaded {} units into catalog", units.size());
    }

    @Override
    public Optional<UnitAttributes> find(int unitId) {
        return Optional.ofNullable(units.get(unitId));
    }

    @Override
    public Collection<UnitAttributes> all() {
        return Collections.unmodifiableCollection(units.values());
    }
}
