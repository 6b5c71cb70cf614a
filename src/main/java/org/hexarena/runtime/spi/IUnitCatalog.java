package org.hexarena.runtime.spi;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only table of static unit attributes, supplied by the host application.
 */
public interface IUnitCatalog {

    Optional<UnitAttributes> find(int unitId);

    Collection<UnitAttributes> all();

    /**
     * @return the unit's base range, or {@code defaultRange} if the unit is not in the catalog
     */
    default int rangeOf(int unitId, int defaultRange) {
        return find(unitId).map(UnitAttributes::range).orElse(defaultRange);
    }
}
