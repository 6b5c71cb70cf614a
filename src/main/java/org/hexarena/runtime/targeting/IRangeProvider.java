package org.hexarena.runtime.targeting;

import org.hexarena.runtime.model.UnitId;

/**
 * Supplies the attack range of a unit. Ranges are at least 1.
 */
@FunctionalInterface
public interface IRangeProvider {

    int rangeOf(UnitId unit);
}
