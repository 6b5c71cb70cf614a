package org.hexarena.runtime.spi;

/**
 * Source of randomness for the few engine decisions that are not fully determined by the board
 * (companion tile choice, auto-placement). Implementations must be reproducible from their seed.
 */
public interface IRandomProvider {

    /**
     * @return a uniformly distributed value in {@code [0, bound)}
     */
    int nextInt(int bound);
}
