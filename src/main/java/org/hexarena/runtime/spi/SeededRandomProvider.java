package org.hexarena.runtime.spi;

import java.util.Random;

/**
 * {@link IRandomProvider} backed by a seeded {@link Random}.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final Random random;

    public SeededRandomProvider(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
