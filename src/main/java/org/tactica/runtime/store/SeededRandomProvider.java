package org.tactica.runtime.store;

import java.util.Random;

import org.tactica.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by {@link java.util.Random} with an explicit seed.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    /**
     * @param seed The seed. Equal seeds yield equal sequences.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * Creates a provider seeded from the clock.
     *
     * @return A non-reproducible provider.
     */
    public static SeededRandomProvider unseeded() {
        return new SeededRandomProvider(System.nanoTime());
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long derived = seed * 0x9E3779B97F4A7C15L + context.hashCode() * 31L + salt;
        return new SeededRandomProvider(derived);
    }

    public long getSeed() {
        return seed;
    }
}
