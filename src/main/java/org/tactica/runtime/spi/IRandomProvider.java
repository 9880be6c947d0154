package org.tactica.runtime.spi;

import java.util.Random;

/**
 * Source of randomness for the combat core.
 * <p>
 * Combats that must be reproducible (tests, traces) use a seeded implementation.
 */
public interface IRandomProvider {

    /**
     * @param bound Exclusive upper bound, positive.
     * @return A uniformly distributed int in {@code [0, bound)}.
     */
    int nextInt(int bound);

    /**
     * @return A uniformly distributed double in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * @return A {@link Random} view backed by this provider.
     */
    Random asJavaRandom();

    /**
     * Creates an independent provider for a sub-system, deterministically derived from this one.
     *
     * @param context Name of the consumer.
     * @param salt Extra salt.
     * @return The derived provider.
     */
    IRandomProvider deriveFor(String context, long salt);
}
