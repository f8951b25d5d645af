package com.probgraph.util;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide random source shared by every element's generateRandomness.
 * Draws are reproducible under a fixed seed as long as they happen in a single
 * thread.
 */
public class RandomSource {

    private static final Logger logger = LoggerFactory.getLogger(RandomSource.class);

    private static final RandomGenerator generator = new MersenneTwister();

    private RandomSource() {
    }

    public static synchronized void setSeed(long seed) {
        logger.debug("Random source seeded with {}", seed);
        generator.setSeed(seed);
    }

    public static synchronized double nextDouble() {
        return generator.nextDouble();
    }

    public static synchronized int nextInt(int bound) {
        return generator.nextInt(bound);
    }

    /**
     * The underlying generator, for commons-math distributions that sample on
     * their own. Callers must not re-seed it directly.
     */
    public static RandomGenerator generator() {
        return generator;
    }
}
