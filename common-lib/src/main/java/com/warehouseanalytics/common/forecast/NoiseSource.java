package com.warehouseanalytics.common.forecast;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniform samples in {@code [0, 1)} used to jitter forecast points.
 *
 * <p>Production wiring uses {@link #random()}; tests and reproducible runs use
 * {@link #seeded(long)}. A seeded source is stateful, so callers that need
 * identical output across invocations create a fresh one per invocation.
 */
@FunctionalInterface
public interface NoiseSource {

    /** @return the next sample, {@code 0.0 <= sample < 1.0} */
    double nextDouble();

    static NoiseSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextDouble;
    }

    static NoiseSource random() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /** Always returns the midpoint, i.e. zero noise. */
    static NoiseSource none() {
        return () -> 0.5;
    }
}
