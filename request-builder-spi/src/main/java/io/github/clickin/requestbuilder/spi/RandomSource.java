package io.github.clickin.requestbuilder.spi;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * Source of random bytes for multipart boundary generation.
 *
 * <p>Boundaries only need to be unlikely to collide with body content, so implementations need
 * not be cryptographically strong. Deterministic implementations make multipart bodies
 * reproducible in tests.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Fills {@code bytes} with random values.
     *
     * @param bytes destination buffer
     * @throws RuntimeException if the source cannot produce bytes
     */
    void nextBytes(byte[] bytes);

    /**
     * Thread-safe source backed by a shared {@link SecureRandom}.
     *
     * @return the default source
     */
    static RandomSource secure() {
        SecureRandom random = new SecureRandom();
        return random::nextBytes;
    }

    /**
     * Reproducible source: two sources with the same seed yield the same byte sequence.
     * Not thread-safe.
     *
     * @param seed initial seed
     * @return a seeded source
     */
    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextBytes;
    }

    /**
     * Wraps an existing {@link Random}.
     *
     * @param random the generator to draw from
     * @return a source delegating to {@code random}
     */
    static RandomSource from(Random random) {
        Objects.requireNonNull(random, "random");
        return random::nextBytes;
    }
}
