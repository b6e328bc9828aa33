package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.Protocol;
import io.github.clickin.requestbuilder.core.RequestBuilderException;
import io.github.clickin.requestbuilder.spi.RandomSource;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Produces multipart boundary tokens: {@code snap-boundary-} followed by 10 random bytes in
 * lowercase hex.
 *
 * <p>Tokens are unique only probabilistically; collisions are not checked.
 */
public final class BoundaryGenerator {
    static final int RANDOM_BYTES = 10;

    /** Length of every token this generator returns. */
    public static final int TOKEN_LENGTH = Protocol.BOUNDARY_PREFIX.length() + RANDOM_BYTES * 2;

    private static final HexFormat HEX = HexFormat.of();

    private final RandomSource randomSource;

    public BoundaryGenerator(RandomSource randomSource) {
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
    }

    /**
     * Draws a fresh boundary token.
     *
     * @return the token
     * @throws RequestBuilderException.BoundaryGenerationFailed if the random source fails
     */
    public String newBoundary() {
        byte[] bytes = new byte[RANDOM_BYTES];
        try {
            randomSource.nextBytes(bytes);
        } catch (RuntimeException e) {
            throw new RequestBuilderException.BoundaryGenerationFailed("Random source failed while generating a boundary", e);
        }
        return Protocol.BOUNDARY_PREFIX + HEX.formatHex(bytes);
    }
}
