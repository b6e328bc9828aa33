package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.RequestBuilderException;
import io.github.clickin.requestbuilder.spi.RandomSource;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundaryGeneratorTest {

    @Test
    void tokenIsPrefixedLowercaseHex() {
        BoundaryGenerator generator = new BoundaryGenerator(bytes -> Arrays.fill(bytes, (byte) 0xAB));
        assertThat(generator.newBoundary()).isEqualTo("snap-boundary-abababababababababab");
    }

    @Test
    void consecutiveTokensDifferAndHaveFixedShape() {
        BoundaryGenerator generator = new BoundaryGenerator(RandomSource.seeded(1234L));
        String first = generator.newBoundary();
        String second = generator.newBoundary();

        assertThat(first).isNotEqualTo(second);
        assertThat(first).hasSize(BoundaryGenerator.TOKEN_LENGTH).matches("snap-boundary-[0-9a-f]{20}");
        assertThat(second).hasSize(BoundaryGenerator.TOKEN_LENGTH).matches("snap-boundary-[0-9a-f]{20}");
    }

    @Test
    void secureSourceProducesWellFormedTokens() {
        BoundaryGenerator generator = new BoundaryGenerator(RandomSource.secure());
        assertThat(generator.newBoundary()).matches("snap-boundary-[0-9a-f]{20}");
    }

    @Test
    void randomSourceFailurePropagates() {
        IllegalStateException failure = new IllegalStateException("entropy exhausted");
        BoundaryGenerator generator = new BoundaryGenerator(bytes -> {
            throw failure;
        });

        assertThatThrownBy(generator::newBoundary)
                .isInstanceOf(RequestBuilderException.BoundaryGenerationFailed.class)
                .hasCause(failure);
    }
}
