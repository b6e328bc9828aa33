package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.ServerDefaults;
import io.github.clickin.requestbuilder.spi.MimeTypeResolver;
import io.github.clickin.requestbuilder.spi.MimeTypes;
import io.github.clickin.requestbuilder.spi.RandomSource;

import java.util.Objects;

/**
 * Collaborators and fixed request fields used by {@link RequestBuilder}.
 *
 * <p>Immutable; one instance can back any number of builders as long as its random source is
 * safe for the way those builders are used.
 */
public final class RequestBuilderConfig {
    private static final RequestBuilderConfig DEFAULTS = builder().build();

    private final RandomSource randomSource;
    private final MimeTypeResolver mimeTypes;
    private final ServerDefaults serverDefaults;

    private RequestBuilderConfig(Builder b) {
        this.randomSource = b.randomSource == null ? RandomSource.secure() : b.randomSource;
        this.mimeTypes = b.mimeTypes == null ? MimeTypes.defaults() : b.mimeTypes;
        this.serverDefaults = b.serverDefaults == null ? ServerDefaults.defaults() : b.serverDefaults;
    }

    public static RequestBuilderConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RandomSource randomSource() {
        return randomSource;
    }

    public MimeTypeResolver mimeTypes() {
        return mimeTypes;
    }

    public ServerDefaults serverDefaults() {
        return serverDefaults;
    }

    BodyResolver bodyResolver() {
        return new BodyResolver(new BoundaryGenerator(randomSource), new MultipartEncoder(mimeTypes));
    }

    RequestAssembler assembler() {
        return new RequestAssembler(serverDefaults);
    }

    public static final class Builder {
        private RandomSource randomSource;
        private MimeTypeResolver mimeTypes;
        private ServerDefaults serverDefaults;

        private Builder() {}

        /**
         * Sets the source of boundary randomness. Defaults to {@link RandomSource#secure()}.
         *
         * @param randomSource the source
         * @return this builder
         */
        public Builder randomSource(RandomSource randomSource) {
            this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
            return this;
        }

        /**
         * Sets the upload MIME type lookup. Defaults to {@link MimeTypes#defaults()}.
         *
         * @param mimeTypes the resolver
         * @return this builder
         */
        public Builder mimeTypes(MimeTypeResolver mimeTypes) {
            this.mimeTypes = Objects.requireNonNull(mimeTypes, "mimeTypes");
            return this;
        }

        public Builder serverDefaults(ServerDefaults serverDefaults) {
            this.serverDefaults = Objects.requireNonNull(serverDefaults, "serverDefaults");
            return this;
        }

        public RequestBuilderConfig build() {
            return new RequestBuilderConfig(this);
        }
    }
}
