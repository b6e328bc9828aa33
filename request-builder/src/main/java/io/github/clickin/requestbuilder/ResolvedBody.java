package io.github.clickin.requestbuilder;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Outcome of body resolution: the encoded bytes plus what the assembler needs from them.
 *
 * <p>Exactly one variant applies per request.
 */
public sealed interface ResolvedBody permits ResolvedBody.Empty, ResolvedBody.UrlEncoded, ResolvedBody.Multipart, ResolvedBody.Raw {

    byte[] bytes();

    /** Declared length; empty when no body was configured. */
    default OptionalLong contentLength() {
        return OptionalLong.of(bytes().length);
    }

    /** Top-level multipart boundary, if one was generated. */
    default Optional<String> boundary() {
        return Optional.empty();
    }

    /** No body configured. */
    record Empty() implements ResolvedBody {
        private static final byte[] NONE = new byte[0];

        @Override
        public byte[] bytes() {
            return NONE;
        }

        @Override
        public OptionalLong contentLength() {
            return OptionalLong.empty();
        }
    }

    /** Parameters encoded as {@code x-www-form-urlencoded}. */
    record UrlEncoded(byte[] bytes) implements ResolvedBody {}

    /** Parameters and files encoded as {@code multipart/form-data}. */
    record Multipart(byte[] bytes, String token) implements ResolvedBody {
        @Override
        public Optional<String> boundary() {
            return Optional.of(token);
        }
    }

    /** Caller-supplied body, passed through unchanged. */
    record Raw(byte[] bytes) implements ResolvedBody {}
}
