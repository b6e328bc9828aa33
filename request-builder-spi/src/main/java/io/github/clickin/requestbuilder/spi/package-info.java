/**
 * Collaborator contracts for request building.
 *
 * <p>{@link io.github.clickin.requestbuilder.spi.RandomSource} feeds multipart boundaries and
 * {@link io.github.clickin.requestbuilder.spi.MimeTypeResolver} names the content type of uploads.
 * Both can be replaced with deterministic implementations in tests.
 */
package io.github.clickin.requestbuilder.spi;
