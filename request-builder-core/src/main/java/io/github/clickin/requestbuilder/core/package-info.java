/**
 * Request model for building in-memory HTTP requests.
 *
 * <p>This module contains no encoding logic. It only models:
 * <ul>
 *   <li>Methods, versions, header and content-type constants</li>
 *   <li>Case-insensitive {@link io.github.clickin.requestbuilder.core.Headers}</li>
 *   <li>Multi-valued {@link io.github.clickin.requestbuilder.core.Params} and
 *       {@link io.github.clickin.requestbuilder.core.FileParams}</li>
 *   <li>The immutable {@link io.github.clickin.requestbuilder.core.MockRequest} handed to handlers</li>
 * </ul>
 */
package io.github.clickin.requestbuilder.core;
