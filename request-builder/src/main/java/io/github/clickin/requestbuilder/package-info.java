/**
 * Builds in-memory HTTP requests for handler tests.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.github.clickin.requestbuilder.RequestBuilder} (step-by-step draft configuration)</li>
 *   <li>{@link io.github.clickin.requestbuilder.BodyResolver} (method/content-type to body encoding)</li>
 *   <li>{@link io.github.clickin.requestbuilder.QueryEncoder} and
 *       {@link io.github.clickin.requestbuilder.MultipartEncoder} (wire formats)</li>
 *   <li>{@link io.github.clickin.requestbuilder.RequestAssembler} (URI, headers and length of the final request)</li>
 * </ul>
 */
package io.github.clickin.requestbuilder;
