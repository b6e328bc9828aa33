package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.FileParams;
import io.github.clickin.requestbuilder.core.Headers;
import io.github.clickin.requestbuilder.core.HttpMethod;
import io.github.clickin.requestbuilder.core.Params;

import java.util.Objects;

/**
 * Immutable copy of a request draft, taken when the builder is consumed.
 *
 * <p>Body resolution and request assembly only ever read this snapshot.
 *
 * @param method HTTP method
 * @param params read-only parameters
 * @param fileParams read-only file parameters
 * @param body raw body; {@code null} when none was set
 * @param headers read-only headers
 * @param contentType content-type tag that selects the body encoding
 * @param secure whether the request is marked as HTTPS
 * @param uri request URI without derived query string
 */
public record DraftSnapshot(
        HttpMethod method,
        Params params,
        FileParams fileParams,
        byte[] body,
        Headers headers,
        String contentType,
        boolean secure,
        String uri
) {
    public DraftSnapshot {
        Objects.requireNonNull(method, "method");
        params = Params.copyOf(Objects.requireNonNull(params, "params"));
        fileParams = FileParams.copyOf(Objects.requireNonNull(fileParams, "fileParams"));
        body = body == null ? null : body.clone();
        headers = Headers.copyOf(Objects.requireNonNull(headers, "headers"));
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(uri, "uri");
    }
}
