package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.FileParams;
import io.github.clickin.requestbuilder.core.Headers;
import io.github.clickin.requestbuilder.core.HttpMethod;
import io.github.clickin.requestbuilder.core.Params;
import io.github.clickin.requestbuilder.core.Protocol;

/**
 * Mutable request configuration owned by a single {@link RequestBuilder}.
 */
final class RequestDraft {
    HttpMethod method = HttpMethod.GET;
    final Params params = Params.create();
    final FileParams fileParams = FileParams.create();
    byte[] body; // null until set
    final Headers headers = Headers.create();
    String contentType = Protocol.CT_FORM_URLENCODED;
    boolean secure;
    String uri = "";

    DraftSnapshot snapshot() {
        return new DraftSnapshot(method, params, fileParams, body, headers, contentType, secure, uri);
    }
}
