package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.Headers;
import io.github.clickin.requestbuilder.core.HttpMethod;
import io.github.clickin.requestbuilder.core.MockRequest;
import io.github.clickin.requestbuilder.core.Protocol;
import io.github.clickin.requestbuilder.core.ServerDefaults;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns a draft snapshot and its resolved body into the final {@link MockRequest}.
 *
 * <p>GET parameters are folded into the URI. A multipart boundary is added to the
 * {@code Content-Type} header only when the draft's tag is exactly {@code multipart/form-data}.
 */
public final class RequestAssembler {
    private final ServerDefaults server;

    public RequestAssembler(ServerDefaults server) {
        this.server = Objects.requireNonNull(server, "server");
    }

    public MockRequest assemble(DraftSnapshot draft, ResolvedBody resolved) {
        Objects.requireNonNull(draft, "draft");
        Objects.requireNonNull(resolved, "resolved");

        return MockRequest.builder(draft.method(), requestUri(draft))
                .queryString(queryString(draft))
                .headers(requestHeaders(draft, resolved.boundary()))
                .body(resolved.bytes())
                .contentLength(resolved.contentLength())
                .params(draft.params())
                .secure(draft.secure())
                .server(server)
                .build();
    }

    static String requestUri(DraftSnapshot draft) {
        if (draft.method() != HttpMethod.GET || draft.params().isEmpty()) return draft.uri();
        return draft.uri() + "?" + QueryEncoder.encode(draft.params());
    }

    static String queryString(DraftSnapshot draft) {
        return draft.method() == HttpMethod.GET ? QueryEncoder.encode(draft.params()) : "";
    }

    static Headers requestHeaders(DraftSnapshot draft, Optional<String> boundary) {
        if (boundary.isEmpty() || !Protocol.CT_MULTIPART_FORM_DATA.equals(draft.contentType())) {
            return draft.headers();
        }
        return Headers.mutableCopyOf(draft.headers())
                .set(Protocol.H_CONTENT_TYPE,
                        Protocol.CT_MULTIPART_FORM_DATA + "; " + Protocol.P_BOUNDARY + "=" + boundary.get());
    }
}
