package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.HttpMethod;
import io.github.clickin.requestbuilder.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Picks and runs the body encoding for a draft based on its method and content-type tag.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>POST with {@code x-www-form-urlencoded}: parameters urlencoded into the body</li>
 *   <li>POST with {@code multipart/form-data}: parameters and files as multipart</li>
 *   <li>PUT: the raw body if one was set, otherwise no body</li>
 *   <li>anything else: no body</li>
 * </ol>
 * Unmatched combinations never fail; whatever they configured for the body is dropped.
 * GET parameters still reach the request through the query string.
 */
public final class BodyResolver {
    private static final Logger log = LoggerFactory.getLogger(BodyResolver.class);

    private final BoundaryGenerator boundaries;
    private final MultipartEncoder multipart;

    public BodyResolver(BoundaryGenerator boundaries, MultipartEncoder multipart) {
        this.boundaries = Objects.requireNonNull(boundaries, "boundaries");
        this.multipart = Objects.requireNonNull(multipart, "multipart");
    }

    public ResolvedBody resolve(DraftSnapshot draft) {
        Objects.requireNonNull(draft, "draft");
        HttpMethod method = draft.method();
        String contentType = draft.contentType();

        if (method == HttpMethod.POST && Protocol.CT_FORM_URLENCODED.equals(contentType)) {
            byte[] body = QueryEncoder.encodeToBytes(draft.params());
            log.debug("POST {}: urlencoded body of {} bytes", draft.uri(), body.length);
            return new ResolvedBody.UrlEncoded(body);
        }

        if (method == HttpMethod.POST && Protocol.CT_MULTIPART_FORM_DATA.equals(contentType)) {
            String boundary = boundaries.newBoundary();
            String fileBoundary = boundaries.newBoundary();
            byte[] body = multipart.encode(boundary, fileBoundary, draft.params(), draft.fileParams());
            log.debug("POST {}: multipart body of {} bytes, boundary {}", draft.uri(), body.length, boundary);
            return new ResolvedBody.Multipart(body, boundary);
        }

        if (method == HttpMethod.PUT) {
            byte[] raw = draft.body();
            if (raw == null) {
                log.debug("PUT {}: no body set", draft.uri());
                return new ResolvedBody.Empty();
            }
            log.debug("PUT {}: raw body of {} bytes", draft.uri(), raw.length);
            return new ResolvedBody.Raw(raw);
        }

        if (log.isDebugEnabled()) {
            logDiscarded(draft);
        }
        return new ResolvedBody.Empty();
    }

    private static void logDiscarded(DraftSnapshot draft) {
        boolean paramsDropped = draft.method() != HttpMethod.GET && !draft.params().isEmpty();
        if (paramsDropped || !draft.fileParams().isEmpty() || draft.body() != null) {
            log.debug("{} {} with content type '{}': no body encoding applies, ignoring configured body input",
                    draft.method(), draft.uri(), draft.contentType());
        }
    }
}
