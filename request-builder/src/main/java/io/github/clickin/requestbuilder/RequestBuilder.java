package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.FileUpload;
import io.github.clickin.requestbuilder.core.HttpMethod;
import io.github.clickin.requestbuilder.core.MockRequest;
import io.github.clickin.requestbuilder.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Accumulates request configuration step by step and builds a {@link MockRequest}.
 *
 * <p>Steps mutate a single draft in call order; a later step overrides an earlier one. Nothing is
 * validated while configuring: combinations with no body encoding (files on a GET, a raw body on
 * a POST) are accepted and simply have no effect on the body when {@link #build()} runs.
 *
 * <pre>{@code
 * MockRequest request = RequestBuilder.buildRequest(rb -> rb
 *         .postUrlEncoded("/authenticate", List.of(Map.entry("login", "john@doe.com")))
 *         .setHeader("Accept", "application/json"));
 * }</pre>
 *
 * <p>A builder is single-use and not thread-safe. After {@link #build()} every further call fails
 * with {@link IllegalStateException}.
 */
public final class RequestBuilder {
    private static final Logger log = LoggerFactory.getLogger(RequestBuilder.class);

    private final RequestBuilderConfig config;
    private final RequestDraft draft = new RequestDraft();
    private boolean consumed;

    private RequestBuilder(RequestBuilderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public static RequestBuilder create() {
        return new RequestBuilder(RequestBuilderConfig.defaults());
    }

    public static RequestBuilder create(RequestBuilderConfig config) {
        return new RequestBuilder(config);
    }

    /**
     * Applies {@code steps} to a fresh default draft and builds it.
     *
     * @param steps configuration steps
     * @return the built request
     */
    public static MockRequest buildRequest(Consumer<RequestBuilder> steps) {
        return buildRequest(RequestBuilderConfig.defaults(), steps);
    }

    public static MockRequest buildRequest(RequestBuilderConfig config, Consumer<RequestBuilder> steps) {
        Objects.requireNonNull(steps, "steps");
        RequestBuilder builder = create(config);
        steps.accept(builder);
        return builder.build();
    }

    /**
     * Runs a reusable sequence of steps against this builder.
     *
     * @param steps configuration steps
     * @return this builder
     */
    public RequestBuilder apply(Consumer<RequestBuilder> steps) {
        Objects.requireNonNull(steps, "steps");
        checkOpen();
        steps.accept(this);
        return this;
    }

    public RequestBuilder setMethod(HttpMethod method) {
        checkOpen();
        draft.method = Objects.requireNonNull(method, "method");
        return this;
    }

    /**
     * Adds a value to a parameter without replacing existing values. The newest value comes first.
     *
     * @param name parameter name
     * @param value parameter value
     * @return this builder
     */
    public RequestBuilder addParam(String name, String value) {
        checkOpen();
        draft.params.add(name, value);
        return this;
    }

    /**
     * Replaces all parameters with one value per name.
     *
     * @param params name/value pairs; a later pair wins over an earlier one with the same name
     * @return this builder
     */
    public RequestBuilder setParams(List<? extends Map.Entry<String, String>> params) {
        checkOpen();
        draft.params.replaceAll(params);
        return this;
    }

    /**
     * Replaces all file parameters with one upload per field.
     *
     * @param fileParams field name/upload pairs
     * @return this builder
     */
    public RequestBuilder setFileParams(List<? extends Map.Entry<String, FileUpload>> fileParams) {
        checkOpen();
        draft.fileParams.replaceAll(fileParams);
        return this;
    }

    /**
     * Adds an upload to a file field; a field with several uploads is sent as nested
     * {@code multipart/mixed}.
     *
     * @param name field name
     * @param filename the upload's filename
     * @param content the upload's bytes
     * @return this builder
     */
    public RequestBuilder addFileParam(String name, String filename, byte[] content) {
        checkOpen();
        draft.fileParams.add(name, new FileUpload(filename, content));
        return this;
    }

    /**
     * Sets the raw body. Only PUT requests send it.
     *
     * @param body body bytes; may be empty
     * @return this builder
     */
    public RequestBuilder setRequestBody(byte[] body) {
        checkOpen();
        draft.body = Objects.requireNonNull(body, "body").clone();
        return this;
    }

    public RequestBuilder setHeader(String name, String value) {
        checkOpen();
        draft.headers.set(name, value);
        return this;
    }

    public RequestBuilder addHeader(String name, String value) {
        checkOpen();
        draft.headers.add(name, value);
        return this;
    }

    /**
     * Encodes the body as {@code x-www-form-urlencoded}. This is the default.
     *
     * @return this builder
     */
    public RequestBuilder formUrlEncoded() {
        return setContentType(Protocol.CT_FORM_URLENCODED);
    }

    /**
     * Encodes the body as {@code multipart/form-data}; the boundary is added to the header at build time.
     *
     * @return this builder
     */
    public RequestBuilder multipartEncoded() {
        return setContentType(Protocol.CT_MULTIPART_FORM_DATA);
    }

    /**
     * Sets the content-type tag and the {@code Content-Type} header to {@code contentType}.
     * Tags other than the form and multipart ones produce no encoded body.
     *
     * @param contentType content type literal
     * @return this builder
     */
    public RequestBuilder setContentType(String contentType) {
        checkOpen();
        Objects.requireNonNull(contentType, "contentType");
        draft.headers.set(Protocol.H_CONTENT_TYPE, contentType);
        draft.contentType = contentType;
        return this;
    }

    public RequestBuilder useHttps() {
        checkOpen();
        draft.secure = true;
        return this;
    }

    public RequestBuilder setURI(String uri) {
        checkOpen();
        draft.uri = Objects.requireNonNull(uri, "uri");
        return this;
    }

    /**
     * GET request whose parameters end up in the query string.
     *
     * @param uri request URI
     * @param params query parameters
     * @return this builder
     */
    public RequestBuilder get(String uri, List<? extends Map.Entry<String, String>> params) {
        return formUrlEncoded()
                .setMethod(HttpMethod.GET)
                .setURI(uri)
                .setParams(params);
    }

    /**
     * POST request with an urlencoded form body.
     *
     * @param uri request URI
     * @param params form parameters
     * @return this builder
     */
    public RequestBuilder postUrlEncoded(String uri, List<? extends Map.Entry<String, String>> params) {
        return formUrlEncoded()
                .setMethod(HttpMethod.POST)
                .setURI(uri)
                .setParams(params);
    }

    /**
     * POST request with a multipart body carrying parameters and files.
     *
     * @param uri request URI
     * @param params form parameters
     * @param fileParams field name/upload pairs
     * @return this builder
     */
    public RequestBuilder postMultipart(String uri,
                                        List<? extends Map.Entry<String, String>> params,
                                        List<? extends Map.Entry<String, FileUpload>> fileParams) {
        return multipartEncoded()
                .setMethod(HttpMethod.POST)
                .setURI(uri)
                .setParams(params)
                .setFileParams(fileParams);
    }

    /**
     * PUT request with a raw body of the given content type.
     *
     * @param uri request URI
     * @param contentType content type of the body
     * @param body body bytes
     * @return this builder
     */
    public RequestBuilder put(String uri, String contentType, byte[] body) {
        return setContentType(contentType)
                .setMethod(HttpMethod.PUT)
                .setURI(uri)
                .setRequestBody(body);
    }

    /**
     * Resolves the body, assembles the request and consumes this builder.
     *
     * @return the built request
     * @throws IllegalStateException if the builder was already built
     */
    public MockRequest build() {
        checkOpen();
        consumed = true;
        DraftSnapshot snapshot = draft.snapshot();
        ResolvedBody body = config.bodyResolver().resolve(snapshot);
        MockRequest request = config.assembler().assemble(snapshot, body);
        log.debug("Built {}", request);
        return request;
    }

    /**
     * Current draft state, for inspection before building.
     *
     * @return an immutable snapshot
     */
    public DraftSnapshot snapshot() {
        checkOpen();
        return draft.snapshot();
    }

    private void checkOpen() {
        if (consumed) throw new IllegalStateException("RequestBuilder has already been built");
    }
}
