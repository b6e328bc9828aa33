package io.github.clickin.requestbuilder.core;

/**
 * HTTP request methods a built request can carry.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    DELETE,
    TRACE,
    OPTIONS,
    CONNECT,
    PATCH
}
