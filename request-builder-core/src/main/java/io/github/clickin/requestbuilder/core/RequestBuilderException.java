package io.github.clickin.requestbuilder.core;

/**
 * Base class for request builder related exceptions.
 *
 * <p>Building a request has almost no failure modes: every combination of parameters, files and
 * headers produces a deterministic request. Subclasses cover the collaborator failures that do exist.
 */
public abstract class RequestBuilderException extends RuntimeException {

    protected RequestBuilderException(String message) {
        super(message);
    }

    protected RequestBuilderException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the random byte source backing boundary generation fails.
     */
    public static class BoundaryGenerationFailed extends RequestBuilderException {
        public BoundaryGenerationFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a MIME type table entry is malformed.
     */
    public static class InvalidMimeMapping extends RequestBuilderException {
        public InvalidMimeMapping(String message) {
            super(message);
        }
    }
}
