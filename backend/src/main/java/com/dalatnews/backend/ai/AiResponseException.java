package com.dalatnews.backend.ai;

/**
 * The text-generation service answered, but not with something usable.
 */
public class AiResponseException extends RuntimeException {

    public AiResponseException(String message) {
        super(message);
    }

    public AiResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
