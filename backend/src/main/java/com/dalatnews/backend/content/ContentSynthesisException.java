package com.dalatnews.backend.content;

/**
 * No article could be synthesized for a cluster. Carries the last underlying failure.
 */
public class ContentSynthesisException extends RuntimeException {

    private final String clusterId;

    public ContentSynthesisException(String clusterId, Throwable cause) {
        super("Synthesis failed for " + clusterId + ": " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.clusterId = clusterId;
    }

    public String getClusterId() {
        return clusterId;
    }
}
