package com.dalatnews.backend.pipeline;

public class PipelineAlreadyRunningException extends RuntimeException {

    public PipelineAlreadyRunningException() {
        super("A news pipeline run is already in progress");
    }
}
