package com.pipelineparser.exception;

/**
 * Exception thrown when a pipeline cannot be analyzed due to an internal failure.
 */
public class PipelineProcessingException extends RuntimeException {

    public PipelineProcessingException(Throwable cause) {
        super(String.format("Error processing pipeline: %s", cause.getMessage()), cause);
    }
}
