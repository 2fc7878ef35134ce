package com.eainde.literature.exception;

/**
 * Raised for configuration-time failures (invalid schema, unrecognised forcing
 * directive, unreadable config file). These abort a run before any document is touched.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
