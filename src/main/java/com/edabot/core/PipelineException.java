package com.edabot.core;

/**
 * Terminal, run-level failure. Carries the name of the stage that failed so
 * the application can report it before exiting.
 */
public class PipelineException extends RuntimeException {
    private final String stage;

    public PipelineException(String stage, String message) {
        super(message);
        this.stage = stage == null ? "" : stage;
    }

    public PipelineException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage == null ? "" : stage;
    }

    public String stage() {
        return stage;
    }
}
