package com.raditha.approx.pipeline;

/**
 * The cross-compiler rejected a variant or could not be run.
 */
public class BuildException extends PipelineException {

    public static final String REASON = "build_failure";

    public BuildException(String message) {
        super(message);
    }

    public BuildException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getReason() {
        return REASON;
    }
}
