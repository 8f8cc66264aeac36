package com.raditha.approx.pipeline;

/**
 * The execution log could not be turned into an energy estimate.
 */
public class ProfileException extends PipelineException {

    public static final String REASON = "profiling_failure";

    public ProfileException(String message) {
        super(message);
    }

    public ProfileException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getReason() {
        return REASON;
    }
}
