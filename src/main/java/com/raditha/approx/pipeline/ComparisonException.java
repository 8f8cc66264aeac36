package com.raditha.approx.pipeline;

/**
 * Candidate and reference outputs could not be compared.
 */
public class ComparisonException extends PipelineException {

    public static final String REASON = "error_calculation_failure";

    public ComparisonException(String message) {
        super(message);
    }

    public ComparisonException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getReason() {
        return REASON;
    }
}
