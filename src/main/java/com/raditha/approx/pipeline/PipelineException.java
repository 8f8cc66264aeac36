package com.raditha.approx.pipeline;

/**
 * Failure of one external stage for one variant. The variant is marked failed with
 * {@link #getReason()} and the search carries on.
 */
public abstract class PipelineException extends Exception {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Machine-readable failure reason recorded in the cache and reports.
     */
    public abstract String getReason();
}
