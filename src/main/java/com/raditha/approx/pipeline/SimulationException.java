package com.raditha.approx.pipeline;

/**
 * The simulator failed, timed out or produced no output.
 */
public class SimulationException extends PipelineException {

    public static final String REASON = "simulation_failure";

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getReason() {
        return REASON;
    }
}
