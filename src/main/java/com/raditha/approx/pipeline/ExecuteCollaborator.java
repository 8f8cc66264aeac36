package com.raditha.approx.pipeline;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs an executable on the simulator.
 */
public interface ExecuteCollaborator {

    /**
     * @param inputData input argument handed to the program
     * @param timeout   the invocation is killed and reported as failed after this long
     * @throws SimulationException on non-zero exit, timeout or missing output
     */
    ExecutionResult run(Path executable, String inputData, Duration timeout) throws SimulationException;
}
