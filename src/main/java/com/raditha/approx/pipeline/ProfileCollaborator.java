package com.raditha.approx.pipeline;

import java.nio.file.Path;

/**
 * Estimates latency and energy from an execution log.
 */
public interface ProfileCollaborator {

    /**
     * @throws ProfileException if the log or the energy model cannot be used
     */
    ProfileResult profile(Path executionLog, Path energyModel) throws ProfileException;
}
