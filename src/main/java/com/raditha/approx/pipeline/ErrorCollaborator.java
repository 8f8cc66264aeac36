package com.raditha.approx.pipeline;

import java.nio.file.Path;

/**
 * Measures how far a candidate's output is from the baseline output.
 */
public interface ErrorCollaborator {

    /**
     * @return error in [0, 1], higher is worse
     * @throws ComparisonException if the outputs cannot be compared
     */
    double compareOutputs(Path referencePath, Path candidatePath) throws ComparisonException;
}
