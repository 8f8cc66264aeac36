package com.raditha.approx.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns variant sources into an executable for the target.
 */
public interface BuildCollaborator {

    /**
     * @param variantFiles the variant source, first, followed by anything else it needs
     * @param flags        extra compiler flags, such as the optimisation level
     * @return path of the built executable
     * @throws BuildException if compilation fails or times out
     */
    Path compile(List<Path> variantFiles, List<String> flags) throws BuildException;
}
