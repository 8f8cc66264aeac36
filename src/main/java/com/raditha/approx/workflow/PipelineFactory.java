package com.raditha.approx.workflow;

import com.raditha.approx.config.ApplicationConfig;
import com.raditha.approx.config.ExplorerConfig;
import com.raditha.approx.pipeline.EvaluationPipeline;
import com.raditha.approx.workspace.ExecutionWorkspace;

/**
 * Creates the evaluation pipeline for one application and workspace.
 */
@FunctionalInterface
public interface PipelineFactory {

    EvaluationPipeline create(ExplorerConfig config, ApplicationConfig application, ExecutionWorkspace workspace);
}
