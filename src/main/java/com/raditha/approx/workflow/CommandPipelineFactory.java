package com.raditha.approx.workflow;

import com.raditha.approx.config.ApplicationConfig;
import com.raditha.approx.config.ExplorerConfig;
import com.raditha.approx.config.ToolchainConfig;
import com.raditha.approx.pipeline.CommandBuildCollaborator;
import com.raditha.approx.pipeline.CommandExecuteCollaborator;
import com.raditha.approx.pipeline.EvaluationPipeline;
import com.raditha.approx.pipeline.InstructionLogProfiler;
import com.raditha.approx.pipeline.NumericOutputComparator;
import com.raditha.approx.pipeline.PipelineOptions;
import com.raditha.approx.pipeline.ProcessRunner;
import com.raditha.approx.pipeline.VariantStatusMonitor;
import com.raditha.approx.workspace.ExecutionWorkspace;

/**
 * Pipeline backed by the configured cross-compiler and simulator processes.
 */
public class CommandPipelineFactory implements PipelineFactory {

    @Override
    public EvaluationPipeline create(ExplorerConfig config, ApplicationConfig application,
                                     ExecutionWorkspace workspace) {
        if (application.energyModel() == null) {
            throw new IllegalArgumentException("energy_model is required for application " + application.name());
        }
        ProcessRunner runner = new ProcessRunner();
        ToolchainConfig toolchain = config.toolchain();

        CommandBuildCollaborator builder = new CommandBuildCollaborator(
                runner,
                toolchain.compiler(),
                toolchain.compilerFlags(),
                application.includeDirs(),
                application.additionalSources(),
                toolchain.libraries(),
                workspace.getExecutablesDir(),
                application.exePrefix(),
                config.timeout());
        CommandExecuteCollaborator executor = new CommandExecuteCollaborator(
                runner,
                toolchain.simulatorCommand(),
                workspace.getOutputsDir(),
                workspace.getLogsDir(),
                application.outputSuffix());

        PipelineOptions options = new PipelineOptions(
                application.buildFlags(),
                application.inputData(),
                config.timeout(),
                application.energyModel(),
                false);
        return new EvaluationPipeline(builder, executor,
                new InstructionLogProfiler(workspace.getEnergyReportsDir()),
                new NumericOutputComparator(),
                new VariantStatusMonitor(),
                options);
    }
}
