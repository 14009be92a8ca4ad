package com.discernus.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discernus.Main;
import com.discernus.dispatch.CancellationToken;
import com.discernus.health.DispatchStatistics;
import com.discernus.health.ModelStatus;
import com.discernus.pipeline.PipelineDefinition;
import com.discernus.pipeline.PipelineStatus;
import com.discernus.pipeline.RunReport;
import com.discernus.pipeline.StageResult;
import com.discernus.runtime.Engine;
import com.discernus.store.StorageException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * {@code discernus run <pipeline>}. Exit codes: 0 success, 3 partial failure,
 * 4 fatal failure, 5 cancelled, 2 usage or configuration error.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a pipeline, reusing cached stage results")
public class RunCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = "Pipeline definition (YAML)")
    Path pipelinePath;

    @Override
    public Integer call() {
        PipelineDefinition definition;
        Engine engine;
        try {
            definition = PipelineDefinition.load(pipelinePath);
            engine = Engine.create(parent.loadConfig(), parent.configDir(), parent.modelClient(), parent.environment());
        } catch (IOException | IllegalArgumentException e) {
            log.error("cli.run.config-error pipeline={} reason={}", pipelinePath, e.getMessage());
            System.err.println("Configuration error: " + e.getMessage());
            return Main.EXIT_USAGE;
        } catch (StorageException e) {
            log.error("cli.run.storage-error reason={}", e.getMessage(), e);
            System.err.println("Storage error: " + e.getMessage());
            return PipelineStatus.FATAL_FAILURE.exitCode();
        }

        CancellationToken cancellation = new CancellationToken();
        Thread shutdownHook = new Thread(() -> cancellation.cancel("interrupted by signal"), "discernus-cancel");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try (engine) {
            RunReport report = engine.orchestrator().run(definition, cancellation);
            print(report);
            for (ModelStatus status : engine.healthManager().snapshot()) {
                System.out.printf("  model %-28s %-11s failures=%d%n",
                        status.descriptor().id(), status.state(), status.consecutiveFailures());
            }
            DispatchStatistics statistics = engine.healthManager().statistics();
            if (statistics.totalFailures() > 0) {
                System.out.printf("  call failures: %s%n", statistics.failureCounts());
            }
            return report.status().exitCode();
        } catch (IllegalArgumentException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return Main.EXIT_USAGE;
        } catch (StorageException e) {
            log.error("cli.run.storage-error reason={}", e.getMessage(), e);
            System.err.println("Storage error: " + e.getMessage());
            return PipelineStatus.FATAL_FAILURE.exitCode();
        } finally {
            removeHook(shutdownHook);
        }
    }

    private static void print(RunReport report) {
        System.out.printf("Pipeline %s run %s: %s%n", report.pipelineName(), report.runId(), report.status());
        for (StageResult stage : report.stages()) {
            System.out.printf("  %-24s %-9s attempts=%d model=%s artifact=%s%s%n",
                    stage.stageId(),
                    stage.status(),
                    stage.attempts(),
                    stage.modelId() == null ? "-" : stage.modelId(),
                    stage.artifactHash() == null ? "-" : stage.artifactHash(),
                    stage.error() == null ? "" : " error=" + stage.error());
        }
        System.out.printf("  total cost: %.6f%n", report.totalCost());
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("cli.run.shutdown-in-progress");
        }
    }
}
