package org.prisma.runtime;

import java.io.IOException;

import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.services.FrameWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import jakarta.jms.JMSException;

/**
 * Runs the pipeline for one job on the pool matching the execution context of the submitting
 * process.
 */
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final Config config;

    /**
     * @param config application configuration.
     */
    public JobRunner(Config config) {
        this.config = config;
    }

    /**
     * @param job     the job.
     * @param context execution context of this process; must be the submitter.
     * @return the run summary.
     * @throws IOException          if the calibration cannot be read or the dataset cannot be finalized.
     * @throws InterruptedException if interrupted while waiting for frames.
     */
    public RunSummary run(JobSpecification job, ExecutionContext context) throws IOException, InterruptedException {
        if (context.role() != RankRole.SUBMITTER) {
            throw new IllegalArgumentException("Only the submitter runs the pipeline, this process is " + context.role());
        }
        IWorkerPool pool = null;
        ExecutionMode mode = ExecutionMode.LOCAL;
        if (context.isDistributed()) {
            Config distributed = config.hasPath("prisma.execution.distributed")
                ? config.getConfig("prisma.execution.distributed")
                : ConfigFactory.empty();
            try {
                pool = new DistributedWorkerPool(context.brokerUrl(), context.workers(), distributed);
                mode = ExecutionMode.DISTRIBUTED;
            } catch (JMSException e) {
                log.warn("Broker {} not reachable, falling back to local execution: {}", context.brokerUrl(),
                    e.getMessage());
            }
        }
        if (pool == null) {
            int threads = context.isDistributed() ? localWorkers() : context.workers();
            pool = new LocalWorkerPool(FrameWorker.forJob(job, config), threads);
        }
        try (IWorkerPool running = pool) {
            log.info("Running {} on {}", job.sample(), running.describe());
            return new ProcessingPipeline(config, running).run(job, mode);
        }
    }

    private int localWorkers() {
        return config.hasPath("prisma.execution.localWorkers") ? config.getInt("prisma.execution.localWorkers") : 0;
    }
}
