package org.prisma.cli.commands;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.prisma.cli.CommandLineInterface;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.job.JobSpecificationLoader;
import org.prisma.datapipeline.services.FrameWorker;
import org.prisma.node.processes.broker.BrokerRendezvous;
import org.prisma.node.processes.broker.CoordinatorService;
import org.prisma.node.processes.broker.EmbeddedBrokerProcess;
import org.prisma.node.processes.worker.FrameWorkerService;
import org.prisma.runtime.ExecutionContext;
import org.prisma.runtime.ExecutionMode;
import org.prisma.runtime.ExecutionModeSelector;
import org.prisma.runtime.JobRunner;
import org.prisma.runtime.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Processes one recipe.
 * <p>
 * Under a multi-node launcher every rank runs this command with the same arguments; the rank
 * decides whether the process runs the broker, a worker loop or the pipeline itself.
 */
@Command(
    name = "process",
    description = "Process one recipe into a 4D dataset"
)
public class ProcessCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommand.class);

    @Option(
        names = {"-j", "--job"},
        required = true,
        description = "Recipe file (JSON)"
    )
    private Path recipe;

    @Option(
        names = {"--mode"},
        description = "Execution mode: ${COMPLETION-CANDIDATES} (default: from configuration)"
    )
    private ExecutionMode mode;

    @Option(
        names = {"--workers"},
        description = "Worker threads in local mode (default: from configuration)"
    )
    private Integer workers;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private Map<String, String> environment = System.getenv();

    void setEnvironment(Map<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public Integer call() throws Exception {
        Config config = parent.getConfig();
        if (workers != null) {
            config = ConfigFactory.parseMap(Map.of("prisma.execution.localWorkers", workers)).withFallback(config);
        }
        JobSpecification job = JobSpecificationLoader.load(recipe);

        ExecutionModeSelector selector = new ExecutionModeSelector(config, environment);
        ExecutionContext context = selector.select(mode);
        if (context.isIdle()) {
            log.warn("Rank {} has no part in this run: {}", context.rank(), context.fallbackReason());
            return CommandLineInterface.EXIT_OK;
        }

        switch (context.role()) {
            case COORDINATOR -> {
                return coordinate(config, selector, context);
            }
            case WORKER -> {
                return work(config, job, context);
            }
            default -> {
                RunSummary summary = new JobRunner(config).run(job, context);
                spec.commandLine().getOut().println(summary.toLogLine());
                return CommandLineInterface.EXIT_OK;
            }
        }
    }

    private int coordinate(Config config, ExecutionModeSelector selector, ExecutionContext context)
            throws InterruptedException {
        Config distributed = config.getConfig("prisma.execution.distributed");
        BrokerRendezvous rendezvous = selector.rendezvous(selector.jobKey());
        CoordinatorService coordinator = new CoordinatorService(
            EmbeddedBrokerProcess.inVmUrl(config.getConfig("prisma.broker")), context.brokerUrl(),
            distributed.getString("controlTopic"), rendezvous, distributed.getDuration("pollInterval").toMillis());
        coordinator.start();
        coordinator.awaitTermination();
        return CommandLineInterface.EXIT_OK;
    }

    private int work(Config config, JobSpecification job, ExecutionContext context) throws Exception {
        FrameWorkerService service = new FrameWorkerService(context.workerId(), context.brokerUrl(),
            FrameWorker.forJob(job, config), config.getConfig("prisma.execution.distributed"));
        service.start();
        service.awaitTermination();
        return CommandLineInterface.EXIT_OK;
    }
}
