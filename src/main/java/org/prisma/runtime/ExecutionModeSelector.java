package org.prisma.runtime;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.prisma.node.processes.broker.BrokerRendezvous;
import org.prisma.node.processes.broker.EmbeddedBrokerProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

/**
 * Decides whether this process runs frames locally or takes part in a distributed run, and
 * which role it plays.
 * <p>
 * Selection never fails. Whenever a distributed run cannot be set up (no or malformed launch
 * context, too few ranks, broker not reachable) the submitting process falls back to local
 * execution with a warning and every other rank is told it has nothing to do, so exactly one
 * process runs the pipeline.
 * <p>
 * In a distributed run rank 0 starts the broker here; publishing its URL is left to the
 * coordinator service, which first subscribes to the control topic.
 */
public class ExecutionModeSelector {

    private static final Logger log = LoggerFactory.getLogger(ExecutionModeSelector.class);

    private final Config execution;
    private final Config broker;
    private final Map<String, String> environment;

    /**
     * @param config      application configuration ({@code prisma.execution}, {@code prisma.broker}).
     * @param environment process environment, usually {@code System.getenv()}.
     */
    public ExecutionModeSelector(Config config, Map<String, String> environment) {
        this.execution = section(config, "prisma.execution");
        this.broker = section(config, "prisma.broker");
        this.environment = environment;
    }

    private static Config section(Config config, String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }

    /**
     * @param override mode requested on the command line, or {@code null}.
     * @return the execution context of this process.
     */
    public ExecutionContext select(ExecutionMode override) {
        ExecutionMode configured = execution.hasPath("mode")
            ? ExecutionMode.parse(execution.getString("mode"))
            : ExecutionMode.AUTO;
        ExecutionMode requested = override != null && override != ExecutionMode.AUTO ? override : configured;
        int localWorkers = localWorkers();

        if (requested == ExecutionMode.LOCAL) {
            return ExecutionContext.local(localWorkers, null);
        }

        ClusterEnvironment cluster = ClusterEnvironment.detect(environment);
        if (!cluster.isPresent()) {
            if (requested == ExecutionMode.DISTRIBUTED) {
                return fallBack(localWorkers, "distributed mode requested but no multi-node launch context found");
            }
            return ExecutionContext.local(localWorkers, null);
        }

        int rank;
        try {
            rank = cluster.parsedRank();
        } catch (IllegalStateException e) {
            return fallBack(localWorkers, "malformed launch context: " + e.getMessage());
        }
        int size;
        try {
            size = cluster.parsedSize();
        } catch (IllegalStateException e) {
            return rankZeroOnly(rank, 0, localWorkers, "malformed launch context: " + e.getMessage());
        }
        if (rank >= size) {
            return rankZeroOnly(rank, size, localWorkers, "rank " + rank + " outside launch of size " + size);
        }
        if (size < ClusterEnvironment.MIN_SIZE) {
            return rankZeroOnly(rank, size, localWorkers, "distributed execution needs at least "
                + ClusterEnvironment.MIN_SIZE + " ranks, launch has " + size);
        }

        RankRole role = RankRole.forRank(rank);
        int workers = size - 2;
        if (role == RankRole.COORDINATOR) {
            return startCoordinator(rank, size, workers);
        }

        BrokerRendezvous rendezvous = rendezvous(cluster.jobKey());
        Optional<String> url;
        try {
            url = rendezvous.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            url = Optional.empty();
        }
        if (url.isEmpty()) {
            String reason = "no broker URL appeared in " + rendezvous.file() + " within " + rendezvousTimeout();
            if (role == RankRole.SUBMITTER) {
                return fallBack(localWorkers, reason);
            }
            log.warn("Rank {}: {}, nothing to do", rank, reason);
            return ExecutionContext.idle(role, rank, size, reason);
        }
        log.info("Rank {} joining distributed run as {} via {}", rank, role, url.get());
        return new ExecutionContext(ExecutionMode.DISTRIBUTED, role, rank, size, workers, url.get(), null);
    }

    /**
     * @return the rendezvous for a job key, as configured.
     */
    public BrokerRendezvous rendezvous(String jobKey) {
        return new BrokerRendezvous(rendezvousDirectory(), jobKey, rendezvousTimeout(),
            duration("distributed.pollInterval", Duration.ofSeconds(1)));
    }

    /**
     * @return the job key of the current launch.
     */
    public String jobKey() {
        return ClusterEnvironment.detect(environment).jobKey();
    }

    private ExecutionContext startCoordinator(int rank, int size, int workers) {
        int port = execution.hasPath("distributed.port") ? execution.getInt("distributed.port") : 61616;
        try {
            EmbeddedBrokerProcess.ensureStarted(broker.withValue("port", ConfigValueFactory.fromAnyRef(port)));
        } catch (IllegalStateException e) {
            String reason = "broker could not be started: " + e.getMessage();
            log.warn("Rank {}: {}, nothing to do", rank, reason);
            return ExecutionContext.idle(RankRole.COORDINATOR, rank, size, reason);
        }
        String url = "tcp://" + advertisedHost() + ":" + port;
        log.info("Rank 0 coordinating distributed run of {} ranks, broker at {}", size, url);
        return new ExecutionContext(ExecutionMode.DISTRIBUTED, RankRole.COORDINATOR, rank, size, workers, url, null);
    }

    private ExecutionContext rankZeroOnly(int rank, int size, int localWorkers, String reason) {
        if (rank == 0) {
            return fallBack(localWorkers, reason);
        }
        log.warn("Rank {}: {}, leaving the run to rank 0", rank, reason);
        return ExecutionContext.idle(RankRole.WORKER, rank, size, reason);
    }

    private ExecutionContext fallBack(int localWorkers, String reason) {
        log.warn("Falling back to local execution: {}", reason);
        return ExecutionContext.local(localWorkers, reason);
    }

    private int localWorkers() {
        int configured = execution.hasPath("localWorkers") ? execution.getInt("localWorkers") : 0;
        return configured > 0 ? configured : LocalWorkerPool.defaultWorkerCount();
    }

    private Duration rendezvousTimeout() {
        return duration("distributed.rendezvousTimeout", Duration.ofMinutes(5));
    }

    private Duration duration(String path, Duration fallback) {
        return execution.hasPath(path) ? execution.getDuration(path) : fallback;
    }

    private Path rendezvousDirectory() {
        String configured = execution.hasPath("distributed.rendezvousDir")
            ? execution.getString("distributed.rendezvousDir")
            : "";
        return configured.isBlank()
            ? Path.of(System.getProperty("user.home"), ".prisma", "rendezvous")
            : Path.of(configured);
    }

    private String advertisedHost() {
        String configured = execution.hasPath("distributed.advertisedHost")
            ? execution.getString("distributed.advertisedHost")
            : "";
        if (!configured.isBlank()) {
            return configured;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name, advertising localhost: {}", e.getMessage());
            return "localhost";
        }
    }
}
