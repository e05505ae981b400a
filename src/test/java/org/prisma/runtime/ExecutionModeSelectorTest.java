package org.prisma.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.prisma.node.processes.broker.BrokerRendezvous;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class ExecutionModeSelectorTest {

    @TempDir
    Path rendezvousDir;

    private Config config(String mode) {
        return ConfigFactory.parseString("prisma.execution { mode = " + mode + ", localWorkers = 3\n"
            + "distributed { rendezvousDir = \"" + rendezvousDir.toString().replace("\\", "\\\\") + "\"\n"
            + "rendezvousTimeout = 200ms, pollInterval = 20ms } }");
    }

    private static Map<String, String> launch(String rank, String size) {
        Map<String, String> env = new HashMap<>();
        if (rank != null) {
            env.put("PMI_RANK", rank);
        }
        if (size != null) {
            env.put("PMI_SIZE", size);
        }
        env.put("PBS_JOBID", "4711.pbs server");
        return env;
    }

    @Test
    void localWithoutLaunchContext() {
        ExecutionContext context = new ExecutionModeSelector(config("auto"), Map.of()).select(null);

        assertThat(context.mode()).isEqualTo(ExecutionMode.LOCAL);
        assertThat(context.role()).isEqualTo(RankRole.SUBMITTER);
        assertThat(context.workers()).isEqualTo(3);
        assertThat(context.fallbackReason()).isNull();
        assertThat(context.isIdle()).isFalse();
    }

    @Test
    void explicitLocalIgnoresLaunchContext() {
        ExecutionContext context = new ExecutionModeSelector(config("auto"), launch("2", "4"))
            .select(ExecutionMode.LOCAL);

        assertThat(context.mode()).isEqualTo(ExecutionMode.LOCAL);
        assertThat(context.role()).isEqualTo(RankRole.SUBMITTER);
    }

    @Test
    void commandLineOverridesConfiguredMode() {
        ExecutionContext context = new ExecutionModeSelector(config("distributed"), launch("1", "3"))
            .select(ExecutionMode.LOCAL);

        assertThat(context.isDistributed()).isFalse();
        assertThat(context.fallbackReason()).isNull();
    }

    @Test
    void distributedRequestWithoutLaunchContextFallsBack() {
        ExecutionContext context = new ExecutionModeSelector(config("distributed"), Map.of()).select(null);

        assertThat(context.mode()).isEqualTo(ExecutionMode.LOCAL);
        assertThat(context.role()).isEqualTo(RankRole.SUBMITTER);
        assertThat(context.fallbackReason()).contains("no multi-node launch context");
    }

    @Test
    void tooFewRanksLeaveTheRunToRankZero() {
        ExecutionContext rankZero = new ExecutionModeSelector(config("auto"), launch("0", "2")).select(null);
        ExecutionContext rankOne = new ExecutionModeSelector(config("auto"), launch("1", "2")).select(null);

        assertThat(rankZero.mode()).isEqualTo(ExecutionMode.LOCAL);
        assertThat(rankZero.role()).isEqualTo(RankRole.SUBMITTER);
        assertThat(rankZero.fallbackReason()).contains("at least 3 ranks");
        assertThat(rankOne.isIdle()).isTrue();
        assertThat(rankOne.rank()).isEqualTo(1);
    }

    @Test
    void malformedContextFallsBack() {
        ExecutionContext badRank = new ExecutionModeSelector(config("auto"), launch("first", "4")).select(null);
        ExecutionContext badSize = new ExecutionModeSelector(config("auto"), launch("2", "many")).select(null);
        ExecutionContext outside = new ExecutionModeSelector(config("auto"), launch("5", "3")).select(null);

        assertThat(badRank.mode()).isEqualTo(ExecutionMode.LOCAL);
        assertThat(badRank.fallbackReason()).contains("malformed launch context");
        assertThat(badSize.isIdle()).isTrue();
        assertThat(outside.isIdle()).isTrue();
        assertThat(outside.fallbackReason()).contains("outside launch of size 3");
    }

    @Test
    void missingBrokerUrlTimesOut() {
        ExecutionContext submitter = new ExecutionModeSelector(config("auto"), launch("1", "3")).select(null);
        ExecutionContext worker = new ExecutionModeSelector(config("auto"), launch("2", "3")).select(null);

        assertThat(submitter.mode()).isEqualTo(ExecutionMode.LOCAL);
        assertThat(submitter.role()).isEqualTo(RankRole.SUBMITTER);
        assertThat(submitter.fallbackReason()).contains("no broker URL");
        assertThat(worker.isIdle()).isTrue();
        assertThat(worker.role()).isEqualTo(RankRole.WORKER);
    }

    @Test
    void ranksJoinThroughPublishedUrl() throws Exception {
        ExecutionModeSelector selector = new ExecutionModeSelector(config("auto"), launch("3", "5"));
        BrokerRendezvous rendezvous = selector.rendezvous(selector.jobKey());
        rendezvous.publish("tcp://node01:61616");

        ExecutionContext context = selector.select(null);

        assertThat(selector.jobKey()).isEqualTo("4711.pbs_server");
        assertThat(rendezvous.file()).isEqualTo(rendezvousDir.resolve("broker-4711.pbs_server.url"));
        assertThat(context.mode()).isEqualTo(ExecutionMode.DISTRIBUTED);
        assertThat(context.role()).isEqualTo(RankRole.WORKER);
        assertThat(context.brokerUrl()).isEqualTo("tcp://node01:61616");
        assertThat(context.workers()).isEqualTo(3);
        assertThat(context.workerId()).isEqualTo("rank-3");
    }

    @Test
    void rendezvousWithdrawRemovesUrl() throws Exception {
        BrokerRendezvous rendezvous = new BrokerRendezvous(rendezvousDir, "job", Duration.ofMillis(50),
            Duration.ofMillis(10));
        rendezvous.publish("tcp://node01:61616");
        assertThat(Files.readString(rendezvous.file())).isEqualTo("tcp://node01:61616");

        rendezvous.withdraw();

        assertThat(rendezvous.await()).isEmpty();
    }
}
