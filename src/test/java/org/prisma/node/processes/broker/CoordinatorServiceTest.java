package org.prisma.node.processes.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.prisma.datapipeline.api.services.IService;
import org.prisma.runtime.DistributedWorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.ConfigFactory;

@Tag("integration")
class CoordinatorServiceTest {

    private static final String ADVERTISED = "tcp://node00:61616";

    @TempDir
    Path tempDir;

    private CoordinatorService coordinator;

    @AfterEach
    void tearDown() throws Exception {
        if (coordinator != null) {
            coordinator.stop();
        }
        EmbeddedBrokerProcess.resetForTesting();
    }

    private BrokerRendezvous rendezvous(Path directory) {
        return new BrokerRendezvous(directory, "4711", Duration.ofSeconds(1), Duration.ofMillis(20));
    }

    @Test
    void publishesUrlAndShutsDownWithTheSubmitter() throws Exception {
        EmbeddedBrokerProcess.ensureStarted(ConfigFactory.parseString("serverId = 0"));
        BrokerRendezvous rendezvous = rendezvous(tempDir);
        coordinator = new CoordinatorService("vm://0", ADVERTISED, "prisma.control", rendezvous, 100);

        coordinator.start();

        await().atMost(Duration.ofSeconds(10)).until(coordinator::isPublished);
        assertThat(rendezvous(tempDir).await()).contains(ADVERTISED);

        new DistributedWorkerPool("vm://0", 1, ConfigFactory.empty()).close();

        await().atMost(Duration.ofSeconds(10))
            .until(() -> coordinator.getCurrentState() == IService.State.STOPPED && !EmbeddedBrokerProcess.isBrokerStarted());
        assertThat(rendezvous.file()).doesNotExist();
        assertThat(coordinator.isHealthy()).isTrue();
    }

    @Test
    void unwritableRendezvousEndsTheCoordinator() throws Exception {
        EmbeddedBrokerProcess.ensureStarted(ConfigFactory.parseString("serverId = 0"));
        Path blocker = Files.writeString(tempDir.resolve("not-a-directory"), "");
        coordinator = new CoordinatorService("vm://0", ADVERTISED, "prisma.control", rendezvous(blocker), 100);

        coordinator.start();

        await().atMost(Duration.ofSeconds(10)).until(() -> coordinator.getCurrentState() == IService.State.STOPPED);
        assertThat(coordinator.isPublished()).isFalse();
        assertThat(coordinator.getErrors()).extracting(e -> e.code()).containsExactly("RENDEZVOUS_FAILED");
        assertThat(EmbeddedBrokerProcess.isBrokerStarted()).isFalse();
    }

    @Test
    void brokerStartIsIdempotent() {
        EmbeddedBrokerProcess.ensureStarted(ConfigFactory.parseString("serverId = 0"));
        EmbeddedBrokerProcess.ensureStarted(ConfigFactory.parseString("serverId = 0"));

        assertThat(EmbeddedBrokerProcess.isBrokerStarted()).isTrue();
        assertThat(EmbeddedBrokerProcess.getServer()).isNotNull();
        assertThat(EmbeddedBrokerProcess.inVmUrl(ConfigFactory.parseString("serverId = 7"))).isEqualTo("vm://7");
    }
}
