package org.prisma.node.processes.broker;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.Map;

import org.apache.activemq.artemis.core.config.Configuration;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class EmbeddedBrokerProcessTest {

    @TempDir
    Path tempDir;

    @Test
    void inVmOnlyWithoutPort() throws Exception {
        Configuration configuration = EmbeddedBrokerProcess.buildConfiguration(ConfigFactory.parseMap(Map.of(
            "serverId", 4)));

        assertThat(configuration.getAcceptorConfigurations()).hasSize(1);
        assertThat(configuration.isPersistenceEnabled()).isFalse();
        assertThat(configuration.isSecurityEnabled()).isFalse();
        assertThat(EmbeddedBrokerProcess.inVmUrl(ConfigFactory.parseMap(Map.of("serverId", 4)))).isEqualTo("vm://4");
    }

    @Test
    void tcpAcceptorAndJournalWhenConfigured() throws Exception {
        Path data = tempDir.resolve("broker");
        Configuration configuration = EmbeddedBrokerProcess.buildConfiguration(ConfigFactory.parseMap(Map.of(
            "port", 61999,
            "persistenceEnabled", true,
            "dataDirectory", data.toString())));

        assertThat(configuration.getAcceptorConfigurations()).hasSize(2);
        assertThat(configuration.isPersistenceEnabled()).isTrue();
        assertThat(configuration.getJournalDirectory()).isEqualTo(data.resolve("journal").toString());
        assertThat(data).isDirectory();
    }
}
