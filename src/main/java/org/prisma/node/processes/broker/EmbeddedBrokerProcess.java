package org.prisma.node.processes.broker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.activemq.artemis.api.core.SimpleString;
import org.apache.activemq.artemis.api.core.TransportConfiguration;
import org.apache.activemq.artemis.core.config.Configuration;
import org.apache.activemq.artemis.core.config.impl.ConfigurationImpl;
import org.apache.activemq.artemis.core.remoting.impl.invm.InVMAcceptorFactory;
import org.apache.activemq.artemis.core.remoting.impl.invm.TransportConstants;
import org.apache.activemq.artemis.core.server.ActiveMQServer;
import org.apache.activemq.artemis.core.server.embedded.EmbeddedActiveMQ;
import org.apache.activemq.artemis.core.settings.impl.AddressFullMessagePolicy;
import org.apache.activemq.artemis.core.settings.impl.AddressSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import ch.qos.logback.classic.Level;

/**
 * Lifecycle of the embedded ActiveMQ Artemis broker hosted by the coordinating rank.
 * <p>
 * The broker always accepts in-VM connections ({@code vm://{serverId}}). When {@code port} is
 * set it also opens a Netty TCP acceptor, which is how submitter and worker ranks on other
 * nodes reach it.
 * <p>
 * Only one broker runs per JVM. Tests call {@link #ensureStarted(Config)} directly and
 * {@link #resetForTesting()} afterwards.
 * <p>
 * <strong>Configuration</strong> (the {@code prisma.broker} block, flat keys):
 * <pre>
 * serverId = 0
 * port = 61616              # 0 or absent: in-VM only
 * persistenceEnabled = false
 * dataDirectory = ""        # empty: {tmpdir}/prisma-broker
 * maxDiskUsage = -1
 * addressSettings { redeliveryDelayMs = 0, maxDeliveryAttempts = 5 }
 * </pre>
 * <p>
 * <b>Thread safety:</b> start and stop are serialized on {@code brokerLock}; status reads are
 * lock-free.
 */
public final class EmbeddedBrokerProcess {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedBrokerProcess.class);

    /** Address receiving messages that exceeded the maximum delivery attempts. */
    public static final String DEAD_LETTER_ADDRESS = "DLQ";

    private static EmbeddedActiveMQ embeddedBroker;
    private static final AtomicBoolean brokerStarted = new AtomicBoolean(false);
    private static final Object brokerLock = new Object();

    private EmbeddedBrokerProcess() {
    }

    public static boolean isBrokerStarted() {
        return brokerStarted.get();
    }

    /**
     * @return the running server, or null if the broker is not started.
     */
    public static ActiveMQServer getServer() {
        synchronized (brokerLock) {
            if (embeddedBroker != null && brokerStarted.get()) {
                return embeddedBroker.getActiveMQServer();
            }
            return null;
        }
    }

    /**
     * @param config broker configuration.
     * @return the in-VM URL of the broker configured by {@code config}.
     */
    public static String inVmUrl(Config config) {
        return "vm://" + serverId(config);
    }

    // =========================================================================
    // Broker startup / shutdown
    // =========================================================================

    /**
     * Starts the embedded broker. Idempotent: returns immediately if it is already running.
     *
     * @param config broker configuration (flat keys).
     * @throws IllegalStateException if the broker cannot be started.
     */
    public static void ensureStarted(Config config) {
        synchronized (brokerLock) {
            if (brokerStarted.get()) {
                return;
            }

            try {
                configureLogging();
                Configuration configuration = buildConfiguration(config);
                log.info("Starting embedded Artemis broker (server {}, {})", serverId(config),
                    tcpPort(config) > 0 ? "tcp port " + tcpPort(config) : "in-VM only");

                embeddedBroker = new EmbeddedActiveMQ();
                embeddedBroker.setConfiguration(configuration);
                embeddedBroker.start();
                brokerStarted.set(true);
                log.info("Embedded Artemis broker started");
            } catch (Exception e) {
                embeddedBroker = null;
                log.error("Failed to start embedded Artemis broker: {}", e.getMessage());
                throw new IllegalStateException("Failed to start embedded Artemis broker", e);
            }
        }
    }

    /**
     * Stops the broker. No-op if it is not running.
     *
     * @throws Exception if shutdown fails.
     */
    public static void stopBroker() throws Exception {
        synchronized (brokerLock) {
            if (embeddedBroker != null) {
                try {
                    embeddedBroker.stop();
                    log.info("Embedded Artemis broker stopped");
                } finally {
                    embeddedBroker = null;
                    brokerStarted.set(false);
                }
            }
        }
    }

    /**
     * Stops the broker between test classes. Not for production use.
     *
     * @throws Exception if shutdown fails.
     */
    public static void resetForTesting() throws Exception {
        stopBroker();
    }

    // =========================================================================
    // Configuration helpers
    // =========================================================================

    private static int serverId(Config config) {
        return config.hasPath("serverId") ? config.getInt("serverId") : 0;
    }

    private static int tcpPort(Config config) {
        return config.hasPath("port") ? config.getInt("port") : 0;
    }

    /**
     * Translates the {@code prisma.broker} block into an Artemis configuration. Every address
     * pages to disk instead of blocking producers when memory runs out.
     */
    static Configuration buildConfiguration(Config config) throws Exception {
        Configuration configuration = new ConfigurationImpl()
            .setSecurityEnabled(false)
            .setJMXManagementEnabled(false);

        configuration.addAcceptorConfiguration(new TransportConfiguration(InVMAcceptorFactory.class.getName(),
            Map.of(TransportConstants.SERVER_ID_PROP_NAME, serverId(config))));
        int port = tcpPort(config);
        if (port > 0) {
            configuration.addAcceptorConfiguration("netty", "tcp://0.0.0.0:" + port);
        }

        boolean persistent = config.hasPath("persistenceEnabled") && config.getBoolean("persistenceEnabled");
        configuration.setPersistenceEnabled(persistent);
        if (persistent) {
            Path dataDirectory = dataDirectory(config);
            try {
                Files.createDirectories(dataDirectory);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot create broker data directory " + dataDirectory, e);
            }
            if (!Files.isWritable(dataDirectory)) {
                throw new IllegalStateException("Broker data directory is not writable: " + dataDirectory);
            }
            configuration.setJournalDirectory(dataDirectory.resolve("journal").toString())
                .setBindingsDirectory(dataDirectory.resolve("bindings").toString())
                .setLargeMessagesDirectory(dataDirectory.resolve("largemessages").toString())
                .setPagingDirectory(dataDirectory.resolve("paging").toString());
        }

        configuration.setMaxDiskUsage(config.hasPath("maxDiskUsage") ? config.getInt("maxDiskUsage") : -1);

        Config delivery = config.hasPath("addressSettings") ? config.getConfig("addressSettings") : null;
        long redeliveryDelay = delivery != null && delivery.hasPath("redeliveryDelayMs")
            ? delivery.getLong("redeliveryDelayMs") : 0L;
        int maxAttempts = delivery != null && delivery.hasPath("maxDeliveryAttempts")
            ? delivery.getInt("maxDeliveryAttempts") : 5;
        configuration.addAddressSetting("#", new AddressSettings()
            .setRedeliveryDelay(redeliveryDelay)
            .setMaxDeliveryAttempts(maxAttempts)
            .setAddressFullMessagePolicy(AddressFullMessagePolicy.PAGE)
            .setDeadLetterAddress(SimpleString.of(DEAD_LETTER_ADDRESS))
            .setExpiryAddress(SimpleString.of("ExpiryQueue")));
        log.debug("Broker delivery: redeliveryDelay={}ms, maxAttempts={}, persistent={}", redeliveryDelay, maxAttempts,
            persistent);
        return configuration;
    }

    private static Path dataDirectory(Config config) {
        String configured = config.hasPath("dataDirectory") ? config.getString("dataDirectory") : "";
        return configured.isBlank() ? Path.of(System.getProperty("java.io.tmpdir"), "prisma-broker") : Path.of(configured);
    }

    /**
     * Quietens Artemis loggers unless the logging configuration sets them explicitly.
     */
    static void configureLogging() {
        quieten("org.apache.activemq.artemis", Level.WARN);
        quieten("org.apache.activemq.artemis.core.server", Level.OFF);
        quieten("org.apache.activemq.audit.base", Level.OFF);
        quieten("org.apache.activemq.audit.message", Level.OFF);
        quieten("org.apache.activemq.audit.resource", Level.OFF);
    }

    private static void quieten(String name, Level level) {
        if (LoggerFactory.getLogger(name) instanceof ch.qos.logback.classic.Logger logger && logger.getLevel() == null) {
            logger.setLevel(level);
        }
    }
}
