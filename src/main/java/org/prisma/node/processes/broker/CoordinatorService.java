package org.prisma.node.processes.broker;

import java.io.IOException;

import org.apache.activemq.artemis.jms.client.ActiveMQConnectionFactory;
import org.prisma.datapipeline.services.AbstractService;
import org.prisma.datapipeline.utils.JmsUtils;

import jakarta.jms.Connection;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.MessageConsumer;
import jakarta.jms.Session;

/**
 * Rank-0 loop of a distributed run.
 * <p>
 * Subscribes to the control topic, publishes the broker URL for the other ranks, then waits
 * for the submitter's shutdown message. On exit the URL is withdrawn and the broker stopped.
 */
public class CoordinatorService extends AbstractService {

    private final String localBrokerUrl;
    private final String advertisedUrl;
    private final String controlTopic;
    private final BrokerRendezvous rendezvous;
    private final long pollMillis;
    private volatile boolean published;

    /**
     * @param localBrokerUrl in-VM URL of the embedded broker.
     * @param advertisedUrl  URL other ranks should use.
     * @param controlTopic   control topic name.
     * @param rendezvous     where to publish {@code advertisedUrl}.
     * @param pollMillis     receive timeout between stop checks.
     */
    public CoordinatorService(String localBrokerUrl, String advertisedUrl, String controlTopic,
                              BrokerRendezvous rendezvous, long pollMillis) {
        super("coordinator", 10_000);
        this.localBrokerUrl = localBrokerUrl;
        this.advertisedUrl = advertisedUrl;
        this.controlTopic = controlTopic;
        this.rendezvous = rendezvous;
        this.pollMillis = pollMillis;
    }

    @Override
    protected void run() throws Exception {
        try (ActiveMQConnectionFactory factory = new ActiveMQConnectionFactory(localBrokerUrl);
             Connection connection = factory.createConnection()) {
            Session session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            MessageConsumer control = session.createConsumer(session.createTopic(controlTopic));
            connection.start();

            try {
                rendezvous.publish(advertisedUrl);
                published = true;
            } catch (IOException e) {
                log.warn("Cannot publish broker URL to {}: {}", rendezvous.file(), e.getMessage());
                recordError("RENDEZVOUS_FAILED", "Broker URL not published", e.getMessage());
                return;
            }

            while (!isStopRequested()) {
                Message message;
                try {
                    message = control.receive(pollMillis);
                } catch (JMSException e) {
                    if (JmsUtils.isInterrupted(e)) {
                        break;
                    }
                    throw e;
                }
                if (JmsUtils.isShutdownSignal(message)) {
                    log.info("Submitter finished, shutting down coordinator");
                    break;
                }
            }
        }
    }

    @Override
    protected void onTerminated() {
        rendezvous.withdraw();
        try {
            EmbeddedBrokerProcess.stopBroker();
        } catch (Exception e) {
            log.warn("Broker did not stop cleanly: {}", e.getMessage());
            log.debug("Exception details:", e);
        }
    }

    public boolean isPublished() {
        return published;
    }
}
