package org.prisma.node.processes.worker;

import org.apache.activemq.artemis.jms.client.ActiveMQConnectionFactory;
import org.prisma.datapipeline.api.results.FailureKind;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameTask;
import org.prisma.datapipeline.services.AbstractService;
import org.prisma.datapipeline.services.FrameWorker;
import org.prisma.datapipeline.utils.FrameMessageCodec;
import org.prisma.datapipeline.utils.JmsUtils;

import com.typesafe.config.Config;

import jakarta.jms.BytesMessage;
import jakarta.jms.Connection;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.MessageConsumer;
import jakarta.jms.MessageProducer;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;

/**
 * Worker-rank loop: takes frame tasks from the broker, processes them, returns the outcomes.
 * <p>
 * Receiving a task and sending its outcome happen in one transacted session, so a task whose
 * worker dies before committing is redelivered to another worker. Retried tasks that name this
 * worker in {@code avoidWorker} are never delivered here.
 * <p>
 * The loop ends on a shutdown message from the control topic, when the broker connection is
 * lost, or when the service is stopped. A loop ending on an error announces the exit on the
 * control topic so the submitter stops counting on this worker.
 */
public class FrameWorkerService extends AbstractService {

    private final String workerId;
    private final String brokerUrl;
    private final FrameWorker worker;
    private final String taskQueue;
    private final String resultQueue;
    private final String controlTopic;
    private final long pollMillis;

    private volatile long processed;

    /**
     * @param workerId           identifier of this worker, e.g. {@code rank-3}.
     * @param brokerUrl          broker to connect to.
     * @param worker             frame worker for the job.
     * @param distributedOptions the {@code prisma.execution.distributed} block.
     */
    public FrameWorkerService(String workerId, String brokerUrl, FrameWorker worker, Config distributedOptions) {
        super("frame-worker-" + workerId, 10_000);
        this.workerId = workerId;
        this.brokerUrl = brokerUrl;
        this.worker = worker;
        this.taskQueue = distributedOptions.hasPath("taskQueue")
            ? distributedOptions.getString("taskQueue") : "prisma.frames.tasks";
        this.resultQueue = distributedOptions.hasPath("resultQueue")
            ? distributedOptions.getString("resultQueue") : "prisma.frames.results";
        this.controlTopic = distributedOptions.hasPath("controlTopic")
            ? distributedOptions.getString("controlTopic") : "prisma.control";
        this.pollMillis = distributedOptions.hasPath("pollInterval")
            ? distributedOptions.getDuration("pollInterval").toMillis() : 1000L;
    }

    static String selectorFor(String workerId) {
        return FrameMessageCodec.AVOID_WORKER + " IS NULL OR " + FrameMessageCodec.AVOID_WORKER + " <> '"
            + workerId.replace("'", "''") + "'";
    }

    @Override
    protected void run() throws Exception {
        try (ActiveMQConnectionFactory factory = new ActiveMQConnectionFactory(brokerUrl);
             Connection connection = factory.createConnection()) {
            connection.setExceptionListener(e -> {
                log.warn("Worker {} lost its broker connection: {}", workerId, e.getMessage());
                requestStop();
            });

            Session controlSession = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            MessageConsumer control = controlSession.createConsumer(controlSession.createTopic(controlTopic));
            control.setMessageListener(this::onControl);

            Session session = connection.createSession(true, Session.SESSION_TRANSACTED);
            MessageConsumer tasks = session.createConsumer(session.createQueue(taskQueue), selectorFor(workerId));
            MessageProducer results = session.createProducer(session.createQueue(resultQueue));
            connection.start();
            log.info("Worker {} consuming from {}", workerId, taskQueue);

            try {
                consume(session, tasks, results);
            } catch (JMSException | RuntimeException e) {
                announceExit(connection, e);
                throw e;
            }
        }
        log.info("Worker {} stopped after {} tasks", workerId, processed);
    }

    private void consume(Session session, MessageConsumer tasks, MessageProducer results) throws JMSException {
        while (!isStopRequested()) {
            Message message;
            try {
                message = tasks.receive(pollMillis);
            } catch (JMSException e) {
                if (JmsUtils.isInterrupted(e) || isStopRequested()) {
                    return;
                }
                throw e;
            }
            if (message == null) {
                continue;
            }
            handle(session, results, message);
        }
    }

    private void announceExit(Connection connection, Exception cause) {
        try {
            Session session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            try {
                Message notice = session.createMessage();
                notice.setStringProperty(FrameMessageCodec.CONTROL_TYPE, FrameMessageCodec.WORKER_EXIT);
                notice.setStringProperty(FrameMessageCodec.WORKER, workerId);
                session.createProducer(session.createTopic(controlTopic)).send(notice);
            } finally {
                session.close();
            }
        } catch (JMSException e) {
            log.warn("Worker {} could not announce its exit after {}: {}", workerId, cause, e.getMessage());
        }
    }

    private void handle(Session session, MessageProducer results, Message message) throws JMSException {
        FrameTask task;
        try {
            task = FrameMessageCodec.decodeTask(((TextMessage) message).getText());
        } catch (ClassCastException | IllegalArgumentException e) {
            log.warn("Worker {} dropping malformed task message: {}", workerId, e.getMessage());
            recordError("MALFORMED_TASK", "Task message could not be decoded", e.getMessage());
            session.commit();
            return;
        }

        FrameOutcome outcome = worker.process(task, workerId);
        if (!outcome.isSuccess() && outcome.failure().kind() != FailureKind.DECODE) {
            recordError("FRAME_FAILED", "Frame " + task.frame().globalIndex() + " failed",
                outcome.failure().toString());
        }
        BytesMessage reply = session.createBytesMessage();
        FrameMessageCodec.writeOutcome(reply, outcome);
        reply.setJMSCorrelationID(message.getJMSCorrelationID());
        results.send(reply);
        session.commit();
        processed++;
    }

    private void onControl(Message message) {
        try {
            if (JmsUtils.isShutdownSignal(message)) {
                log.info("Worker {} received shutdown", workerId);
                requestStop();
            }
        } catch (JMSException e) {
            log.warn("Worker {} cannot read control message: {}", workerId, e.getMessage());
        }
    }

    public long processedCount() {
        return processed;
    }
}
