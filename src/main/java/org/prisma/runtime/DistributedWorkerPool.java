package org.prisma.runtime;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.activemq.artemis.jms.client.ActiveMQConnectionFactory;
import org.prisma.datapipeline.api.results.FailureKind;
import org.prisma.datapipeline.api.results.FrameOutcome;
import org.prisma.datapipeline.api.results.FrameTask;
import org.prisma.datapipeline.utils.FrameMessageCodec;
import org.prisma.datapipeline.utils.JmsUtils;
import org.prisma.node.processes.broker.EmbeddedBrokerProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
 * Worker pool backed by remote worker ranks reached through the coordinator's broker.
 * <p>
 * Tasks are sent to a shared queue that all workers consume from; a result listener matches
 * results to submissions by correlation id. A retry carries the id of the worker that failed
 * it, which that worker's message selector excludes, as long as more than one worker exists.
 * <p>
 * A task the broker gives up on after repeated redelivery lands in the dead-letter queue; the
 * pool consumes that queue and resolves the task as a {@link FailureKind#TRANSPORT} failure.
 * Worker ranks that stop abnormally announce it on the control topic. Once every rank has gone,
 * outstanding and new submissions fail the same way instead of waiting for a result.
 * <p>
 * Closing the pool broadcasts a shutdown message on the control topic, which ends the worker
 * ranks and the coordinator.
 * <p>
 * <b>Thread safety:</b> {@link #submit(FrameTask)} may be called from any thread; sends are
 * serialized on the producer session.
 */
public class DistributedWorkerPool implements IWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(DistributedWorkerPool.class);

    private final String brokerUrl;
    private final int workers;
    private final ActiveMQConnectionFactory connectionFactory;
    private final Connection connection;
    private final Session producerSession;
    private final MessageProducer taskProducer;
    private final MessageProducer controlProducer;
    private final Session resultSession;
    private final MessageConsumer resultConsumer;
    private final MessageConsumer deadLetterConsumer;
    private final Session controlSession;
    private final MessageConsumer controlConsumer;
    private final Map<String, CompletableFuture<FrameOutcome>> pending = new ConcurrentHashMap<>();
    private final Map<String, FrameTask> pendingTasks = new ConcurrentHashMap<>();
    private final Set<String> exitedWorkers = ConcurrentHashMap.newKeySet();

    /**
     * @param brokerUrl           broker to connect to.
     * @param workers             number of worker ranks.
     * @param distributedOptions  the {@code prisma.execution.distributed} block (queue names).
     * @throws JMSException if the broker cannot be reached.
     */
    public DistributedWorkerPool(String brokerUrl, int workers, Config distributedOptions) throws JMSException {
        this.brokerUrl = brokerUrl;
        this.workers = workers;
        String taskQueue = option(distributedOptions, "taskQueue", "prisma.frames.tasks");
        String resultQueue = option(distributedOptions, "resultQueue", "prisma.frames.results");
        String controlTopic = option(distributedOptions, "controlTopic", "prisma.control");
        String deadLetterQueue = option(distributedOptions, "deadLetterQueue",
            EmbeddedBrokerProcess.DEAD_LETTER_ADDRESS);

        this.connectionFactory = new ActiveMQConnectionFactory(brokerUrl);
        this.connection = connectionFactory.createConnection();
        try {
            this.producerSession = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            this.taskProducer = producerSession.createProducer(producerSession.createQueue(taskQueue));
            this.controlProducer = producerSession.createProducer(producerSession.createTopic(controlTopic));
            this.resultSession = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            this.resultConsumer = resultSession.createConsumer(resultSession.createQueue(resultQueue));
            this.resultConsumer.setMessageListener(this::onResult);
            this.deadLetterConsumer = resultSession.createConsumer(resultSession.createQueue(deadLetterQueue));
            this.deadLetterConsumer.setMessageListener(this::onDeadLetter);
            this.controlSession = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            this.controlConsumer = controlSession.createConsumer(controlSession.createTopic(controlTopic));
            this.controlConsumer.setMessageListener(this::onControl);
            connection.start();
        } catch (JMSException e) {
            closeQuietly();
            throw e;
        }
        log.info("Connected to broker {} with {} worker ranks", brokerUrl, workers);
    }

    private static String option(Config options, String path, String fallback) {
        return options != null && options.hasPath(path) ? options.getString(path) : fallback;
    }

    @Override
    public CompletableFuture<FrameOutcome> submit(FrameTask task) {
        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<FrameOutcome> future = new CompletableFuture<>();
        pending.put(correlationId, future);
        pendingTasks.put(correlationId, task);
        if (!hasLiveWorkers()) {
            complete(correlationId, FrameOutcome.failure(task, "submitter", FailureKind.TRANSPORT,
                "no worker ranks left"));
            return future;
        }
        try {
            synchronized (producerSession) {
                TextMessage message = producerSession.createTextMessage(FrameMessageCodec.encodeTask(task));
                message.setJMSCorrelationID(correlationId);
                if (task.avoidWorker() != null && workers > 1) {
                    message.setStringProperty(FrameMessageCodec.AVOID_WORKER, task.avoidWorker());
                }
                taskProducer.send(message);
            }
        } catch (JMSException e) {
            log.warn("Could not send task for frame {}: {}", task.frame().globalIndex(), e.getMessage());
            complete(correlationId, FrameOutcome.failure(task, "submitter", FailureKind.TRANSPORT,
                "send failed: " + e.getMessage()));
        }
        return future;
    }

    private void onResult(Message message) {
        try {
            String correlationId = message.getJMSCorrelationID();
            if (!(message instanceof BytesMessage bytes)) {
                log.warn("Ignoring unexpected result message type {}", message.getClass().getSimpleName());
                return;
            }
            FrameOutcome outcome = FrameMessageCodec.readOutcome(bytes);
            if (!complete(correlationId, outcome)) {
                log.debug("Dropping result for unknown submission {} (frame {})", correlationId,
                    outcome.globalIndex());
            }
        } catch (JMSException | RuntimeException e) {
            log.warn("Cannot read result message: {}", e.getMessage());
            log.debug("Exception details:", e);
        }
    }

    private void onDeadLetter(Message message) {
        try {
            String correlationId = message.getJMSCorrelationID();
            FrameTask task = correlationId == null ? null : pendingTasks.get(correlationId);
            if (task == null) {
                log.debug("Ignoring dead-lettered message {} of no pending submission", message.getJMSMessageID());
                return;
            }
            log.warn("Frame {} was dead-lettered after repeated redelivery", task.frame().globalIndex());
            complete(correlationId, FrameOutcome.failure(task, "broker", FailureKind.TRANSPORT,
                "task dead-lettered after repeated redelivery"));
        } catch (JMSException e) {
            log.warn("Cannot read dead-lettered message: {}", e.getMessage());
        }
    }

    private void onControl(Message message) {
        try {
            if (!JmsUtils.isWorkerExit(message)) {
                return;
            }
            String worker = message.getStringProperty(FrameMessageCodec.WORKER);
            if (exitedWorkers.add(worker)) {
                log.warn("Worker {} stopped consuming tasks ({} of {} ranks gone)", worker, exitedWorkers.size(),
                    workers);
            }
            if (!hasLiveWorkers()) {
                failOutstanding("no worker ranks left");
            }
        } catch (JMSException e) {
            log.warn("Cannot read control message: {}", e.getMessage());
        }
    }

    private boolean hasLiveWorkers() {
        return exitedWorkers.size() < workers;
    }

    private void failOutstanding(String reason) {
        for (String correlationId : pending.keySet()) {
            FrameTask task = pendingTasks.get(correlationId);
            if (task != null) {
                complete(correlationId, FrameOutcome.failure(task, "submitter", FailureKind.TRANSPORT, reason));
            }
        }
    }

    private boolean complete(String correlationId, FrameOutcome outcome) {
        CompletableFuture<FrameOutcome> future = correlationId == null ? null : pending.remove(correlationId);
        if (future == null) {
            return false;
        }
        pendingTasks.remove(correlationId);
        return future.complete(outcome);
    }

    @Override
    public int workerCount() {
        return workers;
    }

    @Override
    public String describe() {
        return "distributed (" + workers + " worker ranks via " + brokerUrl + ")";
    }

    /**
     * Broadcasts shutdown, fails outstanding submissions with TRANSPORT and disconnects.
     */
    @Override
    public void close() {
        try {
            synchronized (producerSession) {
                Message shutdown = producerSession.createMessage();
                shutdown.setStringProperty(FrameMessageCodec.CONTROL_TYPE, FrameMessageCodec.SHUTDOWN);
                controlProducer.send(shutdown);
            }
            log.info("Shutdown broadcast to worker ranks");
        } catch (JMSException e) {
            log.warn("Could not broadcast shutdown: {}", e.getMessage());
        }
        failOutstanding("worker pool closed");
        closeQuietly();
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (JMSException e) {
            log.debug("Error closing broker connection: {}", e.getMessage());
        }
        connectionFactory.close();
    }
}
