package org.prisma.datapipeline.utils;

import jakarta.jms.JMSException;
import jakarta.jms.Message;

/**
 * Helpers shared by the coordinator, worker and submitter ranks.
 */
public final class JmsUtils {

    private JmsUtils() {}

    /**
     * Artemis reports an interrupted blocking receive as a {@code JMSException} whose cause chain
     * holds the {@link InterruptedException}.
     *
     * @param failure the exception thrown by a JMS call.
     * @return {@code true} if the call ended because the thread was interrupted.
     */
    public static boolean isInterrupted(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param message a message from the control topic, or {@code null} after a receive timeout.
     * @return {@code true} if it tells every rank to shut down.
     * @throws JMSException if the message properties cannot be read.
     */
    public static boolean isShutdownSignal(Message message) throws JMSException {
        return message != null
            && FrameMessageCodec.SHUTDOWN.equals(message.getStringProperty(FrameMessageCodec.CONTROL_TYPE));
    }

    /**
     * @param message a message from the control topic.
     * @return {@code true} if a worker rank announces that it stopped consuming tasks.
     * @throws JMSException if the message properties cannot be read.
     */
    public static boolean isWorkerExit(Message message) throws JMSException {
        return message != null
            && FrameMessageCodec.WORKER_EXIT.equals(message.getStringProperty(FrameMessageCodec.CONTROL_TYPE));
    }
}
