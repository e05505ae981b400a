package org.prisma.datapipeline.api.services;

import java.util.List;

/**
 * Long-running component with its own thread.
 */
public interface IService {

    enum State {
        STOPPED,
        RUNNING,
        ERROR
    }

    void start();

    void stop();

    State getCurrentState();

    /**
     * @return transient errors recorded since start, oldest first.
     */
    List<OperationalError> getErrors();

    /**
     * @return true if the service is not in ERROR and has recorded no errors.
     */
    boolean isHealthy();
}
