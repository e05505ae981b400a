package org.prisma.datapipeline.services;

import java.nio.channels.ClosedByInterruptException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.prisma.datapipeline.api.services.IService;
import org.prisma.datapipeline.api.services.OperationalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for services that run a loop on a dedicated thread.
 * <p>
 * Subclasses implement {@link #run()} and check {@link #isStopRequested()} between units of
 * work. Transient problems are logged at WARN and tracked with
 * {@link #recordError(String, String, String)}; an exception escaping {@code run()} moves the
 * service to ERROR.
 */
public abstract class AbstractService implements IService {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;

    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final long shutdownTimeoutMillis;
    private Thread serviceThread;

    /**
     * @param name                  service name, also the thread name.
     * @param shutdownTimeoutMillis how long {@link #stop()} waits for the thread to end.
     */
    protected AbstractService(String name, long shutdownTimeoutMillis) {
        this.serviceName = name;
        this.shutdownTimeoutMillis = shutdownTimeoutMillis;
    }

    /**
     * Maximum number of errors kept; older ones are dropped.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s",
                serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        stopRequested.set(true);
        Thread thread = serviceThread;
        if (thread == null || !thread.isAlive()) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(shutdownTimeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for service shutdown", this.getClass().getSimpleName());
        }
        if (thread.isAlive()) {
            log.error("{} thread did not stop within {} ms! Forcing ERROR state.", this.getClass().getSimpleName(),
                shutdownTimeoutMillis);
            currentState.set(State.ERROR);
        }
    }

    /**
     * Blocks until the service thread has ended.
     *
     * @throws InterruptedException if interrupted while waiting.
     */
    public void awaitTermination() throws InterruptedException {
        Thread thread = serviceThread;
        if (thread != null) {
            thread.join();
        }
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (isStopRequested() && isInterruptInduced(e)) {
                log.debug("Service thread interrupted during shutdown.");
            } else {
                log.error("{} stopped with ERROR due to {}", this.getClass().getSimpleName(),
                    e.getClass().getSimpleName());
                log.debug("Exception details:", e);
                currentState.set(State.ERROR);
            }
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            onTerminated();
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    private static boolean isInterruptInduced(Throwable t) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException
                    || current instanceof ClosedByInterruptException) {
                return true;
            }
        }
        return false;
    }

    /**
     * The service loop. Runs on the service thread until it returns or throws.
     *
     * @throws Exception on fatal errors; the service moves to ERROR.
     */
    protected abstract void run() throws Exception;

    /**
     * Called on the service thread after {@link #run()} has ended, for releasing resources.
     */
    protected void onTerminated() {
    }

    /**
     * Asks the loop to end after the current unit of work.
     */
    protected void requestStop() {
        stopRequested.set(true);
    }

    protected boolean isStopRequested() {
        return stopRequested.get() || Thread.currentThread().isInterrupted();
    }

    /**
     * Records a transient error. Use only for problems the service continues after.
     *
     * @param code    error category.
     * @param message human-readable message.
     * @param details additional context.
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public boolean isHealthy() {
        return getCurrentState() != State.ERROR && errors.isEmpty();
    }
}
