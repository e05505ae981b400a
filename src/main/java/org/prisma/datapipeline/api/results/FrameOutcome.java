package org.prisma.datapipeline.api.results;

/**
 * What a worker reports for one task: a result or a frame-level failure, always tagged with
 * the frame's position in the requested sequence.
 */
public final class FrameOutcome {

    private final int position;
    private final int globalIndex;
    private final int attempt;
    private final String workerId;
    private final FrameResult result;
    private final FrameFailure failure;

    private FrameOutcome(int position, int globalIndex, int attempt, String workerId, FrameResult result,
                         FrameFailure failure) {
        this.position = position;
        this.globalIndex = globalIndex;
        this.attempt = attempt;
        this.workerId = workerId;
        this.result = result;
        this.failure = failure;
    }

    public static FrameOutcome success(FrameTask task, String workerId, FrameResult result) {
        return new FrameOutcome(task.position(), task.frame().globalIndex(), task.attempt(), workerId, result, null);
    }

    public static FrameOutcome failure(FrameTask task, String workerId, FailureKind kind, String message) {
        return new FrameOutcome(task.position(), task.frame().globalIndex(), task.attempt(), workerId, null,
            new FrameFailure(kind, message));
    }

    /**
     * Rebuilds an outcome received from a remote worker.
     */
    public static FrameOutcome of(int position, int globalIndex, int attempt, String workerId, FrameResult result,
                                  FrameFailure failure) {
        if ((result == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of result and failure must be present");
        }
        return new FrameOutcome(position, globalIndex, attempt, workerId, result, failure);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public int position() {
        return position;
    }

    public int globalIndex() {
        return globalIndex;
    }

    public int attempt() {
        return attempt;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * @return the result.
     * @throws IllegalStateException if this outcome is a failure.
     */
    public FrameResult result() {
        if (result == null) {
            throw new IllegalStateException("Frame " + globalIndex + " failed: " + failure);
        }
        return result;
    }

    /**
     * @return the failure.
     * @throws IllegalStateException if this outcome is a success.
     */
    public FrameFailure failure() {
        if (failure == null) {
            throw new IllegalStateException("Frame " + globalIndex + " succeeded");
        }
        return failure;
    }

    @Override
    public String toString() {
        return "FrameOutcome{position=" + position + ", frame=" + globalIndex + ", attempt=" + attempt
            + ", worker=" + workerId + ", " + (isSuccess() ? "success" : failure) + "}";
    }
}
