package org.prisma.datapipeline.api.results;

import org.prisma.datapipeline.api.frames.FrameDescriptor;

/**
 * Unit of work handed to a worker pool: one frame plus its position in the requested sequence.
 * <p>
 * The position travels with the task and comes back on the outcome. It is the only thing that
 * decides where a result lands in the dataset.
 *
 * @param position    index of the frame within the requested frame sequence
 * @param attempt     0 for the first submission, incremented on every retry
 * @param frame       the frame to process
 * @param avoidWorker worker that failed the previous attempt, or {@code null}
 */
public record FrameTask(int position, int attempt, FrameDescriptor frame, String avoidWorker) {

    public static FrameTask first(int position, FrameDescriptor frame) {
        return new FrameTask(position, 0, frame, null);
    }

    /**
     * @param failedWorker worker that produced the failure being retried.
     * @return the next attempt of this task.
     */
    public FrameTask retry(String failedWorker) {
        return new FrameTask(position, attempt + 1, frame, failedWorker);
    }

    public String taskId() {
        return position + "-" + attempt;
    }
}
