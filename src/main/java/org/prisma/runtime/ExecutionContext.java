package org.prisma.runtime;

/**
 * Outcome of execution-mode selection, passed explicitly to the components that need it.
 *
 * @param mode           LOCAL or DISTRIBUTED; never AUTO
 * @param role           this process's role
 * @param rank           this process's rank, 0 in local mode
 * @param size           number of ranks, 1 in local mode
 * @param workers        number of worker slots available to the submitter
 * @param brokerUrl      broker to connect to, or {@code null} when there is none
 * @param fallbackReason why a requested or detected distributed run is not happening, or {@code null}
 */
public record ExecutionContext(ExecutionMode mode, RankRole role, int rank, int size, int workers, String brokerUrl,
                               String fallbackReason) {

    public static ExecutionContext local(int workers, String fallbackReason) {
        return new ExecutionContext(ExecutionMode.LOCAL, RankRole.SUBMITTER, 0, 1, workers, null, fallbackReason);
    }

    /**
     * A rank that has nothing to do in this run, e.g. a worker that found no broker.
     */
    public static ExecutionContext idle(RankRole role, int rank, int size, String reason) {
        return new ExecutionContext(ExecutionMode.LOCAL, role, rank, size, 0, null, reason);
    }

    public boolean isDistributed() {
        return mode == ExecutionMode.DISTRIBUTED;
    }

    /**
     * @return true if this process has no part in the run.
     */
    public boolean isIdle() {
        return role != RankRole.SUBMITTER && brokerUrl == null;
    }

    /**
     * @return identifier of a worker rank, used to steer retries away from it.
     */
    public String workerId() {
        return "rank-" + rank;
    }

    public String describe() {
        return isDistributed()
            ? "distributed (rank " + rank + "/" + size + ", " + role + ", " + workers + " workers)"
            : "local (" + workers + " workers)";
    }
}
