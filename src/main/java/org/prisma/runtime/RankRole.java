package org.prisma.runtime;

/**
 * What a process does in a run.
 */
public enum RankRole {
    /** Rank 0 of a distributed run: hosts the message broker. */
    COORDINATOR,
    /** Runs the pipeline: rank 1 of a distributed run, or the only process of a local run. */
    SUBMITTER,
    /** Ranks 2 and above: process frame tasks. */
    WORKER;

    public static RankRole forRank(int rank) {
        return switch (rank) {
            case 0 -> COORDINATOR;
            case 1 -> SUBMITTER;
            default -> WORKER;
        };
    }
}
