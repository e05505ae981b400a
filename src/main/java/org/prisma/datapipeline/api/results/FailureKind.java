package org.prisma.datapipeline.api.results;

/**
 * Frame-level infrastructure failures. All of them may be retried; cell-level fit failures
 * are not frame failures and never appear here.
 */
public enum FailureKind {
    /** The image could not be read or decoded. */
    DECODE,
    /** The worker threw an unexpected exception. */
    WORKER_CRASH,
    /** The worker ran out of memory or another exhaustible resource. */
    RESOURCE_EXHAUSTED,
    /** The task or its result was lost between submitter and worker. */
    TRANSPORT
}
