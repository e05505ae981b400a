package org.prisma.datapipeline.api.services;

import java.time.Instant;

/**
 * A transient error recorded by a service that kept running.
 *
 * @param timestamp when the error occurred
 * @param code      category, e.g. {@code "TASK_DECODE_FAILED"}
 * @param message   human-readable message
 * @param details   additional context
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {}
