package org.prisma.datapipeline.api.results;

/**
 * Why a frame produced no result.
 *
 * @param kind    failure category
 * @param message human-readable cause
 */
public record FrameFailure(FailureKind kind, String message) {}
