package org.prisma.datapipeline.api.fitting;

/**
 * Signals that a peak could not be fitted in one slice (no convergence, empty window,
 * corrupt bin). It is terminal for that cell and is never retried.
 */
public class FitConvergenceException extends Exception {

    public FitConvergenceException(String message) {
        super(message);
    }
}
