package org.prisma.datapipeline.api.fitting;

import org.prisma.datapipeline.api.job.PeakDefinition;

/**
 * Fits a single diffraction peak inside a window of a 1D pattern.
 * <p>
 * Implementations are called concurrently from all frame workers and must not keep mutable
 * state between calls.
 */
public interface IPeakFitter {

    /**
     * @param pattern the full azimuthal slice.
     * @param window  the window to restrict the fit to.
     * @param peak    the peak being fitted.
     * @return the fitted parameters.
     * @throws FitConvergenceException if the peak cannot be fitted in this slice.
     */
    PeakFit fit(DiffractionPattern pattern, FitWindow window, PeakDefinition peak) throws FitConvergenceException;
}
