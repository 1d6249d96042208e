package com.cburch.logsim.circuit;

import com.cburch.logsim.file.ErrorType;

/**
 * Outcome of one call to {@link Propagator#executeCycle()}.
 *
 * @param cycle     1-based index of the attempted cycle
 * @param converged false when the combinational logic did not settle
 * @param passes    evaluation passes used (the limit when not converged)
 */
public record CycleResult(int cycle, boolean converged, int passes) {

    public static CycleResult settled(int cycle, int passes) {
        return new CycleResult(cycle, true, passes);
    }

    public static CycleResult diverged(int cycle, int passes) {
        return new CycleResult(cycle, false, passes);
    }

    public ErrorType error() {
        return converged ? null : ErrorType.NO_CONVERGENCE;
    }

    /** Localized description of the failure, or empty when converged. */
    public String message() {
        return converged ? "" : ErrorType.NO_CONVERGENCE.format(passes, cycle);
    }
}
