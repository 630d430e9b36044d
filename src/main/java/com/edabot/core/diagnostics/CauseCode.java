package com.edabot.core.diagnostics;

/**
 * Reason a single statistical test could not produce a value for a series.
 */
public enum CauseCode {
    NONE,
    INSUFFICIENT_DATA,
    DEGENERATE_SERIES,
    SINGULAR_DESIGN,
    NON_FINITE_RESULT,
    INSUFFICIENT_TAIL_MASS,
    NON_POSITIVE_THRESHOLD,
    RUNTIME_ERROR
}
