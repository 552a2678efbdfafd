package com.match.lp.models.enums;

/**
 * What to do with a solution value strictly inside {@code (tolerance, 1 - tolerance)}.
 */
public enum FractionalValuePolicy {
    /** Fail the extraction. */
    REJECT,
    /** Log and treat the edge as not selected. */
    DISCARD
}
