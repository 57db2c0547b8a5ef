package com.assetmetrics.history.reader;

/**
 * What a single window fetch means for the rest of the read.
 */
public enum FetchOutcome {

    /** Data reaches back to start and forward past end. */
    COVERED_BOTH,

    /** Data does not reach back to start: the window was too narrow, likely clock skew. */
    NEEDS_WIDER,

    /** Data reaches back to start but stops before end: samples after upstream midnight are missing. */
    NEEDS_SUPPLEMENT
}
