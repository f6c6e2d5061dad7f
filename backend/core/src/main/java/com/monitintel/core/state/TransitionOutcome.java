package com.monitintel.core.state;

/**
 * Classification of one service's newest status against its stored status.
 */
public enum TransitionOutcome {
    /** Healthy before and after; bookkeeping only. */
    HEALTHY(false),
    /** Healthy before, failing now. */
    NEW(true),
    /** Failing with the same status code as before. */
    ONGOING(false),
    /** Failing with a different status code than before. */
    CHANGED(true),
    /** Failing before, healthy now. */
    RECOVERED(false);

    private final boolean critical;

    TransitionOutcome(boolean critical) {
        this.critical = critical;
    }

    public boolean critical() {
        return critical;
    }
}
