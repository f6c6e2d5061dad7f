package com.monitintel.core.state;

/**
 * Maps a (previous, new) status pair to exactly one {@link TransitionOutcome}. Status 0 is
 * healthy, any other code is a failure variant.
 *
 * <p>A service still failing with the same code is {@link TransitionOutcome#ONGOING} even if the
 * underlying cause differs; downstream analysis is throttled on the status code alone.
 */
public final class FailureClassifier {
    private FailureClassifier() {
    }

    public static TransitionOutcome classify(int previousStatus, int newStatus) {
        boolean wasFailing = previousStatus != 0;
        boolean isFailing = newStatus != 0;
        if (!wasFailing) {
            return isFailing ? TransitionOutcome.NEW : TransitionOutcome.HEALTHY;
        }
        if (!isFailing) {
            return TransitionOutcome.RECOVERED;
        }
        return previousStatus == newStatus ? TransitionOutcome.ONGOING : TransitionOutcome.CHANGED;
    }
}
