package com.enterprise.morpher.migration.domain;

import java.util.Optional;

/**
 * Maximum tolerated share of failed rows per stage, checked at batch boundaries.
 * A rate is failed rows divided by rows attempted at that stage.
 */
public record FailurePolicy(double maxTransformFailureRate, double maxWriteFailureRate) {

    public static final FailurePolicy BEST_EFFORT = new FailurePolicy(1.0, 1.0);
    public static final FailurePolicy FAIL_FAST = new FailurePolicy(0.0, 0.0);

    public FailurePolicy {
        checkRate("maxTransformFailureRate", maxTransformFailureRate);
        checkRate("maxWriteFailureRate", maxWriteFailureRate);
    }

    /**
     * @return the violation message, empty while both stages are within bounds
     */
    public Optional<String> check(long transformAttempted, long transformFailed,
                                  long writeAttempted, long writeFailed) {
        if (exceeds(transformFailed, transformAttempted, maxTransformFailureRate)) {
            return Optional.of(String.format("Transform failure rate %d/%d exceeds %.2f",
                    transformFailed, transformAttempted, maxTransformFailureRate));
        }
        if (exceeds(writeFailed, writeAttempted, maxWriteFailureRate)) {
            return Optional.of(String.format("Write failure rate %d/%d exceeds %.2f",
                    writeFailed, writeAttempted, maxWriteFailureRate));
        }
        return Optional.empty();
    }

    private static boolean exceeds(long failed, long attempted, double maxRate) {
        return attempted > 0 && failed > 0 && (double) failed / attempted > maxRate;
    }

    private static void checkRate(String name, double rate) {
        if (rate < 0.0 || rate > 1.0 || Double.isNaN(rate)) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + rate);
        }
    }
}
