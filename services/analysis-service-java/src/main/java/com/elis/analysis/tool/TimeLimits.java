package com.elis.analysis.tool;

import java.time.Duration;

/**
 * Soft limit: the tool is asked to stop. Hard limit: the tool is killed.
 */
public record TimeLimits(Duration soft, Duration hard) {

    public TimeLimits {
        if (soft == null || hard == null || soft.isNegative() || soft.isZero()) {
            throw new IllegalArgumentException("Time limits must be positive");
        }
        if (hard.compareTo(soft) < 0) {
            throw new IllegalArgumentException("Hard limit " + hard + " is shorter than soft limit " + soft);
        }
    }

    public Duration grace() {
        return hard.minus(soft);
    }
}
