package com.z254.butterfly.prism.causal;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Caps the number of independence tests and the wall-clock time of one pass.
 * <p>
 * Not thread-safe; a budget belongs to a single pass.
 */
public final class DiscoveryBudget {

    private final long maxTests;
    private final long deadlineNanos;
    private final LongSupplier nanoClock;
    private long consumed;
    private boolean exhausted;

    DiscoveryBudget(long maxTests, Duration maxDuration, LongSupplier nanoClock) {
        this.maxTests = maxTests;
        this.nanoClock = nanoClock;
        this.deadlineNanos = maxDuration == null || maxDuration.isZero() || maxDuration.isNegative()
                ? Long.MAX_VALUE
                : nanoClock.getAsLong() + maxDuration.toNanos();
    }

    /**
     * Budget proportional to {@code factor * variables^2 * (maxConditioningSize + 1)}.
     */
    public static DiscoveryBudget forPass(int variables, int maxConditioningSize, int factor,
                                          Duration maxDuration) {
        long tests = (long) factor * variables * variables * (maxConditioningSize + 1L);
        return new DiscoveryBudget(Math.max(tests, 1L), maxDuration, System::nanoTime);
    }

    public static DiscoveryBudget unlimited() {
        return new DiscoveryBudget(Long.MAX_VALUE, null, System::nanoTime);
    }

    public static DiscoveryBudget ofTests(long maxTests) {
        return new DiscoveryBudget(maxTests, null, System::nanoTime);
    }

    /**
     * Take one unit of budget; returns false once the budget is exhausted.
     */
    public boolean tryConsume() {
        if (exhausted) {
            return false;
        }
        if (consumed >= maxTests || nanoClock.getAsLong() - deadlineNanos > 0) {
            exhausted = true;
            return false;
        }
        consumed++;
        return true;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public long getConsumed() {
        return consumed;
    }
}
