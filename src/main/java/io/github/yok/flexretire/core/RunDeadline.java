package io.github.yok.flexretire.core;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Wall-clock budget of one run, measured from its creation.
 *
 * @author Yasuharu.Okawauchi
 */
public final class RunDeadline {

    /**
     * Message logged for a job stopped between batches.
     */
    public static final String DEFERRED_MESSAGE =
            "Run deadline reached; remaining rows deferred to next run";

    /**
     * Message logged for a job that never started.
     */
    public static final String NOT_STARTED_MESSAGE = "Run deadline reached before job start";

    private static final RunDeadline NONE = new RunDeadline(null, null);

    private final Stopwatch stopwatch;
    private final Duration budget;

    private RunDeadline(Stopwatch stopwatch, Duration budget) {
        this.stopwatch = stopwatch;
        this.budget = budget;
    }

    /**
     * Returns a deadline that is never reached.
     *
     * @return unlimited deadline
     */
    public static RunDeadline none() {
        return NONE;
    }

    /**
     * Starts a deadline.
     *
     * @param budget run budget
     * @param ticker time source
     * @return started deadline
     */
    public static RunDeadline after(Duration budget, Ticker ticker) {
        Validate.isTrue(budget != null && !budget.isNegative(), "budget must be non-negative.");
        return new RunDeadline(Stopwatch.createStarted(ticker), budget);
    }

    /**
     * Returns whether the budget is used up.
     *
     * @return {@code true} once the budget has elapsed
     */
    public boolean isReached() {
        return budget != null && stopwatch.elapsed().compareTo(budget) >= 0;
    }
}
