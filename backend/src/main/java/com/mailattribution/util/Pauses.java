package com.mailattribution.util;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import lombok.experimental.UtilityClass;

/** Spacing between upstream calls. */
@UtilityClass
public class Pauses {

    /**
     * Sleeps for {@code duration}; zero or negative durations return immediately.
     *
     * @throws CancellationException when the thread is interrupted; the interrupt flag is restored
     */
    public static void pause(Duration duration, String activity) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException(activity + " interrupted");
            cancelled.initCause(e);
            throw cancelled;
        }
    }
}
