package snake.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Spaces ticks {@code periodNanos} apart on an absolute schedule. A late tick moves the
 * schedule forward to now; missed ticks are not replayed.
 */
public final class FixedRatePacer implements Pacer {
    private static final Logger LOG = LoggerFactory.getLogger(FixedRatePacer.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    private final long periodNanos;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private long nextTickAt;

    public FixedRatePacer(long periodNanos) {
        this(periodNanos, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    public FixedRatePacer(long periodNanos, LongSupplier clock, Sleeper sleeper) {
        if (periodNanos <= 0) throw new IllegalArgumentException("Tick period must be positive: " + periodNanos);
        this.periodNanos = periodNanos;
        this.clock = clock;
        this.sleeper = sleeper;
        this.nextTickAt = clock.getAsLong() + periodNanos;
    }

    @Override public void awaitNextTick() throws InterruptedException {
        long now = clock.getAsLong();
        long wait = nextTickAt - now;
        if (wait > 0) {
            sleeper.sleepNanos(wait);
            nextTickAt += periodNanos;
        } else {
            if (-wait > periodNanos) LOG.debug("Tick overran by {} ms, resynchronising", TimeUnit.NANOSECONDS.toMillis(-wait));
            nextTickAt = now + periodNanos;
        }
    }

    long nextTickAt() { return nextTickAt; }
}
