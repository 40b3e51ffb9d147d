package dbft.consensus.service;

import dbft.consensus.message.ViewNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * One pending timeout at a time for the (height, view) the node is in. The timeout doubles with
 * every view and is capped; arming again replaces whatever was pending.
 */
public final class ViewTimers implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ViewTimers.class);

    @FunctionalInterface
    public interface Expiry {
        void onViewTimeout(long height, ViewNumber view);
    }

    private final ScheduledExecutorService scheduler;
    private final long blockTimeMs;
    private final long maxTimeoutMs;
    private final Expiry expiry;

    private final Object lock = new Object();
    private ScheduledFuture<?> viewTimer;

    public ViewTimers(String name, long blockTimeMs, long maxTimeoutMs, Expiry expiry) {
        if (blockTimeMs <= 0) throw new IllegalArgumentException("blockTimeMs must be positive");
        this.blockTimeMs = blockTimeMs;
        this.maxTimeoutMs = Math.max(maxTimeoutMs, blockTimeMs);
        this.expiry = Objects.requireNonNull(expiry, "expiry");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new TF(name + "-timers"));
    }

    /** {@code blockTimeMs << (view + 1)}, capped. */
    public long timeoutFor(ViewNumber view) {
        long shift = (long) view.value() + 1;
        if (shift >= Long.numberOfLeadingZeros(blockTimeMs)) return maxTimeoutMs;
        return Math.min(blockTimeMs << shift, maxTimeoutMs);
    }

    public void arm(long height, ViewNumber view) {
        arm(height, view, timeoutFor(view));
    }

    public void arm(long height, ViewNumber view, long delayMs) {
        synchronized (lock) {
            cancel(viewTimer);
            viewTimer = scheduler.schedule(() -> fire(height, view), delayMs, TimeUnit.MILLISECONDS);
        }
        log.debug("Timers: armed h={} v={} for {}ms", height, view, delayMs);
    }

    public void cancel() {
        synchronized (lock) {
            cancel(viewTimer);
            viewTimer = null;
        }
    }

    public boolean isArmed() {
        synchronized (lock) {
            return viewTimer != null && !viewTimer.isDone();
        }
    }

    private void fire(long height, ViewNumber view) {
        log.info("Timers: view timeout at h={} v={}", height, view);
        try {
            expiry.onViewTimeout(height, view);
        } catch (RuntimeException e) {
            log.error("Timers: timeout handler failed at h={} v={}", height, view, e);
        }
    }

    private static void cancel(ScheduledFuture<?> f) {
        if (f != null) f.cancel(false);
    }

    @Override
    public void close() {
        cancel();
        scheduler.shutdownNow();
    }

    private static final class TF implements ThreadFactory {
        private final String base;
        TF(String base) { this.base = base; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, base);
            t.setDaemon(true);
            return t;
        }
    }
}
