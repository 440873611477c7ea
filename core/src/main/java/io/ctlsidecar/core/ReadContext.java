package io.ctlsidecar.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request cancellation signal handed to the {@link Reader}.
 *
 * Carries an optional deadline and an explicit cancel flag. Readers poll
 * {@link #checkActive()} between units of work and may register hooks
 * (e.g. {@code Statement::cancel}) to abort blocking calls.
 */
public final class ReadContext {
    private static final Logger log = Logger.getLogger(ReadContext.class.getName());

    private final Clock clock;
    private final Instant deadline; // null = none
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelHooks = new ArrayList<>(); // guarded by this

    private ReadContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /** Context with no deadline; only explicit cancel() stops it. */
    public static ReadContext background() {
        return new ReadContext(Clock.systemUTC(), null);
    }

    public static ReadContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static ReadContext withTimeout(Duration timeout, Clock clock) {
        return new ReadContext(clock, clock.instant().plus(timeout));
    }

    /**
     * Mark the context cancelled and run registered hooks once.
     * Hooks registered after cancellation run immediately.
     */
    public void cancel() {
        List<Runnable> hooks;
        synchronized (this) {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            hooks = new ArrayList<>(cancelHooks);
            cancelHooks.clear();
        }
        for (Runnable hook : hooks) {
            runHook(hook);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void onCancel(Runnable hook) {
        synchronized (this) {
            if (!cancelled.get()) {
                cancelHooks.add(hook);
                return;
            }
        }
        runHook(hook);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Time left before the deadline, clamped at zero; empty when there is no deadline. */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isDone() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /** Throws if the request was cancelled or its deadline passed. */
    public void checkActive() throws ReaderException {
        if (cancelled.get()) {
            throw new ReaderException("context canceled");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new ReaderException("context deadline exceeded");
        }
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "cancel hook failed", e);
        }
    }
}
