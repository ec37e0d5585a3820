package com.toolhub.tools;

import com.toolhub.tools.error.ToolTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-call execution state handed to {@link Tool#execute}: the optional deadline and the
 * cancellation flag. Cancelling the context also interrupts the thread currently executing the
 * call, so blocking I/O inside the tool is released.
 */
public final class ExecutionContext {

    private final String toolName;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile boolean deadlineReached;
    private volatile Thread executingThread;

    private ExecutionContext(String toolName, Instant deadline, Clock clock) {
        this.toolName = Objects.requireNonNull(toolName, "toolName");
        this.deadline = deadline;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Context with no deadline. */
    public static ExecutionContext unbounded(String toolName) {
        return new ExecutionContext(toolName, null, Clock.systemUTC());
    }

    /**
     * Context whose deadline is {@code timeout} from now.
     *
     * @param timeout null or non-positive = no deadline
     */
    public static ExecutionContext withTimeout(String toolName, Duration timeout, Clock clock) {
        Clock c = clock != null ? clock : Clock.systemUTC();
        Instant d = timeout != null && !timeout.isNegative() && !timeout.isZero() ? c.instant().plus(timeout) : null;
        return new ExecutionContext(toolName, d, c);
    }

    public String getToolName() {
        return toolName;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /** Time left before the deadline (never negative); empty when there is no deadline. */
    public Optional<Duration> remaining() {
        if (deadline == null) return Optional.empty();
        if (deadlineReached) return Optional.of(Duration.ZERO);
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isExpired() {
        return deadlineReached || (deadline != null && !clock.instant().isBefore(deadline));
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Cancels the call. Idempotent; the first call interrupts the executing thread, if any.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            synchronized (this) {
                Thread t = executingThread;
                if (t != null) {
                    t.interrupt();
                }
            }
        }
    }

    /**
     * Marks the deadline as reached and cancels the call. Used by the engine's deadline timer so the
     * call reports a timeout rather than a cancellation.
     */
    public void expire() {
        deadlineReached = true;
        cancel();
    }

    /**
     * Throws if the call may not continue. Tools doing multi-step work call this between steps.
     *
     * @throws CancellationException if cancelled
     * @throws ToolTimeoutException  if the deadline has passed
     */
    public void checkActive() throws ToolTimeoutException {
        if (isExpired()) {
            throw new ToolTimeoutException("Deadline exceeded for " + toolName);
        }
        if (isCancelled()) {
            throw new CancellationException("Call to " + toolName + " was cancelled");
        }
    }

    /** Binds the executing thread; used by the dispatcher around {@link Tool#execute}. */
    public synchronized void attach(Thread thread) {
        this.executingThread = thread;
        if (cancelled.get() && thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Unbinds the executing thread once {@link Tool#execute} has returned. After this returns,
     * {@link #cancel()} no longer interrupts that thread.
     */
    public synchronized void detach() {
        this.executingThread = null;
    }
}
