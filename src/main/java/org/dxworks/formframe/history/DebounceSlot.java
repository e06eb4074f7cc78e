package org.dxworks.formframe.history;

import java.util.function.LongSupplier;

/**
 * A single pending deferred action. Scheduling while an action is pending replaces it and
 * restarts the delay; {@link #flush()} runs the pending action immediately and clears the slot.
 * Nothing runs on its own: the owner calls {@link #fireIfDue()} from its event loop.
 */
public class DebounceSlot {
    private final long delayMillis;
    private final LongSupplier clock;

    private Runnable pending;
    private long dueAt;

    public DebounceSlot(long delayMillis, LongSupplier clock) {
        this.delayMillis = delayMillis;
        this.clock = clock;
    }

    public void schedule(Runnable action) {
        pending = action;
        dueAt = clock.getAsLong() + delayMillis;
    }

    /** Runs the pending action, if any. Returns whether one ran. */
    public boolean flush() {
        if (pending == null) {
            return false;
        }
        Runnable action = pending;
        pending = null;
        action.run();
        return true;
    }

    public void cancel() {
        pending = null;
    }

    public boolean fireIfDue() {
        if (pending != null && clock.getAsLong() >= dueAt) {
            return flush();
        }
        return false;
    }

    public boolean isPending() {
        return pending != null;
    }
}
