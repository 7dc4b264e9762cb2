package com.usatiuk.utils;

import org.jboss.logging.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * A named set of tasks running on a shared scheduler, that can be cancelled together.
 * Tasks scheduled while the group is inactive are dropped, and task bodies are skipped
 * once the group has been cancelled, even if the scheduler already dequeued them.
 */
public class TaskGroup {
    private static final Logger LOG = Logger.getLogger(TaskGroup.class);

    private final String _name;
    private final ScheduledExecutorService _executor;
    private final Set<ScheduledFuture<?>> _futures = ConcurrentHashMap.newKeySet();
    private volatile boolean _active = false;

    /**
     * Creates a new inactive task group.
     *
     * @param name     the name used in log messages
     * @param executor the shared scheduler
     */
    public TaskGroup(String name, ScheduledExecutorService executor) {
        _name = name;
        _executor = executor;
    }

    public String getName() {
        return _name;
    }

    /**
     * Allows tasks to be scheduled in this group.
     *
     * @return false if the group was already active
     */
    public boolean activate() {
        synchronized (this) {
            if (_active) return false;
            _active = true;
            return true;
        }
    }

    public boolean isActive() {
        return _active;
    }

    /**
     * Runs the task as soon as possible.
     *
     * @param task the task
     */
    public void execute(Runnable task) {
        schedule(task, 0);
    }

    /**
     * Runs the task once after a delay.
     *
     * @param task    the task
     * @param delayMs the delay in milliseconds
     */
    public void schedule(Runnable task, long delayMs) {
        if (!_active) {
            LOG.tracev("Dropping task of inactive group {0}", _name);
            return;
        }

        var self = new AtomicReference<ScheduledFuture<?>>();
        ScheduledFuture<?> future = _executor.schedule(() -> {
            try {
                runGuarded(task);
            } finally {
                var f = self.get();
                if (f != null) _futures.remove(f);
            }
        }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        self.set(future);
        _futures.add(future);
        if (future.isDone())
            _futures.remove(future);
    }

    /**
     * Runs the body repeatedly, the delay before every run being computed anew.
     * A failing run is logged and does not stop the loop.
     *
     * @param initialDelayMs the delay before the first run
     * @param nextDelayMs    supplies the delay between the end of a run and the next one
     * @param body           the loop body
     */
    public void loop(long initialDelayMs, LongSupplier nextDelayMs, Runnable body) {
        schedule(new Runnable() {
            @Override
            public void run() {
                try {
                    runGuarded(body);
                } finally {
                    if (_active)
                        schedule(this, nextDelayMs.getAsLong());
                }
            }
        }, initialDelayMs);
    }

    /**
     * Cancels every pending task and deactivates the group.
     * Safe to call several times.
     */
    public void cancelAll() {
        synchronized (this) {
            _active = false;
        }
        for (var f : _futures) {
            f.cancel(false);
        }
        _futures.clear();
    }

    /**
     * @return the number of tasks that are scheduled but did not run yet
     */
    public int pendingCount() {
        return (int) _futures.stream().filter(f -> !f.isDone()).count();
    }

    private void runGuarded(Runnable task) {
        if (!_active) return;
        try {
            task.run();
        } catch (Exception e) {
            LOG.errorv(e, "Task of {0} failed", _name);
        }
    }
}
