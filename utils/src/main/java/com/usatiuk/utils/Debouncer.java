package com.usatiuk.utils;

import jakarta.annotation.Nullable;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Holds a single latest value and hands it to the sink once no new distinct value
 * was submitted for the whole debounce window.
 * Submitting the value that is already held is a no-op and does not restart the window.
 *
 * @param <T> the type of the value
 */
public class Debouncer<T> {
    private final ScheduledExecutorService _executor;
    private final Consumer<T> _sink;
    private final long _windowMs;
    private T _value;
    private boolean _hasValue = false;
    private long _generation = 0;
    private ScheduledFuture<?> _pending;
    private boolean _closed = false;

    /**
     * @param executor the scheduler used for the delayed delivery
     * @param windowMs the debounce window in milliseconds
     * @param sink     receives the settled values
     */
    public Debouncer(ScheduledExecutorService executor, long windowMs, Consumer<T> sink) {
        _executor = executor;
        _windowMs = windowMs;
        _sink = sink;
    }

    /**
     * Submits a value.
     *
     * @param value the value
     * @return true if the value differs from the held one and restarted the window
     */
    public boolean submit(T value) {
        synchronized (this) {
            if (_closed) throw new IllegalStateException("Submitting to a closed debouncer!");
            if (_hasValue && Objects.equals(_value, value))
                return false;

            _value = value;
            _hasValue = true;
            var generation = ++_generation;

            if (_pending != null)
                _pending.cancel(false);
            _pending = _executor.schedule(() -> fire(generation), _windowMs, TimeUnit.MILLISECONDS);
            return true;
        }
    }

    /**
     * @return the latest submitted value, settled or not
     */
    @Nullable
    public synchronized T current() {
        return _value;
    }

    /**
     * Forgets the held value so that the next submission always restarts the window.
     */
    public synchronized void reset() {
        _hasValue = false;
        _value = null;
        _generation++;
        if (_pending != null) {
            _pending.cancel(false);
            _pending = null;
        }
    }

    /**
     * Cancels the pending delivery, no values are accepted afterwards.
     */
    public void close() {
        synchronized (this) {
            _closed = true;
            _generation++;
            if (_pending != null)
                _pending.cancel(false);
            _pending = null;
        }
    }

    private void fire(long generation) {
        T value;
        synchronized (this) {
            if (_closed || generation != _generation)
                return;
            _pending = null;
            value = _value;
        }
        _sink.accept(value);
    }
}
