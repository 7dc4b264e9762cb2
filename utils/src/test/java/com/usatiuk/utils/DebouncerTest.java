package com.usatiuk.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;

public class DebouncerTest {
    private final ScheduledExecutorService _executor = Executors.newSingleThreadScheduledExecutor();
    private final List<Boolean> _received = new CopyOnWriteArrayList<>();

    @AfterEach
    void shutdown() {
        _executor.shutdownNow();
    }

    @Test
    void deliversAfterWindow() {
        var debouncer = new Debouncer<Boolean>(_executor, 300, _received::add);

        var curTime = System.currentTimeMillis();
        Assertions.assertTrue(debouncer.submit(true));
        await().atMost(5, TimeUnit.SECONDS).until(() -> _received.size() == 1);
        var gotTime = System.currentTimeMillis();

        Assertions.assertEquals(List.of(true), _received);
        Assertions.assertTrue((gotTime - curTime) >= 300);
    }

    @Test
    void onlyLatestValueIsDelivered() {
        var debouncer = new Debouncer<Boolean>(_executor, 300, _received::add);

        debouncer.submit(true);
        debouncer.submit(false);
        debouncer.submit(true);
        Assertions.assertEquals(true, debouncer.current());

        await().atMost(5, TimeUnit.SECONDS).until(() -> !_received.isEmpty());
        Assertions.assertEquals(List.of(true), _received);
    }

    @Test
    void repeatedValueDoesNotRestartWindow() throws InterruptedException {
        var debouncer = new Debouncer<Boolean>(_executor, 400, _received::add);

        var curTime = System.currentTimeMillis();
        Assertions.assertTrue(debouncer.submit(false));
        Thread.sleep(300);
        Assertions.assertFalse(debouncer.submit(false));
        await().atMost(5, TimeUnit.SECONDS).until(() -> _received.size() == 1);
        var gotTime = System.currentTimeMillis();

        // Second submission would have pushed delivery to at least 700ms
        Assertions.assertTrue((gotTime - curTime) < 690);
    }

    @Test
    void resetAcceptsSameValueAgain() {
        var debouncer = new Debouncer<Boolean>(_executor, 50, _received::add);

        debouncer.submit(true);
        await().atMost(5, TimeUnit.SECONDS).until(() -> _received.size() == 1);
        Assertions.assertFalse(debouncer.submit(true));
        debouncer.reset();
        Assertions.assertTrue(debouncer.submit(true));
        await().atMost(5, TimeUnit.SECONDS).until(() -> _received.size() == 2);
    }

    @Test
    void closedDebouncerDeliversNothing() throws InterruptedException {
        var debouncer = new Debouncer<Boolean>(_executor, 100, _received::add);

        debouncer.submit(true);
        debouncer.close();
        Thread.sleep(300);
        Assertions.assertTrue(_received.isEmpty());
        Assertions.assertThrows(IllegalStateException.class, () -> debouncer.submit(false));
    }
}
