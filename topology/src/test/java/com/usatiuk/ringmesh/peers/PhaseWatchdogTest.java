package com.usatiuk.ringmesh.peers;

import com.usatiuk.ringmesh.ManualScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PhaseWatchdogTest {
    private static final DeviceName A = DeviceName.of("a");
    private static final EndpointId E1 = EndpointId.of("e1");

    private ManualScheduler _scheduler;
    private MeshStateStore _store;
    private PhaseWatchdog _watchdog;

    @BeforeEach
    void setup() {
        _scheduler = new ManualScheduler();
        _store = new MeshStateStore(DeviceName.of("self"), _scheduler.clock());
        _watchdog = new PhaseWatchdog(_store, _scheduler, 30_000, 30_000, 30_000);
        _watchdog.start();
    }

    @AfterEach
    void teardown() {
        _watchdog.stop();
    }

    private ConnectionPhase phase() {
        return _store.getDeviceState(E1).orElseThrow().phase();
    }

    @Test
    void stuckConnectingBecomesErrorThenIsForgotten() {
        _store.updatePhase(E1, A, ConnectionPhase.CONNECTING);
        _scheduler.advance(29_999);
        Assertions.assertEquals(ConnectionPhase.CONNECTING, phase());

        _scheduler.advance(1);
        Assertions.assertEquals(ConnectionPhase.ERROR, phase());
        Assertions.assertEquals(1, _store.getRetryCount(A));

        _scheduler.advance(30_000);
        Assertions.assertTrue(_store.getDeviceState(E1).isEmpty());
        Assertions.assertEquals(1, _store.getRetryCount(A));
    }

    @Test
    void phaseChangeDisarmsTimer() {
        _store.updatePhase(E1, A, ConnectionPhase.CONNECTING);
        _scheduler.advance(20_000);
        _store.updatePhase(E1, ConnectionPhase.CONNECTED);
        _scheduler.advance(120_000);
        Assertions.assertEquals(ConnectionPhase.CONNECTED, phase());
        Assertions.assertEquals(0, _store.getRetryCount(A));
    }

    @Test
    void newPhaseStartsNewTimeout() {
        _store.updatePhase(E1, A, ConnectionPhase.CONNECTING);
        _scheduler.advance(20_000);
        _store.updatePhase(E1, ConnectionPhase.DISCONNECTED);
        _scheduler.advance(20_000);
        Assertions.assertEquals(ConnectionPhase.DISCONNECTED, phase());
        _scheduler.advance(10_000);
        Assertions.assertTrue(_store.getDeviceState(E1).isEmpty());
    }

    @Test
    void discoveredAndConnectedNeverTimeOut() {
        _store.deviceDiscovered(E1, A);
        _scheduler.advance(600_000);
        Assertions.assertEquals(ConnectionPhase.DISCOVERED, phase());
        Assertions.assertEquals(-1, _watchdog.timeoutFor(ConnectionPhase.CONNECTED));
    }

    @Test
    void stopCancelsTimers() {
        _store.updatePhase(E1, A, ConnectionPhase.CONNECTING);
        _watchdog.stop();
        _scheduler.advance(120_000);
        Assertions.assertEquals(ConnectionPhase.CONNECTING, phase());
        Assertions.assertEquals(0, _scheduler.queued());
    }
}
