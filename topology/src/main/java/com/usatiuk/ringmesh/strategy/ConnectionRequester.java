package com.usatiuk.ringmesh.strategy;

import com.usatiuk.ringmesh.peers.ConnectionPhase;
import com.usatiuk.ringmesh.peers.DeviceState;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.AlreadyConnectedException;
import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.utils.TaskGroup;
import org.jboss.logging.Logger;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Issues outgoing connection requests on behalf of a strategy and reconciles the mesh state with their outcome.
 * <p>
 * A request failing because the endpoint is already connected moves the device to CONNECTED,
 * any other failure counts as a failed attempt and moves it to ERROR.
 * Outcomes arriving after the owning strategy was stopped are ignored.
 */
class ConnectionRequester {
    private static final Logger LOG = Logger.getLogger(ConnectionRequester.class);

    private final MeshStateStore _store;
    private final Transport _transport;
    private final TaskGroup _owner;
    private final Set<EndpointId> _outgoing = ConcurrentHashMap.newKeySet();

    ConnectionRequester(MeshStateStore store, Transport transport, TaskGroup owner) {
        _store = store;
        _transport = transport;
        _owner = owner;
    }

    /**
     * Dials a device that the caller already moved to CONNECTING.
     *
     * @param target the device
     * @return completes once the outcome of the request has been applied, never exceptionally
     */
    CompletableFuture<Void> dial(DeviceState target) {
        _outgoing.add(target.endpoint());
        LOG.infov("Requesting connection to {0}", target);
        CompletableFuture<Void> request;
        try {
            request = _transport.requestConnection(_store.self(), target.endpoint());
        } catch (RuntimeException e) {
            request = CompletableFuture.failedFuture(e);
        }
        return request.handle((v, e) -> {
            if (e != null) onFailure(target, unwrap(e));
            return null;
        });
    }

    /**
     * @return true if the endpoint is being dialed by us
     */
    boolean isOutgoing(EndpointId endpoint) {
        return _outgoing.contains(endpoint);
    }

    void settled(EndpointId endpoint) {
        _outgoing.remove(endpoint);
    }

    void clear() {
        _outgoing.clear();
    }

    private void onFailure(DeviceState target, Throwable e) {
        _outgoing.remove(target.endpoint());
        if (!_owner.isActive()) {
            LOG.debugv("Ignoring outcome of request to {0}, {1} is stopped", target, _owner.getName());
            return;
        }
        if (e instanceof AlreadyConnectedException) {
            LOG.warnv("Already connected to {0}, recovering state", target);
            _store.updatePhase(target.endpoint(), ConnectionPhase.CONNECTED);
            return;
        }
        var retries = _store.incrementRetry(target.name());
        LOG.warnv(e, "Connection request to {0} failed, retry count {1}", target, retries);
        _store.updatePhase(target.endpoint(), ConnectionPhase.ERROR);
    }

    private static Throwable unwrap(Throwable e) {
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null)
            e = e.getCause();
        return e;
    }
}
