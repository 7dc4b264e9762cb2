package com.usatiuk.ringmesh.peers;

/**
 * Listener for changes of the mesh state.
 */
public interface MeshStateListener {
    /**
     * Called after every change that was applied to the store.
     * Called on the thread that made the change, implementations should not block.
     *
     * @param snapshot the state right after the change
     */
    void handleMeshStateChanged(MeshSnapshot snapshot);
}
