package com.usatiuk.ringmesh.transport;

public enum ConnectionStatus {
    OK,
    REJECTED,
    ERROR;

    public boolean isSuccess() {
        return this == OK;
    }
}
