package com.call_bridge_backend.models;

public enum CallSessionState {
    IDLE,
    STARTING,
    STREAMING,
    STOPPING,
    CLOSED
}
