package com.p14n.upsbridge.bridge;

public enum BridgeState {
    IDLE,
    CONNECTING,
    POLLING,
    PUBLISHING,
    SLEEPING
}
