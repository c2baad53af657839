package com.websocket.fanout;

public enum SessionState {
    ACTIVE,
    /** Removed from the registry and connection closed; loops are unwinding. */
    TERMINATING,
    CLOSED
}
