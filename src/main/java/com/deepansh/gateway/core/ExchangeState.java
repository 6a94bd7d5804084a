package com.deepansh.gateway.core;

/**
 * Lifecycle of one exchange:
 * {@code REQUESTING → STREAMING → (EXECUTING → REQUESTING)* → COMPLETE | FAILED | CANCELLED}.
 */
public enum ExchangeState {
    REQUESTING,
    STREAMING,
    EXECUTING,
    COMPLETE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }
}
