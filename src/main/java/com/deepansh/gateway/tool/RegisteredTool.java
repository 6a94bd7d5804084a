package com.deepansh.gateway.tool;

import lombok.Getter;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * A tool as the registry holds it: declaration, handler, and the process-wide
 * concurrency ceiling. The semaphore is the only mutable state.
 */
@Getter
public class RegisteredTool {

    private final ToolDefinition definition;
    private final ToolHandler handler;
    private final int concurrencyLimit;
    private final Semaphore permits;

    RegisteredTool(ToolDefinition definition, ToolHandler handler, int concurrencyLimit) {
        this.definition = definition;
        this.handler = handler;
        this.concurrencyLimit = concurrencyLimit;
        this.permits = new Semaphore(concurrencyLimit, true);
    }

    public String getName() {
        return definition.getName();
    }

    public boolean isProviderHandled() {
        return definition.isProviderHandled();
    }

    boolean tryAcquire(long timeoutMs) throws InterruptedException {
        return permits.tryAcquire(Math.max(timeoutMs, 0), TimeUnit.MILLISECONDS);
    }

    void release() {
        permits.release();
    }

    public int inFlight() {
        return concurrencyLimit - permits.availablePermits();
    }
}
