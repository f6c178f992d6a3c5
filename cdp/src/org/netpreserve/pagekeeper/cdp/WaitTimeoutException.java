package org.netpreserve.pagekeeper.cdp;

import java.time.Duration;

/**
 * A wait exceeded its time bound. The caller may retry or give up.
 */
public class WaitTimeoutException extends RuntimeException {
    private final String operation;
    private final Duration timeout;

    public WaitTimeoutException(String operation, Duration timeout) {
        super("Waiting for " + operation + " failed: timeout " + timeout.toMillis() + "ms exceeded");
        this.operation = operation;
        this.timeout = timeout;
    }

    public String operation() {
        return operation;
    }

    public Duration timeout() {
        return timeout;
    }
}
