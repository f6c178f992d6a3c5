package org.netpreserve.pagekeeper.cdp.protocol;

/**
 * Handle for a registered event listener.
 */
@FunctionalInterface
public interface Subscription {
    /**
     * Stops delivering events to the listener. Removing twice has no further effect.
     */
    void remove();
}
