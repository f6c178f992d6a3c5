package org.netpreserve.pagekeeper.cdp.protocol;

/**
 * The browser-level command channel plus access to per-target sessions.
 */
public interface Connection {
    /**
     * Returns a proxy for a protocol domain interface whose methods send commands and whose {@code onX} methods
     * subscribe to events on the browser-level channel.
     */
    <T> T domain(Class<T> domainInterface);

    /**
     * Returns the session bound to the given target, creating it on first use.
     */
    CDPSession session(String targetId);

    /**
     * Discards the session bound to the given target, if any.
     */
    void closeSession(String targetId);
}
