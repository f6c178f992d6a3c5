package org.netpreserve.pagekeeper.cdp;

import org.netpreserve.pagekeeper.cdp.protocol.CDPSession;

import java.util.concurrent.CompletableFuture;

/**
 * Builds the {@link Page} for a target. Called at most once per target, possibly on the connection's event
 * thread, so implementations must only use the {@code Async} command variants.
 */
@FunctionalInterface
public interface PageFactory {
    CompletableFuture<Page> create(Target target, CDPSession session);
}
