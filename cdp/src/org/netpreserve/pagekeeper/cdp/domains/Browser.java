package org.netpreserve.pagekeeper.cdp.domains;

import org.netpreserve.pagekeeper.cdp.protocol.Unwrap;

import java.util.concurrent.CompletableFuture;

public interface Browser {
    @Unwrap("browserContextId")
    CompletableFuture<String> createContextAsync();

    CompletableFuture<Void> deleteContextAsync(String browserContextId);

    /**
     * Opens a page in the given context, or in the default context when {@code browserContextId} is null.
     */
    @Unwrap("targetId")
    CompletableFuture<String> createPageAsync(String browserContextId);
}
