package org.netpreserve.pagekeeper.cdp;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Runs asynchronous tasks one at a time in submission order. A failed task does not stop later ones.
 */
public class TaskQueue {
    private CompletableFuture<?> chain = CompletableFuture.completedFuture(null);

    public synchronized <T> CompletableFuture<T> postTask(Supplier<? extends CompletableFuture<T>> task) {
        CompletableFuture<T> result = chain.handle((ignored, error) -> null).thenCompose(ignored -> task.get());
        chain = result;
        return result;
    }
}
