package org.netpreserve.pagekeeper.cdp;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {
    @Test
    void tasksDoNotOverlap() throws Exception {
        var queue = new TaskQueue();
        var log = new CopyOnWriteArrayList<String>();
        var firstGate = new CompletableFuture<String>();

        var first = queue.postTask(() -> {
            log.add("start first");
            return firstGate.thenApply(value -> {
                log.add("end first");
                return value;
            });
        });
        var second = queue.postTask(() -> {
            log.add("start second");
            return CompletableFuture.completedFuture("second");
        });

        assertFalse(second.isDone());
        assertEquals(List.of("start first"), log);

        firstGate.complete("first");
        assertEquals("first", first.get(5, TimeUnit.SECONDS));
        assertEquals("second", second.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("start first", "end first", "start second"), log);
    }

    @Test
    void failedTaskDoesNotBlockTheQueue() throws Exception {
        var queue = new TaskQueue();
        var failed = queue.<String>postTask(() -> CompletableFuture.failedFuture(new IllegalStateException("capture failed")));
        var thrown = queue.<String>postTask(() -> {
            throw new IllegalArgumentException("bad clip");
        });
        var next = queue.postTask(() -> CompletableFuture.completedFuture("ok"));

        var e = assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        e = assertThrows(ExecutionException.class, () -> thrown.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals("ok", next.get(5, TimeUnit.SECONDS));
    }
}
