package org.netpreserve.pagekeeper.cdp;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.pagekeeper.cdp.domains.Target.TargetInfo;
import org.netpreserve.pagekeeper.config.BrowserOptions;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class WaitForTargetTest {
    private FakeBrowserConnection connection;
    private Browser browser;

    @BeforeEach
    void setUp() throws IOException {
        connection = new FakeBrowserConnection();
        browser = new Browser(connection.client,
                (target, session) -> CompletableFuture.completedFuture(new FakePage(target, session)),
                BrowserOptions.defaults().withTimeout(Duration.ofMillis(200)));
    }

    @AfterEach
    void tearDown() throws IOException {
        browser.close();
        connection.client.close();
    }

    @Test
    void existingTargetResolvesImmediately() throws Exception {
        connection.targetCreated("t1", "page", null);
        connection.flush();

        var future = browser.waitForTarget(target -> target.targetId().equals("t1"));

        assertTrue(future.isDone());
        assertEquals("t1", future.get().targetId());
        assertEquals(0, browser.listenerCount());
    }

    @Test
    void resolvesWhenAMatchingTargetIsCreated() throws Exception {
        var future = browser.waitForTarget(target -> "http://example.com/".equals(target.url()),
                Duration.ofSeconds(5));
        connection.targetCreated("t1", "page", null);
        connection.flush();
        assertFalse(future.isDone());

        connection.targetCreated(new TargetInfo("t2", "page", "http://example.com/", null));

        assertEquals("t2", future.get(5, TimeUnit.SECONDS).targetId());
        assertEquals(0, browser.listenerCount());
    }

    @Test
    void resolvesWhenAnExistingTargetChanges() throws Exception {
        connection.targetCreated("t1", "page", null);
        connection.flush();
        var future = browser.waitForTarget(target -> "http://example.com/".equals(target.url()),
                Duration.ofSeconds(5));
        assertFalse(future.isDone());

        browser.targets().get(0).updateUrl("http://example.com/");

        assertEquals("t1", future.get(5, TimeUnit.SECONDS).targetId());
    }

    @Test
    void timesOutAfterTheConfiguredBound() {
        long start = System.nanoTime();
        var future = browser.waitForTarget(target -> false, Duration.ofMillis(100));

        var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        var timeout = assertInstanceOf(WaitTimeoutException.class, e.getCause());
        assertEquals("target", timeout.operation());
        assertEquals(Duration.ofMillis(100), timeout.timeout());
        assertEquals("Waiting for target failed: timeout 100ms exceeded", timeout.getMessage());
        assertTrue(elapsedMillis >= 100, "timed out after only " + elapsedMillis + "ms");
        assertEquals(0, browser.listenerCount());
    }

    @Test
    void usesTheDefaultTimeoutFromOptions() {
        var e = assertThrows(ExecutionException.class,
                () -> browser.waitForTarget(target -> false).get(5, TimeUnit.SECONDS));
        assertEquals(Duration.ofMillis(200), ((WaitTimeoutException) e.getCause()).timeout());
    }

    @Test
    void zeroTimeoutWaitsForever() throws Exception {
        var future = browser.waitForTarget(target -> target.type().equals("page"), Duration.ZERO);

        assertThrows(TimeoutException.class, () -> future.get(400, TimeUnit.MILLISECONDS));
        assertEquals(2, browser.listenerCount());

        connection.targetCreated("t1", "page", null);
        assertEquals("t1", future.get(5, TimeUnit.SECONDS).targetId());
        assertEquals(0, browser.listenerCount());
    }

    @Test
    void satisfiedWaitIsNotFailedByItsTimeout() throws Exception {
        var future = browser.waitForTarget(target -> true, Duration.ofMillis(100));
        connection.targetCreated("t1", "page", null);
        assertEquals("t1", future.get(5, TimeUnit.SECONDS).targetId());

        Thread.sleep(200);

        assertFalse(future.isCompletedExceptionally());
        assertEquals("t1", future.get().targetId());
        assertEquals(0, browser.listenerCount());
    }

    @Test
    void cancellingAWaitReleasesItsListeners() {
        var future = browser.waitForTarget(target -> false, Duration.ofSeconds(30));
        assertEquals(2, browser.listenerCount());

        assertTrue(future.cancel(false));

        assertEquals(0, browser.listenerCount());
    }

    @Test
    void concurrentWaitsResolveIndependently() throws Exception {
        var first = browser.waitForTarget(target -> target.targetId().equals("a"), Duration.ofSeconds(5));
        var second = browser.waitForTarget(target -> target.targetId().equals("b"), Duration.ofSeconds(5));
        var any = browser.waitForTarget(target -> true, Duration.ofSeconds(5));

        connection.targetCreated("b", "page", null);
        connection.targetCreated("a", "page", null);

        assertEquals("a", first.get(5, TimeUnit.SECONDS).targetId());
        assertEquals("b", second.get(5, TimeUnit.SECONDS).targetId());
        assertEquals("b", any.get(5, TimeUnit.SECONDS).targetId());
    }

    @Test
    void contextWaitIgnoresTargetsOfOtherContexts() throws Exception {
        var context = browser.createIncognitoBrowserContext().get(5, TimeUnit.SECONDS);
        var future = context.waitForTarget(target -> true, Duration.ofSeconds(5));

        connection.targetCreated("outside", "page", null);
        connection.flush();
        assertFalse(future.isDone());

        connection.targetCreated("inside", "page", context.id());
        var target = future.get(5, TimeUnit.SECONDS);
        assertEquals("inside", target.targetId());
        assertSame(context, target.browserContext());
    }
}
