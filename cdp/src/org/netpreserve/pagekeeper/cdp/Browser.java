package org.netpreserve.pagekeeper.cdp;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagekeeper.cdp.domains.Target.DidCommitProvisionalTarget;
import org.netpreserve.pagekeeper.cdp.domains.Target.LifecycleEvent;
import org.netpreserve.pagekeeper.cdp.domains.Target.TargetCreated;
import org.netpreserve.pagekeeper.cdp.domains.Target.TargetDestroyed;
import org.netpreserve.pagekeeper.cdp.domains.Target.TargetInfo;
import org.netpreserve.pagekeeper.cdp.protocol.Connection;
import org.netpreserve.pagekeeper.cdp.protocol.Subscription;
import org.netpreserve.pagekeeper.config.BrowserOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Registry of the targets and browser contexts of one browser process.
 * <p>
 * The registry is only changed by the target lifecycle events of the connection, which arrive one at a time on
 * the connection's event thread. A page created by {@link #newPage()} is therefore always registered by the time
 * the command that created it completes.
 */
public class Browser implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Browser.class);
    private final Connection connection;
    private final org.netpreserve.pagekeeper.cdp.domains.Browser browserDomain;
    private final PageFactory pageFactory;
    private final BrowserOptions options;
    private final Process process;
    private final Closeable closeCallback;
    private final BrowserContext defaultContext;
    private final Map<String, BrowserContext> contexts = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Target> targets = Collections.synchronizedMap(new LinkedHashMap<>());
    private final TaskQueue screenshotTaskQueue = new TaskQueue();
    private final Listeners<Target> targetCreated = new Listeners<>("Browser.targetCreated");
    private final Listeners<Target> targetDestroyed = new Listeners<>("Browser.targetDestroyed");
    private final Listeners<Target> targetChanged = new Listeners<>("Browser.targetChanged");
    private final List<Subscription> eventListeners;
    private final AtomicBoolean closed = new AtomicBoolean();

    public Browser(Connection connection, PageFactory pageFactory, BrowserOptions options) {
        this(connection, pageFactory, options, null, null);
    }

    /**
     * @param process       the browser process, if we launched it
     * @param closeCallback called once by {@link #close()}, typically shutting down the process
     */
    public Browser(Connection connection, PageFactory pageFactory, BrowserOptions options,
                   @Nullable Process process, @Nullable Closeable closeCallback) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.pageFactory = Objects.requireNonNull(pageFactory, "pageFactory");
        this.options = Objects.requireNonNull(options, "options");
        this.process = process;
        this.closeCallback = closeCallback;
        this.browserDomain = connection.domain(org.netpreserve.pagekeeper.cdp.domains.Browser.class);
        this.defaultContext = new BrowserContext(this, null);

        var targetDomain = connection.domain(org.netpreserve.pagekeeper.cdp.domains.Target.class);
        this.eventListeners = List.of(
                targetDomain.onTargetCreated(this::handleLifecycleEvent),
                targetDomain.onTargetDestroyed(this::handleLifecycleEvent),
                targetDomain.onDidCommitProvisionalTarget(this::handleLifecycleEvent));
    }

    @Nullable
    public Process process() {
        return process;
    }

    @Nullable
    public Viewport defaultViewport() {
        return options.defaultViewport();
    }

    public BrowserOptions options() {
        return options;
    }

    /**
     * Queue for operations that misbehave when run concurrently, like screenshots.
     */
    public TaskQueue screenshotTaskQueue() {
        return screenshotTaskQueue;
    }

    public CompletableFuture<BrowserContext> createIncognitoBrowserContext() {
        return browserDomain.createContextAsync().thenApply(contextId -> {
            var context = new BrowserContext(this, contextId);
            contexts.put(contextId, context);
            log.debug("Created browser context {}", contextId);
            return context;
        });
    }

    /**
     * The default context followed by the incognito contexts in creation order.
     */
    public List<BrowserContext> browserContexts() {
        var list = new ArrayList<BrowserContext>();
        list.add(defaultContext);
        synchronized (contexts) {
            list.addAll(contexts.values());
        }
        return list;
    }

    public BrowserContext defaultBrowserContext() {
        return defaultContext;
    }

    CompletableFuture<Void> disposeContext(String contextId) {
        return browserDomain.deleteContextAsync(contextId).thenRun(() -> {
            contexts.remove(contextId);
            log.debug("Disposed browser context {}", contextId);
        });
    }

    public CompletableFuture<Page> newPage() {
        return createPageInContext(defaultContext.id());
    }

    CompletableFuture<Page> createPageInContext(@Nullable String contextId) {
        return browserDomain.createPageAsync(contextId).thenCompose(targetId -> {
            var target = targets.get(targetId);
            if (target == null) {
                throw new IllegalStateException("Browser.createPage returned target " + targetId +
                                                " which was never announced by Target.targetCreated");
            }
            return target.page();
        });
    }

    /**
     * Snapshot of all targets that currently exist.
     */
    public List<Target> targets() {
        synchronized (targets) {
            return new ArrayList<>(targets.values());
        }
    }

    /**
     * Waits up to the configured default timeout for a target matching {@code predicate}.
     */
    public CompletableFuture<Target> waitForTarget(Predicate<Target> predicate) {
        return waitForTarget(predicate, options.timeout());
    }

    /**
     * Returns a target matching {@code predicate}, waiting for one to be created or changed if none exists yet.
     * Fails with {@link WaitTimeoutException} after {@code timeout}; a zero timeout waits forever.
     */
    public CompletableFuture<Target> waitForTarget(Predicate<Target> predicate, Duration timeout) {
        var existing = findTarget(predicate);
        if (existing != null) return CompletableFuture.completedFuture(existing);

        var future = new CompletableFuture<Target>();
        Consumer<Target> check = target -> {
            if (predicate.test(target)) future.complete(target);
        };
        var createdSubscription = targetCreated.add(check);
        var changedSubscription = targetChanged.add(check);
        // completes only after both listeners are gone
        var result = new CompletableFuture<Target>();
        future.whenComplete((target, error) -> {
            createdSubscription.remove();
            changedSubscription.remove();
            if (error instanceof TimeoutException) {
                result.completeExceptionally(new WaitTimeoutException("target", timeout));
            } else if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(target);
            }
        });
        // a caller cancelling the wait releases the listeners and the timer
        result.whenComplete((target, error) -> future.cancel(false));

        // a target may have appeared between the first check and subscribing
        existing = findTarget(predicate);
        if (existing != null) {
            future.complete(existing);
            return result;
        }

        // the timer is cancelled as soon as the wait completes
        if (!timeout.isZero()) future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return result;
    }

    @Nullable
    private Target findTarget(Predicate<Target> predicate) {
        for (var target : targets()) {
            if (predicate.test(target)) return target;
        }
        return null;
    }

    /**
     * Pages of every context, default context first.
     */
    public CompletableFuture<List<Page>> pages() {
        List<CompletableFuture<List<Page>>> contextPages = browserContexts().stream()
                .map(BrowserContext::pages)
                .toList();
        return CompletableFuture.allOf(contextPages.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> contextPages.stream()
                        .flatMap(future -> future.join().stream())
                        .toList());
    }

    private void handleLifecycleEvent(LifecycleEvent event) {
        if (event instanceof TargetCreated created) {
            handleTargetCreated(created.targetInfo());
        } else if (event instanceof TargetDestroyed destroyed) {
            handleTargetDestroyed(destroyed.targetId());
        } else if (event instanceof DidCommitProvisionalTarget committed) {
            handleProvisionalTargetCommitted(committed.oldTargetId(), committed.newTargetId());
        }
    }

    private void handleTargetCreated(TargetInfo targetInfo) {
        BrowserContext context = null;
        if (targetInfo.browserContextId() != null) {
            // The protocol has no context lifecycle events, so we can't tell the browser's own contexts apart.
            // Targets in any context we didn't create are treated as belonging to the default context.
            context = contexts.get(targetInfo.browserContextId());
        }
        if (context == null) context = defaultContext;

        var target = new Target(this, targetInfo, context);
        var previous = targets.putIfAbsent(targetInfo.targetId(), target);
        if (previous != null) {
            throw new IllegalStateException("Target.targetCreated for existing target " + targetInfo.targetId());
        }
        log.debug("Target created: {} in {}", target, context);
        targetCreated.fire(target);
        context.targetCreated.fire(target);
    }

    private void handleTargetDestroyed(String targetId) {
        var target = targets.remove(targetId);
        if (target == null) {
            throw new IllegalStateException("Target.targetDestroyed for unknown target " + targetId);
        }
        log.debug("Target destroyed: {}", target);
        target.didClose();
        connection.closeSession(targetId);
        targetDestroyed.fire(target);
        target.browserContext().targetDestroyed.fire(target);
    }

    private void handleProvisionalTargetCommitted(String oldTargetId, String newTargetId) {
        var oldTarget = targets.get(oldTargetId);
        if (oldTarget == null) {
            log.warn("Provisional target {} committed over unknown target {}", newTargetId, oldTargetId);
            return;
        }
        if (!oldTarget.hasPage()) {
            log.debug("Provisional target {} committed over {} which has no page", newTargetId, oldTargetId);
            return;
        }
        var newTarget = targets.get(newTargetId);
        if (newTarget == null) {
            throw new IllegalStateException("Target.didCommitProvisionalTarget for unknown target " + newTargetId);
        }
        if (newTarget.hasPage()) {
            log.warn("Provisional target {} already has a page, closing it in favour of the page of {}",
                    newTargetId, oldTargetId);
        }
        log.debug("Moving page from target {} to {}", oldTargetId, newTargetId);
        newTarget.adoptPage(oldTarget, connection.session(newTargetId));
    }

    void handleTargetChanged(Target target) {
        targetChanged.fire(target);
        target.browserContext().targetChanged.fire(target);
    }

    public Subscription onTargetCreated(Consumer<Target> listener) {
        return targetCreated.add(listener);
    }

    public Subscription onTargetDestroyed(Consumer<Target> listener) {
        return targetDestroyed.add(listener);
    }

    public Subscription onTargetChanged(Consumer<Target> listener) {
        return targetChanged.add(listener);
    }

    int listenerCount() {
        return targetCreated.size() + targetChanged.size();
    }

    public void disconnect() {
        throw new UnsupportedOperationException("Unsupported operation");
    }

    public boolean isConnected() {
        return true;
    }

    /**
     * Stops tracking lifecycle events, then runs the close callback. Only the first call has any effect.
     */
    @Override
    public void close() throws IOException {
        eventListeners.forEach(Subscription::remove);
        if (closed.compareAndSet(false, true) && closeCallback != null) {
            closeCallback.close();
        }
    }

    Connection connection() {
        return connection;
    }

    PageFactory pageFactory() {
        return pageFactory;
    }
}
