package org.netpreserve.pagekeeper.cdp;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagekeeper.cdp.protocol.Subscription;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * An isolation scope within the browser, like a browser profile. The default context always exists and can't
 * be closed; contexts created with {@link Browser#createIncognitoBrowserContext()} are incognito.
 */
public class BrowserContext {
    private final Browser browser;
    private final String id;
    final Listeners<Target> targetCreated = new Listeners<>("BrowserContext.targetCreated");
    final Listeners<Target> targetDestroyed = new Listeners<>("BrowserContext.targetDestroyed");
    final Listeners<Target> targetChanged = new Listeners<>("BrowserContext.targetChanged");

    BrowserContext(Browser browser, @Nullable String id) {
        this.browser = browser;
        this.id = id;
    }

    /**
     * Targets currently belonging to this context.
     */
    public List<Target> targets() {
        return browser.targets().stream()
                .filter(target -> target.browserContext() == this)
                .toList();
    }

    /**
     * Pages of this context in target order. Pages that could not be created because their target went away
     * are left out, as are targets whose page now lives in the target that replaced them.
     */
    public CompletableFuture<List<Page>> pages() {
        List<CompletableFuture<Page>> futures = targets().stream()
                .filter(target -> target.type().equals("page") && !target.isPageHandedOver())
                .map(target -> target.page().handle((page, error) -> {
                    if (error == null) return page;
                    if (target.isClosed()) return null;
                    throw error instanceof CompletionException completionException ?
                            completionException : new CompletionException(error);
                }))
                .toList();
        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> futures.stream()
                        .map(CompletableFuture::join)
                        .filter(Objects::nonNull)
                        .toList());
    }

    public CompletableFuture<Target> waitForTarget(Predicate<Target> predicate) {
        return waitForTarget(predicate, browser.options().timeout());
    }

    public CompletableFuture<Target> waitForTarget(Predicate<Target> predicate, Duration timeout) {
        return browser.waitForTarget(target -> target.browserContext() == this && predicate.test(target), timeout);
    }

    public boolean isIncognito() {
        return id != null && !id.isEmpty();
    }

    public CompletableFuture<Page> newPage() {
        return browser.createPageInContext(id);
    }

    /**
     * Disposes this context and everything in it.
     *
     * @throws IllegalStateException if this is the default context
     */
    public CompletableFuture<Void> close() {
        if (!isIncognito()) {
            throw new IllegalStateException("Non-incognito profiles cannot be closed!");
        }
        return browser.disposeContext(id);
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

    /**
     * The protocol's id for this context, or null for the default context.
     */
    @Nullable
    public String id() {
        return id;
    }

    public Browser browser() {
        return browser;
    }

    @Override
    public String toString() {
        return isIncognito() ? "BrowserContext{" + id + "}" : "BrowserContext{default}";
    }
}
