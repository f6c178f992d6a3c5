package org.netpreserve.pagekeeper.cdp;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pagekeeper.cdp.domains.Target.TargetInfo;
import org.netpreserve.pagekeeper.cdp.protocol.CDPSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A browsing context inside the browser process, such as a page or a worker.
 * <p>
 * Page-type targets lazily create exactly one {@link Page}. The page may outlive its target: when a
 * cross-process navigation commits, the page is handed over to the replacement target and keeps its identity.
 */
public class Target {
    private static final Logger log = LoggerFactory.getLogger(Target.class);
    private final Browser browser;
    private final BrowserContext browserContext;
    private final String targetId;
    private final String type;
    private volatile String url;
    private final AtomicReference<CompletableFuture<Page>> page = new AtomicReference<>();
    private volatile boolean pageHandedOver;
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    Target(Browser browser, TargetInfo targetInfo, BrowserContext browserContext) {
        this.browser = browser;
        this.browserContext = browserContext;
        this.targetId = targetInfo.targetId();
        this.type = targetInfo.type();
        this.url = targetInfo.url();
    }

    /**
     * Returns this target's page, creating it on first call. Every caller gets the same future. Targets that
     * are not pages resolve to null.
     */
    public CompletableFuture<Page> page() {
        if (!isPage()) return CompletableFuture.completedFuture(null);
        var existing = page.get();
        if (existing != null) return existing;
        var future = new CompletableFuture<Page>();
        if (!page.compareAndSet(null, future)) return page.get();
        if (closed.isDone()) {
            future.completeExceptionally(new TargetClosedException(targetId));
            return future;
        }
        CompletableFuture<Page> creation;
        try {
            creation = browser.pageFactory().create(this, browser.connection().session(targetId));
        } catch (RuntimeException e) {
            creation = CompletableFuture.failedFuture(e);
        }
        creation.whenComplete((created, error) -> {
            if (error != null) {
                future.completeExceptionally(error);
            } else if (!future.complete(created) && created != null) {
                log.debug("Target {} closed while its page was being created", targetId);
                created.didClose();
            }
        });
        return future;
    }

    boolean hasPage() {
        return page.get() != null;
    }

    /**
     * True once this target's page has moved to the target that replaced it.
     */
    boolean isPageHandedOver() {
        return pageHandedOver;
    }

    /**
     * Takes over the page of {@code previous} after a provisional navigation committed into this target.
     * The page is moved to {@code session} before anyone can obtain it through this target.
     */
    void adoptPage(Target previous, CDPSession session) {
        var previousPage = previous.page.get();
        if (previousPage == null) return;
        previous.pageHandedOver = true;
        var future = new CompletableFuture<Page>();
        var displaced = page.getAndSet(future);
        if (displaced != null && displaced != previousPage) {
            displaced.thenAccept(early -> {
                if (early == null) return;
                log.debug("Closing page target {} created before adopting the page of {}", targetId,
                        previous.targetId);
                early.didClose();
            });
        }
        previousPage.whenComplete((adopted, error) -> {
            if (error != null) {
                future.completeExceptionally(error);
                return;
            }
            if (adopted == null) {
                future.complete(null);
                return;
            }
            try {
                adopted.swapSessionOnNavigation(session, this);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                return;
            }
            if (!future.complete(adopted)) {
                log.debug("Target {} closed while adopting the page of {}", targetId, previous.targetId);
                adopted.didClose();
            }
        });
    }

    /**
     * Tears the target down. Settles a page still being created and closes an existing page unless it was
     * handed over to another target.
     */
    void didClose() {
        if (!closed.complete(null)) {
            throw new IllegalStateException("Target " + targetId + " closed twice");
        }
        var future = page.get();
        if (future == null || pageHandedOver) return;
        future.completeExceptionally(new TargetClosedException(targetId));
        future.thenAccept(created -> {
            if (created != null) created.didClose();
        });
    }

    /**
     * Records a navigation of this target. Listeners for target changes on the browser and this target's
     * context are notified when the URL actually differs.
     */
    public void updateUrl(String url) {
        if (Objects.equals(this.url, url)) return;
        this.url = url;
        browser.handleTargetChanged(this);
    }

    private boolean isPage() {
        return "page".equals(type);
    }

    public String targetId() {
        return targetId;
    }

    public String type() {
        return type;
    }

    @Nullable
    public String url() {
        return url;
    }

    public BrowserContext browserContext() {
        return browserContext;
    }

    public Browser browser() {
        return browser;
    }

    public boolean isClosed() {
        return closed.isDone();
    }

    /**
     * Completes when the remote target is destroyed.
     */
    public CompletableFuture<Void> closed() {
        return closed.thenApply(ignored -> null);
    }

    @Override
    public String toString() {
        return "Target{" +
               "targetId='" + targetId + '\'' +
               ", type='" + type + '\'' +
               ", url='" + url + '\'' +
               '}';
    }
}
