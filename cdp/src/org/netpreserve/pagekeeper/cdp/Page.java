package org.netpreserve.pagekeeper.cdp;

import org.netpreserve.pagekeeper.cdp.protocol.CDPSession;

/**
 * The automation handle for a page-type {@link Target}. Only the parts the target lifecycle relies on are
 * declared here.
 */
public interface Page {
    /**
     * Called when a cross-process navigation has moved this page into {@code target}. The page must route all
     * further commands and events through {@code session}.
     */
    void swapSessionOnNavigation(CDPSession session, Target target);

    /**
     * Called once when the target hosting this page is destroyed.
     */
    void didClose();

    boolean isClosed();
}
