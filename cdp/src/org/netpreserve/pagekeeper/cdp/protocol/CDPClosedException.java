package org.netpreserve.pagekeeper.cdp.protocol;

public class CDPClosedException extends CDPException {
    public CDPClosedException() {
        super(0, "Connection closed");
        actuallyFillInStackTrace();
    }
}
