package org.netpreserve.pagekeeper.cdp;

public class TargetClosedException extends RuntimeException {
    private final String targetId;

    public TargetClosedException(String targetId) {
        super("Target closed: " + targetId);
        this.targetId = targetId;
    }

    public String targetId() {
        return targetId;
    }
}
