package org.netpreserve.pagekeeper.cdp.domains;

import org.netpreserve.pagekeeper.cdp.protocol.Subscription;

import java.util.Objects;
import java.util.function.Consumer;

public interface Target {
    Subscription onTargetCreated(Consumer<TargetCreated> handler);

    Subscription onTargetDestroyed(Consumer<TargetDestroyed> handler);

    Subscription onDidCommitProvisionalTarget(Consumer<DidCommitProvisionalTarget> handler);

    record TargetInfo(String targetId, String type, String url, String browserContextId) {
        public TargetInfo {
            Objects.requireNonNull(targetId, "targetId");
            Objects.requireNonNull(type, "type");
        }
    }

    /**
     * Notifications that change which targets exist.
     */
    sealed interface LifecycleEvent permits TargetCreated, TargetDestroyed, DidCommitProvisionalTarget {
    }

    record TargetCreated(TargetInfo targetInfo) implements LifecycleEvent {
        public TargetCreated {
            Objects.requireNonNull(targetInfo, "targetInfo");
        }
    }

    record TargetDestroyed(String targetId) implements LifecycleEvent {
        public TargetDestroyed {
            Objects.requireNonNull(targetId, "targetId");
        }
    }

    /**
     * A navigation that started in a provisional target has committed, so {@code newTargetId} now hosts the page
     * previously hosted by {@code oldTargetId}.
     */
    record DidCommitProvisionalTarget(String oldTargetId, String newTargetId) implements LifecycleEvent {
        public DidCommitProvisionalTarget {
            Objects.requireNonNull(oldTargetId, "oldTargetId");
            Objects.requireNonNull(newTargetId, "newTargetId");
        }
    }
}
