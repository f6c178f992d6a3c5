package org.netpreserve.pagekeeper.cdp;

import org.netpreserve.pagekeeper.cdp.protocol.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Listeners for one kind of event, called in registration order.
 */
final class Listeners<T> {
    private static final Logger log = LoggerFactory.getLogger(Listeners.class);
    private final String name;
    private final List<Consumer<T>> listeners = new CopyOnWriteArrayList<>();

    Listeners(String name) {
        this.name = name;
    }

    Subscription add(Consumer<T> listener) {
        // wrap so that adding the same callback twice yields two independently removable registrations
        Consumer<T> registration = listener::accept;
        listeners.add(registration);
        return () -> listeners.remove(registration);
    }

    void fire(T event) {
        for (var listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("{} listener threw", name, e);
            }
        }
    }

    int size() {
        return listeners.size();
    }
}
