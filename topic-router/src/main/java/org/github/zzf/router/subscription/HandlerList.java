package org.github.zzf.router.subscription;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The handlers registered on one pattern, in registration order.
 * <p>
 * 线程安全: appends run under the index write lock and replace the list, so a reader holding a
 * snapshot from {@link #handlers()} never sees it change.
 */
public final class HandlerList<H> {

    private volatile List<H> handlers = Collections.emptyList();

    HandlerList() {
    }

    /**
     * only through {@link SubscriptionIndex#set}, which holds the write lock
     */
    void add(H handler) {
        Objects.requireNonNull(handler, "handler");
        List<H> copy = new ArrayList<>(handlers.size() + 1);
        copy.addAll(handlers);
        copy.add(handler);
        handlers = Collections.unmodifiableList(copy);
    }

    /**
     * immutable snapshot
     */
    public List<H> handlers() {
        return handlers;
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public int size() {
        return handlers.size();
    }

    @Override
    public String toString() {
        return handlers.size() + " handlers";
    }

}
