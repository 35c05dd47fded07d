package org.github.zzf.router.trie;

/**
 * A matched node: the pattern that won, e.g. '/device/+/state', and its live slot.
 */
public record Route<T>(String route, Slot<T> slot) {

    public T value() {
        return slot.get();
    }

}
