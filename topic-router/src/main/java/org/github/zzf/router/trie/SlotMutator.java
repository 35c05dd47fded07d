package org.github.zzf.router.trie;

/**
 * Decides the new payload of a node.
 * <p>
 * Called under the index write lock. {@code existed} is false the first time the pattern is
 * registered. An exception thrown here propagates to the caller of
 * {@link RoutingIndex#set(String, SlotMutator)}; nodes already created are kept.
 */
@FunctionalInterface
public interface SlotMutator<T> {

    void mutate(Slot<T> slot, boolean existed);

}
