package org.github.zzf.router.trie;

@FunctionalInterface
public interface NodeVisitor<T> {

    /**
     * @param path  route of the node, '' for the root
     * @param value the stored value, null if unset
     * @param set   whether a value was ever set on the node
     */
    void visit(String path, T value, boolean set);

}
