package org.github.zzf.router.trie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One level of the topic tree.
 * <p>
 * Children are only created under the owning index's write lock and never removed.
 */
public class Node<T> {

    final String level;
    final SegmentKind kind;
    final Node<T> parent;
    final Slot<T> data = new Slot<>();
    /* literal child Nodes */
    final Map<String, Node<T>> childNodes
        = new HashMap<>(Integer.getInteger("topic.router.node.childNodes", 4));
    /* '+' */
    Node<T> singleLevel;
    /* '#' */
    Node<T> multiLevel;

    Node(Node<T> parent, String level) {
        this.parent = parent;
        this.level = level;
        this.kind = Segments.classify(level);
    }

    static <T> Node<T> root() {
        return new Node<>(null, "");
    }

    Node<T> addChild(String childLevel) {
        if (kind == SegmentKind.MULTI) {
            throw new IllegalStateException("'#' node can not have children: " + path());
        }
        return switch (Segments.classify(childLevel)) {
            case SINGLE -> {
                if (singleLevel == null) {
                    singleLevel = new Node<>(this, childLevel);
                }
                yield singleLevel;
            }
            case MULTI -> {
                if (multiLevel == null) {
                    multiLevel = new Node<>(this, childLevel);
                }
                yield multiLevel;
            }
            case LITERAL -> childNodes.computeIfAbsent(childLevel, l -> new Node<>(this, l));
        };
    }

    public Node<T> literalChild(String childLevel) {
        return childNodes.get(childLevel);
    }

    public Node<T> singleLevelChild() {
        return singleLevel;
    }

    public Node<T> multiLevelChild() {
        return multiLevel;
    }

    public Slot<T> data() {
        return data;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * literal children sorted by level, then '+', then '#'
     */
    List<Node<T>> children() {
        if (childNodes.isEmpty() && singleLevel == null && multiLevel == null) {
            return Collections.emptyList();
        }
        List<Node<T>> ret = new ArrayList<>(new TreeMap<>(childNodes).values());
        if (singleLevel != null) {
            ret.add(singleLevel);
        }
        if (multiLevel != null) {
            ret.add(multiLevel);
        }
        return ret;
    }

    /**
     * levels from the root (exclusive) down to this node
     */
    List<String> levels() {
        List<String> levels = new ArrayList<>();
        for (Node<T> n = this; !n.isRoot(); n = n.parent) {
            levels.add(n.level);
        }
        Collections.reverse(levels);
        return levels;
    }

    public String path() {
        return Segments.route(levels());
    }

}
