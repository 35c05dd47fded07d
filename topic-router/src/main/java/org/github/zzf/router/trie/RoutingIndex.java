package org.github.zzf.router.trie;

import static org.github.zzf.router.trie.Segments.candidateChildren;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Topic tree that maps a pattern to one value.
 * <p>
 * Patterns use the MQTT wildcards: 'a/b/c' exact, 'a/+/c' one level, 'a/#' one or more trailing
 * levels. A lookup prefers the exact level, then '+', then '#', at every level of the tree.
 * <p>
 * 设计思路： 1. 写操作持有写锁串行更改 2. 读操作共享读锁。节点只增不删
 */
@Slf4j
public class RoutingIndex<T> {

    // tree root, addressed by the pattern ""
    private final Node<T> root = Node.root();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * store {@code value} under {@code pattern}, overwriting any previous value
     *
     * @throws InvalidPatternException if '#' is not the last level. nothing is created
     */
    public void setValue(String pattern, T value) {
        Objects.requireNonNull(value, "value");
        set(pattern, (slot, existed) -> slot.set(value));
    }

    /**
     * get or create the node of {@code pattern} and let {@code mutator} decide its value
     *
     * @throws InvalidPatternException if '#' is not the last level. nothing is created
     */
    public void set(String pattern, SlotMutator<T> mutator) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(mutator, "mutator");
        List<String> levels = Segments.split(pattern);
        // validate the whole pattern before the tree is touched
        Segments.validate(pattern, levels);
        Lock w = lock.writeLock();
        w.lock();
        try {
            Node<T> n = root;
            for (String level : levels) {
                // n will point to the child after add
                n = n.addChild(level);
            }
            Slot<T> slot = n.data;
            mutator.mutate(slot, slot.isPresent());
            log.debug("set pattern: {} -> {}", pattern, n.path());
        } finally {
            w.unlock();
        }
    }

    /**
     * the value of the highest priority pattern that matches {@code topic}.
     * a null set through {@link #set(String, SlotMutator)} reads as empty, use {@link #match(String)}
     */
    public Optional<T> getValue(String topic) {
        return match(topic).map(Route::value);
    }

    public Optional<Route<T>> match(String topic) {
        return match(topic, v -> true);
    }

    /**
     * first match search. nodes whose value is unset or rejected by {@code accept} are skipped
     */
    public Optional<Route<T>> match(String topic, Predicate<? super T> accept) {
        Objects.requireNonNull(topic, "topic");
        List<String> topicLevels = Segments.split(topic);
        Lock r = lock.readLock();
        r.lock();
        try {
            Node<T> n = dfsMatch(topicLevels, 0, root, accept);
            return Optional.ofNullable(n).map(this::toRoute);
        } finally {
            r.unlock();
        }
    }

    public List<Route<T>> matchAll(String topic) {
        return matchAll(topic, v -> true);
    }

    /**
     * every pattern that matches {@code topic}. exact before '+' before '#' at each level
     */
    public List<Route<T>> matchAll(String topic, Predicate<? super T> accept) {
        Objects.requireNonNull(topic, "topic");
        List<String> topicLevels = Segments.split(topic);
        List<Node<T>> ret = new ArrayList<>(2);
        Lock r = lock.readLock();
        r.lock();
        try {
            dfsMatchAll(topicLevels, 0, root, accept, ret);
            return ret.stream().map(this::toRoute).toList();
        } finally {
            r.unlock();
        }
    }

    private Node<T> dfsMatch(List<String> topicLevels, int levelIdx, Node<T> cur,
        Predicate<? super T> accept) {
        if (levelIdx == topicLevels.size()) {
            return accepted(cur, accept) ? cur : null;
        }
        String topicLevel = topicLevels.get(levelIdx);
        for (Node<T> child : candidateChildren(cur, topicLevel)) {
            Node<T> n;
            if (child.kind == SegmentKind.MULTI) {
                // '#' consumes the remaining levels
                n = accepted(child, accept) ? child : null;
            }
            else {
                n = dfsMatch(topicLevels, levelIdx + 1, child, accept);
            }
            if (n != null) {
                return n;
            }
        }
        return null;
    }

    private void dfsMatchAll(List<String> topicLevels, int levelIdx, Node<T> cur,
        Predicate<? super T> accept, List<Node<T>> ret) {
        if (levelIdx == topicLevels.size()) {
            if (accepted(cur, accept)) {
                ret.add(cur);
            }
            return;
        }
        String topicLevel = topicLevels.get(levelIdx);
        for (Node<T> child : candidateChildren(cur, topicLevel)) {
            if (child.kind == SegmentKind.MULTI) {
                if (accepted(child, accept)) {
                    ret.add(child);
                }
            }
            else {
                dfsMatchAll(topicLevels, levelIdx + 1, child, accept, ret);
            }
        }
    }

    private boolean accepted(Node<T> n, Predicate<? super T> accept) {
        Slot<T> slot = n.data;
        return slot.isPresent() && accept.test(slot.get());
    }

    private Route<T> toRoute(Node<T> n) {
        return new Route<>(n.path(), n.data);
    }

    /**
     * pre-order traversal of every node ever created, including the ones without a value
     */
    public void walk(NodeVisitor<? super T> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        Lock r = lock.readLock();
        r.lock();
        try {
            dfsWalk(root, visitor);
        } finally {
            r.unlock();
        }
    }

    private void dfsWalk(Node<T> n, NodeVisitor<? super T> visitor) {
        visitor.visit(n.path(), n.data.get(), n.data.isPresent());
        for (Node<T> child : n.children()) {
            dfsWalk(child, visitor);
        }
    }

    /**
     * number of nodes that carry a value
     */
    public int size() {
        int[] count = {0};
        walk((path, value, set) -> {
            if (set) {
                count[0] += 1;
            }
        });
        return count[0];
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * the shape of the tree, one node per line
     */
    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        Lock r = lock.readLock();
        r.lock();
        try {
            render(root, 0, buf);
        } finally {
            r.unlock();
        }
        return buf.toString();
    }

    private void render(Node<T> n, int depth, StringBuilder buf) {
        buf.append("  ".repeat(depth));
        if (n.isRoot()) {
            buf.append('*');
        }
        else if (n.level.isEmpty()) {
            buf.append("''");
        }
        else {
            buf.append(n.level);
        }
        if (n.data.isPresent()) {
            buf.append(" -> ").append(n.data.get());
        }
        buf.append('\n');
        for (Node<T> child : n.children()) {
            render(child, depth + 1, buf);
        }
    }

}
