package org.github.zzf.router.subscription;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.router.trie.NodeVisitor;
import org.github.zzf.router.trie.Route;
import org.github.zzf.router.trie.RoutingIndex;

/**
 * Topic tree of subscriptions: every pattern keeps a list of handlers, several subscribers may
 * share one pattern.
 * <p>
 * '$share/&lt;group&gt;/...' and '$queue/...' are stripped before the pattern reaches the tree, so
 * '$share/g1/device/+/state' routes exactly like 'device/+/state'.
 */
@Slf4j
public class SubscriptionIndex<H> {

    final RoutingIndex<HandlerList<H>> tree = new RoutingIndex<>();

    /**
     * get or create the node of {@code topicFilter} and hand its handler list to {@code op}.
     * Calling it again for the same pattern appends, it never overwrites.
     *
     * @throws InvalidShareSubscriptionException malformed '$share' / '$queue' prefix
     * @throws InvalidTopicPatternException      '#' is not the last level
     */
    public Registration set(String topicFilter, Consumer<HandlerList<H>> op) {
        Objects.requireNonNull(topicFilter, "topicFilter");
        Objects.requireNonNull(op, "op");
        Registration registration;
        try {
            registration = SubscriptionNormalizer.normalize(topicFilter);
        } catch (IllegalArgumentException e) {
            log.warn("subscription rejected: {}", e.getMessage());
            throw e;
        }
        tree.set(registration.matchPattern(), (slot, existed) -> {
            if (!existed) {
                slot.set(new HandlerList<>());
            }
            op.accept(slot.get());
        });
        log.debug("subscription added: {}", registration);
        return registration;
    }

    public Registration register(String topicFilter, H handler) {
        Objects.requireNonNull(handler, "handler");
        return set(topicFilter, handlers -> handlers.add(handler));
    }

    /**
     * handlers of the highest priority pattern that matches {@code topicName}
     */
    public Optional<List<H>> get(String topicName) {
        return match(topicName).map(r -> r.value().handlers());
    }

    public Optional<Route<HandlerList<H>>> match(String topicName) {
        return tree.match(topicName, SubscriptionIndex::hasHandlers);
    }

    /**
     * every pattern that matches {@code topicName}, exact before '+' before '#' at each level
     */
    public List<Route<HandlerList<H>>> matchAll(String topicName) {
        return tree.matchAll(topicName, SubscriptionIndex::hasHandlers);
    }

    /**
     * handlers of every matching pattern merged in {@link #matchAll(String)} order
     */
    public List<H> route(String topicName) {
        return matchAll(topicName).stream()
            .flatMap(r -> r.value().handlers().stream())
            .toList();
    }

    public void walk(NodeVisitor<? super HandlerList<H>> visitor) {
        tree.walk(visitor);
    }

    /**
     * number of patterns with at least one handler
     */
    public int size() {
        int[] count = {0};
        tree.walk((path, handlers, set) -> {
            if (set && hasHandlers(handlers)) {
                count[0] += 1;
            }
        });
        return count[0];
    }

    @Override
    public String toString() {
        return tree.toString();
    }

    private static boolean hasHandlers(HandlerList<?> handlers) {
        return handlers != null && !handlers.isEmpty();
    }

}
