package org.github.zzf.router.subscription;

import java.util.List;
import org.github.zzf.router.trie.Segments;

/**
 * Strips the delivery prefix of a topic filter.
 * <pre>
 * $share/&lt;group&gt;/&lt;topic...&gt;  -> shared, groupName = &lt;group&gt;
 * $queue/&lt;topic...&gt;           -> queue
 * </pre>
 * The prefix is checked first, then the '#' placement of what remains.
 */
public final class SubscriptionNormalizer {

    public static final String SHARE_PREFIX = "$share";
    public static final String QUEUE_PREFIX = "$queue";

    private SubscriptionNormalizer() {
    }

    /**
     * @throws InvalidShareSubscriptionException '$share' without group and topic, '$queue' without topic
     * @throws InvalidTopicPatternException      '#' is not the last level
     */
    public static Registration normalize(String topicFilter) {
        Registration registration = stripPrefix(topicFilter);
        String matchPattern = registration.matchPattern();
        if (!Segments.multiLevelWildcardLast(Segments.split(matchPattern))) {
            throw new InvalidTopicPatternException(topicFilter, matchPattern);
        }
        return registration;
    }

    private static Registration stripPrefix(String topicFilter) {
        List<String> levels = Segments.split(topicFilter);
        if (levels.isEmpty()) {
            return Registration.plain(topicFilter);
        }
        String first = levels.get(0);
        if (SHARE_PREFIX.equals(first)) {
            // $share/<group>/<topic-level...>
            if (levels.size() < 3) {
                throw new InvalidShareSubscriptionException(topicFilter);
            }
            String groupName = levels.get(1);
            // the raw rest keeps its trailing levels, it is split once more by the tree
            int from = SHARE_PREFIX.length() + groupName.length() + 2;
            return Registration.shared(topicFilter, groupName, topicFilter.substring(from));
        }
        if (QUEUE_PREFIX.equals(first)) {
            // $queue/<topic-level...>
            if (levels.size() < 2) {
                throw new InvalidShareSubscriptionException(topicFilter);
            }
            return Registration.queue(topicFilter, topicFilter.substring(QUEUE_PREFIX.length() + 1));
        }
        return Registration.plain(topicFilter);
    }

}
