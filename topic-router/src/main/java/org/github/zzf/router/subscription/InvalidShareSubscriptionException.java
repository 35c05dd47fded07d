package org.github.zzf.router.subscription;

/**
 * '$share/&lt;group&gt;' without a topic, or '$queue' without a topic
 */
public class InvalidShareSubscriptionException extends IllegalArgumentException {

    private final String topicFilter;

    public InvalidShareSubscriptionException(String topicFilter) {
        super("invalid share subscription: should be $share/<group>/<topic> or $queue/<topic> -> " + topicFilter);
        this.topicFilter = topicFilter;
    }

    public String topicFilter() {
        return topicFilter;
    }

}
