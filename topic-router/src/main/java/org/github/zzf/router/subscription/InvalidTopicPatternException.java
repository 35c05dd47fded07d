package org.github.zzf.router.subscription;

import org.github.zzf.router.trie.InvalidPatternException;

/**
 * a subscription whose pattern, once the '$share' / '$queue' prefix is stripped, has a '#' that
 * is not the last level
 */
public class InvalidTopicPatternException extends InvalidPatternException {

    private final String topicFilter;

    public InvalidTopicPatternException(String topicFilter, String matchPattern) {
        super("invalid topic pattern: '#' must be the last level of " + topicFilter, matchPattern);
        this.topicFilter = topicFilter;
    }

    public String topicFilter() {
        return topicFilter;
    }

}
