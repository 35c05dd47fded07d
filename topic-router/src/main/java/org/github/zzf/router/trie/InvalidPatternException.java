package org.github.zzf.router.trie;

/**
 * thrown when a multi-level wildcard is not the last level of a pattern
 */
public class InvalidPatternException extends IllegalArgumentException {

    private final String pattern;

    public InvalidPatternException(String pattern) {
        this("invalid pattern: '#' must be the last level, pattern should be a/b/c or a/+/c or a/#", pattern);
    }

    protected InvalidPatternException(String message, String pattern) {
        super(message + " -> " + pattern);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }

}
