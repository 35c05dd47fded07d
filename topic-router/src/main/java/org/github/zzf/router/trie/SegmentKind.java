package org.github.zzf.router.trie;

/**
 * kind of one topic level in a pattern
 */
public enum SegmentKind {

    /**
     * matches only the identical level, the empty string included
     */
    LITERAL,

    /**
     * '+', matches exactly one level
     */
    SINGLE,

    /**
     * '#', matches one or more trailing levels. must be the last level of a pattern
     */
    MULTI,

}
