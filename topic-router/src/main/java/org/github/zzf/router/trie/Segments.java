package org.github.zzf.router.trie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Topic level helpers shared by every index.
 * <p>
 * 'a/b/' is the same as 'a/b', 'a//b' keeps the empty level and '' or '/' is the root.
 */
public final class Segments {

    public static final String LEVEL_SEPARATOR = "/";
    public static final String MULTI_LEVEL_WILDCARD = "#";
    public static final String SINGLE_LEVEL_WILDCARD = "+";

    private static final char SEPARATOR_CHAR = '/';

    private Segments() {
    }

    public static SegmentKind classify(String token) {
        if (MULTI_LEVEL_WILDCARD.equals(token)) {
            return SegmentKind.MULTI;
        }
        if (SINGLE_LEVEL_WILDCARD.equals(token)) {
            return SegmentKind.SINGLE;
        }
        return SegmentKind.LITERAL;
    }

    /**
     * split a pattern or a topic into levels.
     * <p>String#split drops every trailing empty token, so the levels are cut by hand.</p>
     */
    public static List<String> split(String path) {
        List<String> levels = new ArrayList<>(4);
        int from = 0;
        int idx;
        while ((idx = path.indexOf(SEPARATOR_CHAR, from)) != -1) {
            levels.add(path.substring(from, idx));
            from = idx + 1;
        }
        levels.add(path.substring(from));
        // only one trailing empty level is dropped
        if (levels.size() > 1 && levels.get(levels.size() - 1).isEmpty()) {
            levels.remove(levels.size() - 1);
        }
        // "" and "/" address the root node
        if (levels.size() == 1 && levels.get(0).isEmpty()) {
            return Collections.emptyList();
        }
        return levels;
    }

    public static String join(List<String> levels) {
        return String.join(LEVEL_SEPARATOR, levels);
    }

    /**
     * the textual route of a matched node: '/a/+/c', or '' for the root
     */
    public static String route(List<String> levels) {
        if (levels.isEmpty()) {
            return "";
        }
        return LEVEL_SEPARATOR + join(levels);
    }

    /**
     * sport/tennis/#/ranking is not valid
     *
     * @throws InvalidPatternException if '#' is not the last level
     */
    public static void validate(String pattern, List<String> levels) {
        if (!multiLevelWildcardLast(levels)) {
            throw new InvalidPatternException(pattern);
        }
    }

    public static boolean multiLevelWildcardLast(List<String> levels) {
        int lastIdx = levels.size() - 1;
        for (int i = 0; i < lastIdx; i++) {
            if (classify(levels.get(i)) == SegmentKind.MULTI) {
                return false;
            }
        }
        return true;
    }

    /**
     * the children of {@code node} a topic level descends into, exact match first.
     */
    public static <T> List<Node<T>> candidateChildren(Node<T> node, String level) {
        List<Node<T>> ret = new ArrayList<>(3);
        Node<T> n;
        if ((n = node.literalChild(level)) != null) {
            ret.add(n);
        }
        if ((n = node.singleLevelChild()) != null) {
            ret.add(n);
        }
        if ((n = node.multiLevelChild()) != null) {
            ret.add(n);
        }
        return ret;
    }

}
