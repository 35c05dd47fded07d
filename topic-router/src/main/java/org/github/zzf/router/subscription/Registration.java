package org.github.zzf.router.subscription;

/**
 * A subscription after its delivery prefix has been stripped.
 * <p>
 * Only {@code matchPattern} goes into the topic tree. {@code shared}, {@code groupName} and
 * {@code queue} are for the transport to balance delivery and never affect matching.
 *
 * @param rawPattern   the topic filter as subscribed, e.g. '$share/g1/device/+/state'
 * @param shared       '$share/&lt;group&gt;/...'
 * @param groupName    the share group, null unless {@code shared}
 * @param queue        '$queue/...'
 * @param matchPattern the pattern inserted into the tree, e.g. 'device/+/state'
 */
public record Registration(String rawPattern,
                           boolean shared,
                           String groupName,
                           boolean queue,
                           String matchPattern) {

    static Registration plain(String pattern) {
        return new Registration(pattern, false, null, false, pattern);
    }

    static Registration shared(String rawPattern, String groupName, String matchPattern) {
        return new Registration(rawPattern, true, groupName, false, matchPattern);
    }

    static Registration queue(String rawPattern, String matchPattern) {
        return new Registration(rawPattern, false, null, true, matchPattern);
    }

}
