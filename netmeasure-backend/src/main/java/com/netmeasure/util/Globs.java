package com.netmeasure.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Expands {@code *} patterns against a list of names.
 */
public final class Globs {

    private Globs() {
    }

    /**
     * Expands patterns in order against the candidate names.
     *
     * @param patterns names or patterns containing {@code *}
     * @param names candidate names
     * @param exclude names never returned
     * @return matching names, each once, in pattern then candidate order
     */
    public static List<String> expand(Collection<String> patterns, Collection<String> names, Collection<String> exclude) {
        Set<String> out = new LinkedHashSet<>();
        for (String pattern : patterns) {
            if (!pattern.contains("*")) {
                if (names.contains(pattern)) {
                    out.add(pattern);
                }
                continue;
            }
            Pattern regex = toRegex(pattern);
            for (String name : names) {
                if (regex.matcher(name).matches()) {
                    out.add(name);
                }
            }
        }
        out.removeAll(exclude);
        return new ArrayList<>(out);
    }

    private static Pattern toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        for (String part : glob.split("\\*", -1)) {
            if (sb.length() > 0) {
                sb.append(".*");
            }
            sb.append(Pattern.quote(part));
        }
        return Pattern.compile(sb.toString());
    }
}
