package io.tagvault.core.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tag normalization and hierarchical expansion. Hierarchy levels are separated by {@code ':'},
 * so {@code "a:b:c"} expands to {@code "a"}, {@code "a:b"} and {@code "a:b:c"}.
 */
public final class Tags {
    public static final char SEPARATOR = ':';

    private Tags() {
    }

    /**
     * Trims and lower-cases every tag, dropping duplicates while keeping first-seen order.
     *
     * @throws IllegalArgumentException if any tag is null, blank, or has an empty hierarchy segment
     */
    public static List<String> normalize(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String tag : tags) {
            out.add(normalize(tag));
        }
        return List.copyOf(out);
    }

    public static String normalize(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (String segment : normalized.split(String.valueOf(SEPARATOR), -1)) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("tag has an empty hierarchy segment: " + tag);
            }
        }
        return normalized;
    }

    /** Every prefix of an already normalized tag, shortest first, the tag itself last. */
    public static List<String> prefixes(String tag) {
        List<String> out = new ArrayList<>();
        int index = tag.indexOf(SEPARATOR);
        while (index >= 0) {
            out.add(tag.substring(0, index));
            index = tag.indexOf(SEPARATOR, index + 1);
        }
        out.add(tag);
        return out;
    }

    public static Set<String> expand(Collection<String> tags) {
        Set<String> out = new LinkedHashSet<>();
        for (String tag : tags) {
            out.addAll(prefixes(tag));
        }
        return out;
    }
}
