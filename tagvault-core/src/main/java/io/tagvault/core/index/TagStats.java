package io.tagvault.core.index;

import java.util.Map;

/**
 * Tag usage summary. {@code counts} holds assigned tags only (not their implied prefixes),
 * most used first.
 */
public record TagStats(
    int totalTags,
    int taggedRecords,
    Map<String, Integer> counts
) {
}
