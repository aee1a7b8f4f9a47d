package io.tagvault.core.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps tags to record ids. A hierarchical tag is registered under each of its prefixes so a
 * query for {@code "a"} finds records tagged {@code "a:b:c"}. Not thread-safe: the owning store
 * serializes access.
 */
public final class TagIndex {
    private final Map<String, Set<String>> idsByTag = new HashMap<>();
    private final Map<String, Set<String>> tagsById = new HashMap<>();

    /** Adds tags to a record. Tags must already be normalized. */
    public void tag(String id, Collection<String> tags) {
        if (tags.isEmpty()) {
            return;
        }
        Set<String> current = tagsById.getOrDefault(id, Set.of());
        Set<String> next = new LinkedHashSet<>(current);
        next.addAll(tags);
        replace(id, current, next);
    }

    /** Removes tags from a record. Tags must already be normalized. */
    public void untag(String id, Collection<String> tags) {
        Set<String> current = tagsById.get(id);
        if (current == null) {
            return;
        }
        Set<String> next = new LinkedHashSet<>(current);
        next.removeAll(tags);
        replace(id, current, next);
    }

    /** Drops every entry for a record. */
    public void remove(String id) {
        Set<String> current = tagsById.get(id);
        if (current != null) {
            replace(id, current, Set.of());
        }
    }

    public void clear() {
        idsByTag.clear();
        tagsById.clear();
    }

    public List<String> tagsOf(String id) {
        return List.copyOf(tagsById.getOrDefault(id, Set.of()));
    }

    /** Record ids under one tag, matching at {@code ':'} boundaries. */
    public Set<String> getByTag(String tag) {
        return Set.copyOf(idsByTag.getOrDefault(tag, Set.of()));
    }

    /**
     * Intersection ({@code requireAll}) or union of the id sets of each tag. An empty tag list
     * matches nothing.
     */
    public Set<String> getByTags(Collection<String> tags, boolean requireAll) {
        if (tags.isEmpty()) {
            return Set.of();
        }
        Set<String> result = null;
        for (String tag : tags) {
            Set<String> ids = idsByTag.getOrDefault(tag, Set.of());
            if (result == null) {
                result = new HashSet<>(ids);
            } else if (requireAll) {
                result.retainAll(ids);
            } else {
                result.addAll(ids);
            }
            if (requireAll && result.isEmpty()) {
                break;
            }
        }
        return result;
    }

    /** Every id referenced by the index. */
    public Set<String> ids() {
        return Set.copyOf(tagsById.keySet());
    }

    public boolean contains(String tag) {
        return idsByTag.containsKey(tag);
    }

    /** Assigned tags (not implied prefixes). */
    public Set<String> allTags() {
        Set<String> out = new HashSet<>();
        tagsById.values().forEach(out::addAll);
        return out;
    }

    /** Assigned tags containing, or contained in, the given text. */
    public List<String> similar(String tag, int maxResults) {
        String needle = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty() || maxResults <= 0) {
            return List.of();
        }
        return allTags().stream()
            .filter(existing -> existing.contains(needle) || needle.contains(existing))
            .sorted()
            .limit(maxResults)
            .toList();
    }

    public TagStats stats() {
        Map<String, Integer> counts = new HashMap<>();
        for (Set<String> tags : tagsById.values()) {
            for (String tag : tags) {
                counts.merge(tag, 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));
        Map<String, Integer> ordered = new LinkedHashMap<>();
        sorted.forEach(entry -> ordered.put(entry.getKey(), entry.getValue()));
        return new TagStats(counts.size(), tagsById.size(), ordered);
    }

    private void replace(String id, Set<String> current, Set<String> next) {
        Set<String> before = Tags.expand(current);
        Set<String> after = Tags.expand(next);

        for (String key : before) {
            if (!after.contains(key)) {
                Set<String> ids = idsByTag.get(key);
                if (ids != null) {
                    ids.remove(id);
                    if (ids.isEmpty()) {
                        idsByTag.remove(key);
                    }
                }
            }
        }
        for (String key : after) {
            idsByTag.computeIfAbsent(key, ignored -> new HashSet<>()).add(id);
        }

        if (next.isEmpty()) {
            tagsById.remove(id);
        } else {
            tagsById.put(id, next);
        }
    }
}
