package io.tagvault.core.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;
import org.junit.jupiter.api.Test;

class TagIndexTest {

    @Test
    void shouldMatchHierarchicalPrefixesOnSeparatorBoundaries() {
        TagIndex index = new TagIndex();
        index.tag("r1", List.of("a:b:c"));
        index.tag("r2", List.of("ab"));

        assertThat(index.getByTag("a")).containsExactly("r1");
        assertThat(index.getByTag("a:b")).containsExactly("r1");
        assertThat(index.getByTag("a:b:c")).containsExactly("r1");
        assertThat(index.getByTag("ab")).containsExactly("r2");
        assertThat(index.getByTag("a:b:c:d")).isEmpty();
    }

    @Test
    void shouldIntersectOrUnionTagSets() {
        TagIndex index = new TagIndex();
        index.tag("r1", List.of("reminder", "shopping"));
        index.tag("r2", List.of("reminder"));
        index.tag("r3", List.of("family"));

        assertThat(index.getByTags(List.of("reminder", "shopping"), true)).containsExactly("r1");
        assertThat(index.getByTags(List.of("shopping", "family"), false)).containsExactlyInAnyOrder("r1", "r3");
        assertThat(index.getByTags(List.of("reminder", "unknown"), true)).isEmpty();
        assertThat(index.getByTags(List.of(), true)).isEmpty();
    }

    @Test
    void shouldDropEmptyTagEntries() {
        TagIndex index = new TagIndex();
        index.tag("r1", List.of("a:b"));

        index.untag("r1", List.of("a:b"));

        assertThat(index.contains("a")).isFalse();
        assertThat(index.contains("a:b")).isFalse();
        assertThat(index.ids()).isEmpty();
    }

    @Test
    void shouldKeepPrefixStillImpliedByAnotherTag() {
        TagIndex index = new TagIndex();
        index.tag("r1", List.of("a:b:c", "a:x"));

        index.untag("r1", List.of("a:b:c"));

        assertThat(index.getByTag("a")).containsExactly("r1");
        assertThat(index.contains("a:b")).isFalse();
        assertThat(index.tagsOf("r1")).containsExactly("a:x");
    }

    @Test
    void shouldRemoveRecordEverywhere() {
        TagIndex index = new TagIndex();
        index.tag("r1", List.of("x", "y:z"));
        index.tag("r2", List.of("x"));

        index.remove("r1");

        assertThat(index.getByTag("x")).containsExactly("r2");
        assertThat(index.contains("y")).isFalse();
        assertThat(index.ids()).containsExactly("r2");
    }

    @Test
    void shouldReportStatsAndSimilarTags() {
        TagIndex index = new TagIndex();
        index.tag("r1", List.of("shopping", "reminder"));
        index.tag("r2", List.of("shopping"));

        TagStats stats = index.stats();

        assertThat(stats.totalTags()).isEqualTo(2);
        assertThat(stats.taggedRecords()).isEqualTo(2);
        assertThat(stats.counts()).containsExactly(
            entry("shopping", 2),
            entry("reminder", 1)
        );
        assertThat(index.similar("shop", 5)).containsExactly("shopping");
    }
}
