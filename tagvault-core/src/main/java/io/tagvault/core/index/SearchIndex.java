package io.tagvault.core.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token to record-id index over serialized payload text, ranked by term overlap. Not
 * thread-safe: the owning store serializes access.
 */
public final class SearchIndex {
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}]+");
    private static final int MIN_TOKEN_LENGTH = 3;

    private final Map<String, Set<String>> idsByToken = new HashMap<>();
    private final Map<String, Set<String>> tokensById = new HashMap<>();
    // first-insertion order, kept across re-indexing, used to break score ties
    private final Map<String, Long> sequence = new HashMap<>();
    private long nextSequence;

    /** Lowercase word tokens longer than two characters, punctuation stripped, de-duplicated. */
    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String raw : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(raw);
            }
        }
        return tokens;
    }

    /** Replaces whatever was indexed for {@code id} with the tokens of {@code text}. */
    public void index(String id, String text) {
        removeTokens(id);
        Set<String> tokens = tokenize(text);
        sequence.computeIfAbsent(id, ignored -> nextSequence++);
        tokensById.put(id, tokens);
        for (String token : tokens) {
            idsByToken.computeIfAbsent(token, ignored -> new LinkedHashSet<>()).add(id);
        }
    }

    public void remove(String id) {
        removeTokens(id);
        tokensById.remove(id);
        sequence.remove(id);
    }

    public void clear() {
        idsByToken.clear();
        tokensById.clear();
        sequence.clear();
        nextSequence = 0;
    }

    public Set<String> ids() {
        return Set.copyOf(tokensById.keySet());
    }

    public Set<String> tokensOf(String id) {
        return Set.copyOf(tokensById.getOrDefault(id, Set.of()));
    }

    /** Ids touched by any query token, best score first, insertion order on ties. */
    public List<ScoredId> query(Collection<String> queryTokens) {
        Map<String, Integer> scores = new HashMap<>();
        for (String token : new LinkedHashSet<>(queryTokens)) {
            for (String id : idsByToken.getOrDefault(token, Set.of())) {
                scores.merge(id, 1, Integer::sum);
            }
        }
        List<ScoredId> ranked = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> ranked.add(new ScoredId(id, score)));
        ranked.sort(Comparator.comparingInt(ScoredId::score).reversed()
            .thenComparingLong(scored -> sequence.getOrDefault(scored.id(), Long.MAX_VALUE)));
        return ranked;
    }

    /** Every indexed id in insertion order, score zero. */
    public List<ScoredId> all() {
        List<ScoredId> out = new ArrayList<>(tokensById.size());
        tokensById.keySet().forEach(id -> out.add(new ScoredId(id, 0)));
        out.sort(Comparator.comparingLong(scored -> sequence.getOrDefault(scored.id(), Long.MAX_VALUE)));
        return out;
    }

    private void removeTokens(String id) {
        Set<String> previous = tokensById.get(id);
        if (previous == null) {
            return;
        }
        for (String token : previous) {
            Set<String> ids = idsByToken.get(token);
            if (ids != null) {
                ids.remove(id);
                if (ids.isEmpty()) {
                    idsByToken.remove(token);
                }
            }
        }
    }

    public record ScoredId(String id, int score) {
    }
}
