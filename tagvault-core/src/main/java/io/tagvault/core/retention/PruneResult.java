package io.tagvault.core.retention;

public record PruneResult(int expired, int evicted) {
    public static final PruneResult NONE = new PruneResult(0, 0);

    public int total() {
        return expired + evicted;
    }
}
