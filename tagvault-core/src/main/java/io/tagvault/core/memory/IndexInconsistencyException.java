package io.tagvault.core.memory;

/**
 * An index referenced a record id that is not in the record table.
 */
public final class IndexInconsistencyException extends IllegalStateException {

    public IndexInconsistencyException(String id) {
        super("Index references missing memory " + id);
    }
}
