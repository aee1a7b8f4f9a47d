package io.tagvault.core.crypto;

import java.io.IOException;

public interface KeyRingStore {
    /** Returns the stored ring, or {@code null} when none has been written yet. */
    KeyRing load() throws IOException;

    void save(KeyRing ring) throws IOException;
}
