package io.tagvault.core.crypto;

/**
 * A sealed payload could not be opened with any key in the ring.
 */
public final class DecryptionException extends Exception {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
