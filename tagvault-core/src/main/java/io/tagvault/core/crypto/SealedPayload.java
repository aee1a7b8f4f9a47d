package io.tagvault.core.crypto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * Ciphertext of a serialized payload. {@code iv} and {@code data} are Base64; {@code data}
 * includes the GCM authentication tag.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SealedPayload(
    String method,
    String iv,
    String data
) {

    public SealedPayload {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(iv, "iv must not be null");
        Objects.requireNonNull(data, "data must not be null");
    }
}
