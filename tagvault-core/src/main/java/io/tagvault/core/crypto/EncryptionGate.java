package io.tagvault.core.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagvault.core.config.model.EncryptionConfig;
import io.tagvault.core.index.Tags;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which payloads are sealed at rest and seals/opens them with AES-GCM.
 *
 * <p>The gate keeps a current key and the key it replaced. Once the current key is older than the
 * rotation period a new key is generated and persisted before it is used; records sealed under the
 * retired key stay readable until the next rotation.
 */
public final class EncryptionGate {
    private static final Logger LOG = LoggerFactory.getLogger(EncryptionGate.class);

    public static final String METHOD = "AES/GCM/NoPadding";
    private static final int KEY_BITS = 256;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final boolean enabled;
    private final Set<String> sensitiveTags;
    private final Duration rotationPeriod;
    private final KeyRingStore keyRingStore;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final SecureRandom random = new SecureRandom();
    private volatile KeyRing ring;
    private volatile long rotations;

    public EncryptionGate(EncryptionConfig config, KeyRingStore keyRingStore, Clock clock) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        this.keyRingStore = Objects.requireNonNull(keyRingStore, "keyRingStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.enabled = config.enabled();
        this.sensitiveTags = Set.copyOf(Tags.normalize(config.sensitiveTags()));
        this.rotationPeriod = Duration.ofDays(config.keyRotationDays());

        KeyRing stored = keyRingStore.load();
        if (stored == null) {
            stored = new KeyRing(generateKey(), null, clock.instant());
            keyRingStore.save(stored);
            LOG.info("Generated new encryption key ring");
        }
        this.ring = stored;
        rotateIfDue();
    }

    public boolean enabled() {
        return enabled;
    }

    public Set<String> sensitiveTags() {
        return sensitiveTags;
    }

    /**
     * True when encryption is enabled and any tag, or any hierarchical prefix of a tag, is in the
     * sensitive set. Tags must already be normalized.
     */
    public boolean shouldEncrypt(Collection<String> tags) {
        if (!enabled || tags == null || tags.isEmpty()) {
            return false;
        }
        for (String tag : Tags.expand(tags)) {
            if (sensitiveTags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    public SealedPayload encrypt(JsonNode payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        rotateIfDue();
        try {
            byte[] plaintext = mapper.writeValueAsBytes(payload);
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(METHOD);
            cipher.init(Cipher.ENCRYPT_MODE, key(ring.currentKey()), new GCMParameterSpec(TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);
            Base64.Encoder encoder = Base64.getEncoder();
            return new SealedPayload(METHOD, encoder.encodeToString(iv), encoder.encodeToString(ciphertext));
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Failed to encrypt payload", e);
        }
    }

    /** Opens a sealed payload with the current key, falling back to the previous key. */
    public JsonNode decrypt(SealedPayload sealed) throws DecryptionException {
        Objects.requireNonNull(sealed, "sealed must not be null");
        if (!METHOD.equals(sealed.method())) {
            throw new DecryptionException("Unsupported encryption method: " + sealed.method());
        }
        KeyRing snapshot = ring;
        byte[] iv;
        byte[] ciphertext;
        try {
            iv = Base64.getDecoder().decode(sealed.iv());
            ciphertext = Base64.getDecoder().decode(sealed.data());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Sealed payload is not valid Base64", e);
        }

        GeneralSecurityException failure;
        try {
            return open(snapshot.currentKey(), iv, ciphertext);
        } catch (GeneralSecurityException e) {
            failure = e;
        }
        if (snapshot.hasPreviousKey()) {
            try {
                return open(snapshot.previousKey(), iv, ciphertext);
            } catch (GeneralSecurityException e) {
                failure.addSuppressed(e);
            }
        }
        throw new DecryptionException("Payload could not be decrypted with any available key", failure);
    }

    /**
     * Rotates the key ring when the current key has reached the rotation period. Safe to call
     * from many threads: only the first caller to see an expired key rotates.
     *
     * @return true if this call rotated the key
     */
    public synchronized boolean rotateIfDue() {
        Instant now = clock.instant();
        if (ring.age(now).compareTo(rotationPeriod) < 0) {
            return false;
        }
        return rotate(now);
    }

    /** Rotates unconditionally. */
    public synchronized boolean rotateNow() {
        return rotate(clock.instant());
    }

    public Instant keyCreatedAt() {
        return ring.createdAt();
    }

    /**
     * Number of rotations performed by this gate. Records sealed before the second-to-last
     * rotation can no longer be opened, so callers compare this value to re-seal in time.
     */
    public long rotations() {
        return rotations;
    }

    private boolean rotate(Instant now) {
        KeyRing rotated;
        try {
            rotated = ring.rotate(generateKey(), now);
            keyRingStore.save(rotated);
        } catch (IOException e) {
            // a key is only used once it is on disk
            LOG.error("Failed to persist rotated key ring, keeping current key: {}", e.getMessage());
            return false;
        }
        ring = rotated;
        rotations++;
        LOG.info("Rotated encryption key");
        return true;
    }

    private JsonNode open(String encodedKey, byte[] iv, byte[] ciphertext) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(METHOD);
        cipher.init(Cipher.DECRYPT_MODE, key(encodedKey), new GCMParameterSpec(TAG_BITS, iv));
        byte[] plaintext = cipher.doFinal(ciphertext);
        try {
            return mapper.readTree(plaintext);
        } catch (IOException e) {
            throw new GeneralSecurityException("Decrypted payload is not valid JSON", e);
        }
    }

    private static SecretKey key(String encoded) {
        return new SecretKeySpec(Base64.getDecoder().decode(encoded), "AES");
    }

    private static String generateKey() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(KEY_BITS);
            return Base64.getEncoder().encodeToString(generator.generateKey().getEncoded());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("AES is not available", e);
        }
    }
}
