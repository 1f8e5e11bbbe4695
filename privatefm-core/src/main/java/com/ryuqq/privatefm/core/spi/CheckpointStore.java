package com.ryuqq.privatefm.core.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Key-value blob store SPI for checkpoints, adapters, integrity markers and job statistics.
 *
 * <p><strong>Key layout:</strong></p>
 * <pre>
 * checkpoint:{hash}                  checkpoint metadata (JSON)
 * checkpoint:{hash}:integrity        "verified" marker
 * adapter:{nsUid}:{subject}          adapter weights
 * adapter:{nsUid}:{subject}:{step}   intermediate adapter checkpoints
 * metadata:{nsUid}:{subject}         training metadata (JSON)
 * namespace:{nsUid}:resources        resource quota (JSON)
 * job_stats:{job}:{yyyyMMdd}         sweep report (JSON)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>Expired keys must behave as absent for {@link #get(String)}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CheckpointStore {

    /**
     * Stores a value without expiry.
     *
     * @param key the key
     * @param value the value bytes
     * @throws IllegalArgumentException if key or value is null
     */
    void put(String key, byte[] value);

    /**
     * Stores a value that expires after {@code ttl}.
     *
     * @param key the key
     * @param value the value bytes
     * @param ttl time to live, positive
     * @throws IllegalArgumentException if any argument is null or ttl is not positive
     */
    void put(String key, byte[] value, Duration ttl);

    /**
     * Reads a value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Optional<byte[]> get(String key);

    /**
     * Deletes a key. Deleting an absent key is a no-op.
     *
     * @param key the key
     * @return true if a value was removed
     */
    boolean delete(String key);

    /**
     * Lists keys starting with the given prefix (expired keys excluded).
     *
     * @param prefix key prefix, empty string for all keys
     * @return matching keys in no particular order
     */
    List<String> listKeys(String prefix);

    /**
     * Returns the expiry instant of a key.
     *
     * @param key the key
     * @return the expiry, or empty if the key is absent or has no expiry
     */
    Optional<Instant> expiresAt(String key);

    /**
     * Sets the expiry of an existing key.
     *
     * @param key the key
     * @param ttl time to live from now
     * @return true if the key exists and the expiry was set
     */
    boolean expire(String key, Duration ttl);

    /**
     * Physically removes expired keys.
     *
     * @return number of keys removed
     */
    int evictExpired();
}
