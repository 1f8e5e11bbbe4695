package com.ryuqq.privatefm.adapter.inmemory.external;

import com.ryuqq.privatefm.core.spi.ModelRegistry;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ModelRegistry} with a configurable latest version.
 *
 * <p>Every (version, subject) pair has a synthetic base model unless it was marked missing
 * through {@link #removeBaseModel(String, String)}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StaticModelRegistry implements ModelRegistry {

    private volatile String latestVersion;
    private final Set<String> missing = ConcurrentHashMap.newKeySet();

    public StaticModelRegistry(String latestVersion) {
        setLatestVersion(latestVersion);
    }

    @Override
    public String latestVersion() {
        return latestVersion;
    }

    @Override
    public Optional<byte[]> getBaseModel(String version, String subject) {
        if (missing.contains(key(version, subject))) {
            return Optional.empty();
        }
        return Optional.of(("base-model:" + version + ":" + subject).getBytes(StandardCharsets.UTF_8));
    }

    public void setLatestVersion(String latestVersion) {
        if (latestVersion == null || latestVersion.isBlank()) {
            throw new IllegalArgumentException("latestVersion cannot be null or blank");
        }
        this.latestVersion = latestVersion;
    }

    public void removeBaseModel(String version, String subject) {
        missing.add(key(version, subject));
    }

    private static String key(String version, String subject) {
        return version + "|" + subject;
    }
}
