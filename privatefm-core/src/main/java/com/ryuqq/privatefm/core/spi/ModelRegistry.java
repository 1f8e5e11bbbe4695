package com.ryuqq.privatefm.core.spi;

import java.util.Optional;

/**
 * Foundation model registry SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ModelRegistry {

    /**
     * Latest published foundation model version, e.g. {@code fm-v2.3.1}.
     *
     * @return the latest version
     * @throws com.ryuqq.privatefm.core.exception.TransientException if the registry is temporarily unavailable
     */
    String latestVersion();

    /**
     * Base adapter weights of a foundation model version for one subject.
     *
     * @param version foundation model version
     * @param subject subject code
     * @return the base weights, or empty if the version/subject is unknown
     */
    Optional<byte[]> getBaseModel(String version, String subject);
}
