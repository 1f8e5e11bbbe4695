package com.ryuqq.privatefm.core.spi;

import com.ryuqq.privatefm.core.model.Namespace;

import java.util.Map;

/**
 * Opaque merge step combining the foundation model with a namespace's adapters.
 *
 * <p>The training algorithm itself is out of scope; implementations only report
 * statistics. A {@link com.ryuqq.privatefm.core.exception.TransientException} is retried by the
 * coordinator, a {@link com.ryuqq.privatefm.core.exception.FatalException} marks the namespace corrupted.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AdapterMerger {

    /**
     * Merges adapters of the namespace into the target foundation model version.
     *
     * @param namespace the namespace being merged
     * @param fmVersion target foundation model version
     * @return merge statistics (e.g. adapters_merged, parameters_updated)
     */
    Map<String, Object> merge(Namespace namespace, String fmVersion);
}
