package com.ryuqq.privatefm.application.context;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OrchestratorConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OrchestratorConfigTest {

    @Test
    void 기본값() {
        OrchestratorConfig config = new OrchestratorConfig();

        assertThat(config.guardianApiKey()).isNull();
        assertThat(config.maxVersionLag()).isEqualTo(3);
        assertThat(config.strictMaxVersionLag()).isEqualTo(5);
        assertThat(config.checkpointRetention()).isEqualTo(Duration.ofDays(30));
        assertThat(config.maxNamespaceSizeGb()).isEqualTo(10.0);
        assertThat(config.staleMergeThreshold()).isEqualTo(Duration.ofHours(48));
        assertThat(config.mergeMaxAttempts()).isEqualTo(3);
    }

    @Test
    void fromEnvironment_환경_변수를_읽음() {
        OrchestratorConfig config = OrchestratorConfig.fromEnvironment(Map.of(
            "GUARDIAN_API_KEY", "secret",
            "MAX_VERSION_LAG", "7",
            "CHECKPOINT_RETENTION_DAYS", "14",
            "MAX_NAMESPACE_SIZE_GB", "2.5"
        ));

        assertThat(config.guardianApiKey()).isEqualTo("secret");
        assertThat(config.maxVersionLag()).isEqualTo(7);
        assertThat(config.strictMaxVersionLag()).isEqualTo(7);
        assertThat(config.checkpointRetention()).isEqualTo(Duration.ofDays(14));
        assertThat(config.maxNamespaceSizeGb()).isEqualTo(2.5);
    }

    @Test
    void fromEnvironment_비어있으면_기본값() {
        assertThat(OrchestratorConfig.fromEnvironment(Map.of())).isEqualTo(new OrchestratorConfig());
    }

    @Test
    void fromEnvironment_빈_Guardian_키는_설정되지_않은_것으로_취급() {
        assertThat(OrchestratorConfig.fromEnvironment(Map.of("GUARDIAN_API_KEY", "  ")).guardianApiKey()).isNull();
    }

    @Test
    void fromEnvironment_숫자_형식이_틀리면_IllegalArgumentException() {
        assertThatThrownBy(() -> OrchestratorConfig.fromEnvironment(Map.of("MAX_VERSION_LAG", "three")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("MAX_VERSION_LAG");
    }

    @Test
    void 유효하지_않은_값은_거부함() {
        OrchestratorConfig defaults = new OrchestratorConfig();

        assertThatThrownBy(() -> defaults.withMaxVersionLag(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withMaxVersionLag(6))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("strictMaxVersionLag");
        assertThatThrownBy(() -> defaults.withMergeMaxAttempts(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withBackoff(500, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withCheckpointRetention(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
