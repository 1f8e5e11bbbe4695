package com.ryuqq.privatefm.application.reset;

import com.ryuqq.privatefm.core.model.LearnerId;
import com.ryuqq.privatefm.core.spi.ResetPermissionChecker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ResetApprovalPolicy 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResetApprovalPolicyTest {

    private static final LearnerId LEARNER = LearnerId.of("learner-1");

    @Mock
    private ResetPermissionChecker permissionChecker;

    private ResetApprovalPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new ResetApprovalPolicy(permissionChecker);
    }

    @Test
    void guardian은_권한_확인없이_자동_승인() {
        assertThat(policy.requiresApproval("guardian", "guardian-1", LEARNER)).isFalse();
        assertThat(policy.requiresApproval("GUARDIAN", "guardian-1", LEARNER)).isFalse();
        verifyNoInteractions(permissionChecker);
    }

    @Test
    void teacher는_권한이_있으면_자동_승인() {
        when(permissionChecker.canResetWithoutApproval("teacher-1", LEARNER)).thenReturn(true);

        assertThat(policy.requiresApproval("teacher", "teacher-1", LEARNER)).isFalse();
    }

    @Test
    void teacher는_권한이_없으면_승인_필요() {
        when(permissionChecker.canResetWithoutApproval("teacher-1", LEARNER)).thenReturn(false);

        assertThat(policy.requiresApproval("teacher", "teacher-1", LEARNER)).isTrue();
    }

    @Test
    void teacher_권한_확인이_실패하면_승인_필요() {
        when(permissionChecker.canResetWithoutApproval(anyString(), any()))
            .thenThrow(new IllegalStateException("permission store down"));

        assertThat(policy.requiresApproval("teacher", "teacher-1", LEARNER)).isTrue();
    }

    @Test
    void 그_외_역할은_항상_승인_필요() {
        assertThat(policy.requiresApproval("tutor", "tutor-1", LEARNER)).isTrue();
        assertThat(policy.requiresApproval(null, "someone", LEARNER)).isTrue();
        verifyNoInteractions(permissionChecker);
    }
}
