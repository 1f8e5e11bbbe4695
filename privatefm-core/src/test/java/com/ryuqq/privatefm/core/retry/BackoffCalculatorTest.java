package com.ryuqq.privatefm.core.retry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void calculate_지수적으로_증가함() {
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.0);

        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(2)).isEqualTo(200);
        assertThat(calculator.calculate(3)).isEqualTo(400);
    }

    @Test
    void calculate_최대값을_넘지_않음() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 5000, 1.0);

        for (int attempt = 1; attempt <= 100; attempt++) {
            assertThat(calculator.calculate(attempt)).isBetween(1000L, 5000L);
        }
    }

    @Test
    void calculate_jitter는_지수값의_비율_이내() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 60_000, 0.1);

        long delay = calculator.calculate(2);

        assertThat(delay).isBetween(2000L, 2200L);
    }

    @Test
    void calculate_attemptCount가_0이하면_예외() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attemptCount");
    }

    @Test
    void 생성자_잘못된_파라미터면_예외() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 100, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 50, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
