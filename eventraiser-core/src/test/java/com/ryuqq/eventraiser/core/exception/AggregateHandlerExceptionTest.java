package com.ryuqq.eventraiser.core.exception;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AggregateHandlerException 유닛 테스트.
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
class AggregateHandlerExceptionTest {

    @Test
    void 모든_예외를_faults와_suppressed로_제공() {
        // given
        RuntimeException first = new RuntimeException("first");
        IllegalStateException second = new IllegalStateException("second");

        // when
        AggregateHandlerException exception = new AggregateHandlerException(List.of(first, second));

        // then
        assertThat(exception.getFaults()).containsExactly(first, second);
        assertThat(exception.getSuppressed()).containsExactly(first, second);
        assertThat(exception.getCause()).isSameAs(first);
        assertThat(exception).hasMessage("2 of the event handlers failed");
    }

    @Test
    void 빈_목록이면_예외() {
        assertThatThrownBy(() -> new AggregateHandlerException(List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("faults cannot be null or empty");
    }

    @Test
    void SignatureMismatchException은_IllegalArgumentException() {
        // when
        SignatureMismatchException exception = new SignatureMismatchException(String.class);

        // then
        assertThat(exception).isInstanceOf(IllegalArgumentException.class);
        assertThat(exception.getTargetType()).isEqualTo(String.class);
        assertThat(exception.getMessage()).contains("EventHandler<java.lang.String>");
    }
}
