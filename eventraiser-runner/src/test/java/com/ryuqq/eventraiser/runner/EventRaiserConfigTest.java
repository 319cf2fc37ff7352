package com.ryuqq.eventraiser.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventRaiserConfig 유닛 테스트.
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
@DisplayName("EventRaiserConfig 테스트")
class EventRaiserConfigTest {

    @Test
    @DisplayName("기본 설정은 공용 ForkJoinPool과 observeAndDiscard continuation을 사용한다")
    void 기본_설정값() {
        // when
        EventRaiserConfig config = new EventRaiserConfig();

        // then
        assertThat(config.executor()).isSameAs(ForkJoinPool.commonPool());
        assertThat(config.defaultContinuation()).isSameAs(Continuation.observeAndDiscard());
    }

    @Test
    @DisplayName("withExecutor는 executor만 바꾼 새 인스턴스를 반환한다")
    void withExecutor_새_인스턴스() {
        // given
        EventRaiserConfig original = new EventRaiserConfig();
        Executor direct = Runnable::run;

        // when
        EventRaiserConfig changed = original.withExecutor(direct);

        // then
        assertThat(changed).isNotSameAs(original);
        assertThat(changed.executor()).isSameAs(direct);
        assertThat(changed.defaultContinuation()).isSameAs(original.defaultContinuation());
        assertThat(original.executor()).isSameAs(ForkJoinPool.commonPool());
    }

    @Test
    @DisplayName("withDefaultContinuation은 continuation만 바꾼 새 인스턴스를 반환한다")
    void withDefaultContinuation_새_인스턴스() {
        // given
        EventRaiserConfig original = new EventRaiserConfig();
        Continuation continuation = failure -> { };

        // when
        EventRaiserConfig changed = original.withDefaultContinuation(continuation);

        // then
        assertThat(changed.defaultContinuation()).isSameAs(continuation);
        assertThat(changed.executor()).isSameAs(original.executor());
    }

    @Test
    @DisplayName("null 값은 허용하지 않는다")
    void null_검증() {
        assertThatThrownBy(() -> new EventRaiserConfig(null, Continuation.observeAndDiscard()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("executor cannot be null");
        assertThatThrownBy(() -> new EventRaiserConfig().withDefaultContinuation(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("defaultContinuation cannot be null");
    }
}
