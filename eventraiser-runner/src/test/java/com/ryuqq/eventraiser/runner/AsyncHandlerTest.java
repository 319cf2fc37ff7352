package com.ryuqq.eventraiser.runner;

import com.ryuqq.eventraiser.core.handler.EventArgs;
import com.ryuqq.eventraiser.core.handler.EventHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AsyncHandler 유닛 테스트.
 *
 * <p>백그라운드 실행 동작을 검증합니다:</p>
 * <ul>
 *   <li>호출 즉시 반환</li>
 *   <li>완료 시 continuation 한 번 호출 (성공: null, 실패: 원본 예외)</li>
 *   <li>continuation 실패는 호출자에게 전파되지 않음</li>
 * </ul>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
@DisplayName("AsyncHandler 테스트")
class AsyncHandlerTest {

    private final Object source = new Object();

    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        executorService = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executorService.shutdownNow();
        executorService.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("핸들러 실행이 끝나기 전에 즉시 반환한다")
    void handle_즉시_반환() throws InterruptedException {
        // given
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        AtomicBoolean ran = new AtomicBoolean();
        EventHandler<EventArgs> blocking = (sender, args) -> {
            awaitQuietly(release);
            ran.set(true);
        };
        AsyncHandler<EventArgs> async = new AsyncHandler<>(blocking, executorService, failure -> finished.countDown());

        // when
        async.handle(source, EventArgs.EMPTY);

        // then: 반환 시점에는 아직 실행 중
        assertThat(ran.get()).isFalse();

        release.countDown();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(ran.get()).isTrue();
    }

    @Test
    @DisplayName("성공 시 continuation은 null로 한 번 호출된다")
    void handle_성공시_continuation_null() throws InterruptedException {
        // given
        CountDownLatch finished = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<Throwable> observed = new AtomicReference<>(new IllegalStateException("not called"));
        AsyncHandler<EventArgs> async = new AsyncHandler<>((sender, args) -> { }, executorService, failure -> {
            calls.incrementAndGet();
            observed.set(failure);
            finished.countDown();
        });

        // when
        async.handle(source, EventArgs.EMPTY);

        // then
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(observed.get()).isNull();
    }

    @Test
    @DisplayName("실패 시 continuation은 원본 예외를 받는다")
    void handle_실패시_continuation_원본_예외() throws InterruptedException {
        // given
        IllegalStateException failure = new IllegalStateException("boom");
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<Throwable> observed = new AtomicReference<>();
        AsyncHandler<EventArgs> async = new AsyncHandler<>((sender, args) -> {
            throw failure;
        }, executorService, error -> {
            observed.set(error);
            finished.countDown();
        });

        // when & then: 호출자에게는 예외가 전파되지 않음
        assertThatCode(() -> async.handle(source, EventArgs.EMPTY)).doesNotThrowAnyException();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(observed.get()).isSameAs(failure);
    }

    @Test
    @DisplayName("null 핸들러는 no-op 작업을 실행하고 continuation을 호출한다")
    void handle_null_핸들러_no_op() throws InterruptedException {
        // given
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<Throwable> observed = new AtomicReference<>(new IllegalStateException("not called"));
        AsyncHandler<EventArgs> async = new AsyncHandler<>(null, executorService, failure -> {
            observed.set(failure);
            finished.countDown();
        });

        // when
        async.handle(source, EventArgs.EMPTY);

        // then
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(observed.get()).isNull();
        assertThat(async.getDelegate()).isNull();
    }

    @Test
    @DisplayName("continuation이 실패해도 이후 작업은 계속 처리된다")
    void handle_continuation_실패_격리() throws InterruptedException {
        // given
        CountDownLatch secondRun = new CountDownLatch(1);
        AsyncHandler<EventArgs> failingContinuation = new AsyncHandler<>((sender, args) -> { }, executorService,
            failure -> {
                throw new IllegalStateException("continuation failed");
            });
        AsyncHandler<EventArgs> next = new AsyncHandler<>((sender, args) -> secondRun.countDown(), executorService,
            Continuation.observeAndDiscard());

        // when
        failingContinuation.handle(source, EventArgs.EMPTY);
        next.handle(source, EventArgs.EMPTY);

        // then
        assertThat(secondRun.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("생성자: Executor나 continuation이 null이면 IllegalArgumentException")
    void 생성자_검증() {
        assertThatThrownBy(() -> new AsyncHandler<EventArgs>(null, null, Continuation.observeAndDiscard()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("executor cannot be null");
        assertThatThrownBy(() -> new AsyncHandler<EventArgs>(null, executorService, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("continuation cannot be null");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
