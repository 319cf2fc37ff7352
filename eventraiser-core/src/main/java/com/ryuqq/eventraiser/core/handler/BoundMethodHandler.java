package com.ryuqq.eventraiser.core.handler;

import com.ryuqq.eventraiser.core.exception.HandlerInvocationException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

/**
 * 리플렉션 메서드 바인딩 핸들러.
 *
 * <p>대상 객체(receiver)와 메서드의 쌍을 elementary 핸들러로 표현합니다.
 * {@code EventHandler}가 아닌 함수형 객체나 임의의 메서드를 어댑터가 변환할 때 생성됩니다.</p>
 *
 * <p><strong>동일성:</strong> 같은 receiver 인스턴스(identity)와 같은 메서드를 가리키면 동일한 핸들러입니다.</p>
 *
 * <p><strong>예외 전파:</strong></p>
 * <ul>
 *   <li>RuntimeException, Error: 감싸지 않고 그대로 전파</li>
 *   <li>checked 예외, 접근 실패: {@link HandlerInvocationException}으로 감싸서 전파</li>
 * </ul>
 *
 * <p>시그니처 호환성 검증은 이 클래스가 아닌 어댑터가 담당합니다.</p>
 *
 * @param <T> 이벤트 데이터 타입
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class BoundMethodHandler<T> implements EventHandler<T> {

    private final Object target;
    private final Method method;

    private BoundMethodHandler(Object target, Method method) {
        this.target = target;
        this.method = method;
        method.trySetAccessible();
    }

    /**
     * 메서드 바인딩 생성.
     *
     * @param target receiver 객체 (static 메서드인 경우 null)
     * @param method 호출할 메서드 (파라미터 2개)
     * @param <T> 이벤트 데이터 타입
     * @return BoundMethodHandler 인스턴스
     * @throws IllegalArgumentException method가 null이거나, 파라미터가 2개가 아니거나,
     *                                  인스턴스 메서드에 target이 없는 경우
     */
    public static <T> BoundMethodHandler<T> of(Object target, Method method) {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (method.getParameterCount() != 2) {
            throw new IllegalArgumentException(
                "method must take exactly 2 parameters (current: " + method.getParameterCount() + ")");
        }
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic && target == null) {
            throw new IllegalArgumentException("target cannot be null for instance method " + method);
        }
        if (!isStatic && !method.getDeclaringClass().isInstance(target)) {
            throw new IllegalArgumentException(
                "target " + target.getClass().getName() + " does not declare " + method);
        }
        return new BoundMethodHandler<>(isStatic ? null : target, method);
    }

    @Override
    public void handle(Object source, T args) {
        try {
            method.invoke(target, source, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new HandlerInvocationException("Handler method threw a checked exception: " + method, cause);
        } catch (IllegalAccessException e) {
            throw new HandlerInvocationException("Cannot access handler method: " + method, e);
        }
    }

    /**
     * receiver 조회.
     *
     * @return receiver 객체 (static 메서드인 경우 null)
     */
    public Object getTarget() {
        return target;
    }

    /**
     * 바인딩된 메서드 조회.
     *
     * @return 메서드
     */
    public Method getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BoundMethodHandler<?> that = (BoundMethodHandler<?>) o;
        return target == that.target && method.equals(that.method);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(target) + method.hashCode();
    }

    @Override
    public String toString() {
        String receiver = target == null ? method.getDeclaringClass().getSimpleName() : target.getClass().getSimpleName();
        return "BoundMethodHandler{" + receiver + "::" + method.getName() + '}';
    }
}
