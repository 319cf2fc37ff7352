package com.ryuqq.eventraiser.core.adapter;

import com.ryuqq.eventraiser.core.exception.SignatureMismatchException;
import com.ryuqq.eventraiser.core.handler.BoundMethodHandler;
import com.ryuqq.eventraiser.core.handler.EventArgs;
import com.ryuqq.eventraiser.core.handler.EventHandler;
import com.ryuqq.eventraiser.core.handler.HandlerChain;
import com.ryuqq.eventraiser.core.handler.SimpleEventHandler;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 이벤트 핸들러 어댑터.
 *
 * <p>{@code (Object source, T args)} 형태와 구조적으로 호환되는 함수를
 * {@code EventHandler<T>}로 변환합니다.</p>
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ol>
 *   <li>null → null (예외 아님)</li>
 *   <li>{@link HandlerChain} → 각 항목을 개별 변환 후 원래 순서대로 재결합</li>
 *   <li>T와 호환되는 {@link EventHandler} → 그대로 재사용 (멱등)</li>
 *   <li>{@link BoundMethodHandler} → 바인딩된 메서드를 T 기준으로 재검증</li>
 *   <li>그 외 함수형 객체 → 호환되는 단일 함수형 메서드를 찾아 {@link BoundMethodHandler}로 바인딩</li>
 * </ol>
 *
 * <p><strong>호환 조건:</strong></p>
 * <ul>
 *   <li>파라미터 2개, 반환 타입 void</li>
 *   <li>첫 번째 파라미터가 임의의 Object source를 받을 수 있음</li>
 *   <li>두 번째 파라미터가 T를 받을 수 있음 (T의 상위 타입 허용)</li>
 * </ul>
 *
 * <p>파라미터 타입은 구현 클래스가 선언한 타입 인자로 판정합니다. 람다와 메서드 참조는
 * 타입 인자가 소거되므로 erasure(보통 Object) 기준으로만 검사되어 어떤 T에도 변환됩니다.
 * 이 경우 불일치는 변환 시점이 아니라 호출 시점의 {@link ClassCastException}으로 드러납니다.</p>
 *
 * <p>조건을 만족하지 않으면 {@link SignatureMismatchException}을 던지며, 부분 결과는 반환하지 않습니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public final class HandlerAdapter {

    private static final Method EVENT_HANDLER_METHOD = lookupHandleMethod();

    private HandlerAdapter() {
    }

    /**
     * 호환되는 함수를 {@code EventHandler<T>}로 변환.
     *
     * <p>람다와 메서드 참조는 두 번째 파라미터 검사를 통과합니다. 예를 들어
     * {@code NotificationListener<PropertyChangedArgs> l = (s, a) -> ...}는 {@code EventArgs}로
     * 변환되지만, {@code PropertyChangedArgs}가 아닌 인자로 호출하면 {@link ClassCastException}이
     * 발생합니다. 변환 시점 검사가 필요하면 타입 인자를 선언한 클래스로 구현하세요.</p>
     *
     * @param handler 변환할 함수 (null 가능)
     * @param argsType 대상 이벤트 데이터 타입
     * @param <T> 이벤트 데이터 타입
     * @return 변환된 핸들러 (handler가 null이면 null)
     * @throws SignatureMismatchException handler가 호환되지 않는 경우
     * @throws IllegalArgumentException argsType이 null인 경우
     */
    public static <T> EventHandler<T> adapt(Object handler, Class<T> argsType) {
        requireArgsType(argsType);
        if (handler == null) {
            return null;
        }
        if (handler instanceof HandlerChain<?>) {
            List<EventHandler<T>> converted = new ArrayList<>();
            for (EventHandler<?> entry : ((HandlerChain<?>) handler).getInvocationList()) {
                converted.add(adaptElementary(entry, argsType));
            }
            return HandlerChain.combine(converted);
        }
        return adaptElementary(handler, argsType);
    }

    /**
     * 상위 타입 S용 핸들러를 하위 타입 T용 핸들러로 변환 (반공변).
     *
     * <p>{@code T extends S} 관계는 컴파일 타임에 검증되며, 일반 변환 경로를 통해 재변환합니다.</p>
     *
     * @param handler S용 핸들러 (null 가능)
     * @param argsType 대상 이벤트 데이터 타입
     * @param <S> 원본 이벤트 데이터 타입
     * @param <T> 대상 이벤트 데이터 타입 (S의 하위 타입)
     * @return T용 핸들러 (handler가 null이면 null)
     */
    public static <S, T extends S> EventHandler<T> adaptContravariant(EventHandler<S> handler, Class<T> argsType) {
        return adapt(handler, argsType);
    }

    /**
     * {@link SimpleEventHandler}를 {@code EventHandler<EventArgs>}로 변환.
     *
     * @param handler 변환할 핸들러 (null 가능)
     * @return 변환된 핸들러 (handler가 null이면 null)
     */
    public static EventHandler<EventArgs> toGeneric(SimpleEventHandler handler) {
        return adapt(handler, EventArgs.class);
    }

    /**
     * 메서드를 elementary 핸들러로 바인딩.
     *
     * @param target receiver 객체 (static 메서드인 경우 무시)
     * @param method 바인딩할 메서드
     * @param argsType 대상 이벤트 데이터 타입
     * @param <T> 이벤트 데이터 타입
     * @return 바인딩된 핸들러
     * @throws SignatureMismatchException 메서드 시그니처가 호환되지 않는 경우
     * @throws IllegalArgumentException method 또는 argsType이 null이거나, 인스턴스 메서드에 target이 없는 경우
     */
    public static <T> EventHandler<T> fromMethod(Object target, Method method, Class<T> argsType) {
        requireArgsType(argsType);
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        Class<?> implClass = isStatic || target == null ? method.getDeclaringClass() : target.getClass();
        if (!isCompatible(implClass, method, argsType)) {
            throw new SignatureMismatchException(argsType);
        }
        return BoundMethodHandler.of(target, method);
    }

    private static <T> EventHandler<T> adaptElementary(Object handler, Class<T> argsType) {
        if (handler instanceof BoundMethodHandler<?>) {
            BoundMethodHandler<?> bound = (BoundMethodHandler<?>) handler;
            Class<?> implClass = bound.getTarget() == null
                ? bound.getMethod().getDeclaringClass()
                : bound.getTarget().getClass();
            if (!isCompatible(implClass, bound.getMethod(), argsType)) {
                throw new SignatureMismatchException(argsType);
            }
            return cast(bound);
        }

        if (handler instanceof EventHandler<?>) {
            if (!isCompatible(handler.getClass(), EVENT_HANDLER_METHOD, argsType)) {
                throw new SignatureMismatchException(argsType);
            }
            return cast((EventHandler<?>) handler);
        }

        Method functionalMethod = findFunctionalMethod(handler.getClass(), argsType);
        return BoundMethodHandler.of(handler, functionalMethod);
    }

    /**
     * 호환되는 단일 함수형 메서드 탐색.
     *
     * <p>구현 클래스가 구현한 모든 인터페이스의 추상 메서드 중 호환되는 메서드가
     * 정확히 하나일 때만 반환합니다.</p>
     */
    private static Method findFunctionalMethod(Class<?> implClass, Class<?> argsType) {
        Map<String, Method> compatible = new HashMap<>();
        for (Class<?> type : interfacesOf(implClass)) {
            for (Method method : type.getDeclaredMethods()) {
                if (isAbstractInstanceMethod(method) && isCompatible(implClass, method, argsType)) {
                    compatible.putIfAbsent(method.getName() + signatureKey(method), method);
                }
            }
        }
        if (compatible.size() != 1) {
            throw new SignatureMismatchException(argsType);
        }
        return compatible.values().iterator().next();
    }

    private static boolean isCompatible(Class<?> implClass, Method method, Class<?> argsType) {
        if (method.getParameterCount() != 2 || method.getReturnType() != void.class) {
            return false;
        }
        Class<?> sourceType = GenericTypeResolver.resolveParameterType(implClass, method, 0);
        Class<?> eventType = GenericTypeResolver.resolveParameterType(implClass, method, 1);
        return sourceType.isAssignableFrom(Object.class) && eventType.isAssignableFrom(argsType);
    }

    private static boolean isAbstractInstanceMethod(Method method) {
        int modifiers = method.getModifiers();
        return Modifier.isAbstract(modifiers) && !Modifier.isStatic(modifiers);
    }

    private static String signatureKey(Method method) {
        StringBuilder key = new StringBuilder("(");
        for (Class<?> parameterType : method.getParameterTypes()) {
            key.append(parameterType.getName()).append(';');
        }
        return key.append(')').toString();
    }

    private static Set<Class<?>> interfacesOf(Class<?> implClass) {
        Set<Class<?>> interfaces = new HashSet<>();
        Deque<Class<?>> queue = new ArrayDeque<>();
        for (Class<?> current = implClass; current != null; current = current.getSuperclass()) {
            queue.addAll(List.of(current.getInterfaces()));
        }
        while (!queue.isEmpty()) {
            Class<?> type = queue.poll();
            if (interfaces.add(type)) {
                queue.addAll(List.of(type.getInterfaces()));
            }
        }
        return interfaces;
    }

    // isCompatible()로 argsType 수용 여부를 확인한 핸들러만 전달됨
    private static <T> EventHandler<T> cast(EventHandler<?> handler) {
        return (EventHandler<T>) handler;
    }

    private static void requireArgsType(Class<?> argsType) {
        if (argsType == null) {
            throw new IllegalArgumentException("argsType cannot be null");
        }
    }

    private static Method lookupHandleMethod() {
        try {
            return EventHandler.class.getMethod("handle", Object.class, Object.class);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("EventHandler.handle(Object, Object) not found", e);
        }
    }
}
