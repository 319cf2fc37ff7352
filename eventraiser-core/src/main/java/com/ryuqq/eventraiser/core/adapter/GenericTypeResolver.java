package com.ryuqq.eventraiser.core.adapter;

import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * 함수형 메서드 파라미터의 실제 타입 해석기.
 *
 * <p>인터페이스의 타입 변수로 선언된 파라미터를 구현 클래스가 선언한 타입 인자로 해석합니다.
 * 예: {@code class AuditHandler implements EventHandler<OrderArgs>}의 {@code handle}
 * 두 번째 파라미터는 {@code OrderArgs}로 해석됩니다.</p>
 *
 * <p>람다처럼 타입 인자가 소거된 경우 파라미터의 erasure(상한)를 반환합니다.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
final class GenericTypeResolver {

    private GenericTypeResolver() {
    }

    /**
     * 파라미터 타입 해석.
     *
     * @param implClass 메서드를 구현한 클래스
     * @param method 인터페이스 또는 클래스에 선언된 메서드
     * @param index 파라미터 인덱스
     * @return 해석된 파라미터 타입 (해석 불가 시 erasure)
     */
    static Class<?> resolveParameterType(Class<?> implClass, Method method, int index) {
        Type generic = method.getGenericParameterTypes()[index];
        Class<?> erased = method.getParameterTypes()[index];

        if (generic instanceof TypeVariable<?> && ((TypeVariable<?>) generic).getGenericDeclaration() instanceof Class<?>) {
            TypeVariable<?> variable = (TypeVariable<?>) generic;
            Class<?> declaring = (Class<?>) variable.getGenericDeclaration();
            int variableIndex = indexOf(declaring, variable);
            Class<?> resolved = rawClass(findTypeArgument(implClass, declaring, variableIndex));
            if (resolved != null) {
                return resolved;
            }
        }
        return erased;
    }

    /**
     * 구현 클래스 계층에서 declaring 타입의 타입 인자 탐색 (BFS).
     */
    private static Type findTypeArgument(Class<?> implClass, Class<?> declaring, int variableIndex) {
        Deque<Class<?>> queue = new ArrayDeque<>();
        Set<Class<?>> visited = new HashSet<>();
        queue.add(implClass);

        while (!queue.isEmpty()) {
            Class<?> current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (Type type : supertypesOf(current)) {
                if (type instanceof ParameterizedType
                        && ((ParameterizedType) type).getRawType() == declaring) {
                    return ((ParameterizedType) type).getActualTypeArguments()[variableIndex];
                }
                Class<?> raw = rawClass(type);
                if (raw != null) {
                    queue.add(raw);
                }
            }
        }
        return null;
    }

    private static Type[] supertypesOf(Class<?> type) {
        Type[] interfaces = type.getGenericInterfaces();
        Type superclass = type.getGenericSuperclass();
        if (superclass == null) {
            return interfaces;
        }
        Type[] all = new Type[interfaces.length + 1];
        all[0] = superclass;
        System.arraycopy(interfaces, 0, all, 1, interfaces.length);
        return all;
    }

    private static int indexOf(Class<?> declaring, TypeVariable<?> variable) {
        TypeVariable<?>[] parameters = declaring.getTypeParameters();
        for (int i = 0; i < parameters.length; i++) {
            if (parameters[i].equals(variable)) {
                return i;
            }
        }
        throw new IllegalStateException("Type variable " + variable + " is not declared by " + declaring);
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class<?>) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        // 타입 변수, 와일드카드 등은 해석하지 않음
        return null;
    }
}
