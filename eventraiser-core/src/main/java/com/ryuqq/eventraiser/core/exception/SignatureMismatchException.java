package com.ryuqq.eventraiser.core.exception;

/**
 * 핸들러 시그니처 불일치 예외.
 *
 * <p>어댑터에 {@code (Object source, T args)} 형태와 호환되지 않는 함수가 전달된 경우 발생합니다.
 * 부분 결과는 반환되지 않습니다.</p>
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>파라미터 개수가 2개가 아님</li>
 *   <li>첫 번째 파라미터가 임의의 Object source를 받을 수 없음</li>
 *   <li>두 번째 파라미터가 대상 이벤트 데이터 타입을 받을 수 없음</li>
 *   <li>반환 타입이 void가 아님</li>
 *   <li>함수형 메서드가 없거나 둘 이상이라 결정할 수 없음</li>
 * </ul>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public class SignatureMismatchException extends IllegalArgumentException {

    private final Class<?> targetType;

    /**
     * 생성자.
     *
     * @param targetType 변환 대상 이벤트 데이터 타입
     */
    public SignatureMismatchException(Class<?> targetType) {
        super(String.format(
            "The method signature of the given handler is incompatible with EventHandler<%s>.",
            targetType.getName()));
        this.targetType = targetType;
    }

    /**
     * 변환 대상 이벤트 데이터 타입 조회.
     *
     * @return 대상 타입
     */
    public Class<?> getTargetType() {
        return targetType;
    }
}
