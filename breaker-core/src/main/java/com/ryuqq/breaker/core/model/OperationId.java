package com.ryuqq.breaker.core.model;

import java.util.UUID;

/**
 * Circuit Breaker를 통과하는 개별 호출의 식별자.
 *
 * <p>전이 이벤트와 로그에 실려 어떤 호출이 상태 전이를 유발했는지 추적하는 데 사용됩니다.
 * 호출자가 직접 지정하지 않으면 {@link #random()}으로 생성됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)만 허용</li>
 * </ul>
 *
 * @param value 식별자 값
 * @author Breaker Team
 * @since 1.0.0
 */
public record OperationId(String value) {

    private static final int MAX_LENGTH = 128;

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public OperationId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "OperationId length cannot exceed " + MAX_LENGTH + " characters (current: " + value.length() + ")"
            );
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:]+$")) {
            throw new IllegalArgumentException("OperationId contains invalid characters: " + value);
        }
    }

    /**
     * 지정한 값으로 생성.
     *
     * @param value 식별자 값
     * @return OperationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationId of(String value) {
        return new OperationId(value);
    }

    /**
     * UUID 기반 식별자 생성.
     *
     * @return 새 OperationId
     */
    public static OperationId random() {
        return new OperationId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return "OperationId{" + value + '}';
    }
}
