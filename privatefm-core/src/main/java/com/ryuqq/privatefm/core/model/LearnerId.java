package com.ryuqq.privatefm.core.model;

/**
 * 학습자(Learner) 식별자.
 *
 * <p>학습자 한 명당 정확히 하나의 Namespace가 존재하며,
 * LearnerId는 Namespace 조회의 기본 키로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LearnerId {

    private final String value;

    private LearnerId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("LearnerId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("LearnerId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("LearnerId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * LearnerId 생성.
     *
     * @param value LearnerId 값
     * @return LearnerId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static LearnerId of(String value) {
        return new LearnerId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LearnerId learnerId = (LearnerId) o;
        return value.equals(learnerId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "LearnerId{" + value + '}';
    }
}
