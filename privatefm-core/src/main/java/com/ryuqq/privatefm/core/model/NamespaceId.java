package com.ryuqq.privatefm.core.model;

import java.util.UUID;

/**
 * Namespace의 내부 식별자.
 *
 * <p>LearnerId와 별개로 생성되며, 이벤트 로그와 Merge 작업은
 * 모두 NamespaceId 기준으로 묶입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NamespaceId {

    private final String value;

    private NamespaceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("NamespaceId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 NamespaceId 생성.
     *
     * @param value NamespaceId 값
     * @return NamespaceId 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static NamespaceId of(String value) {
        return new NamespaceId(value);
    }

    /**
     * 새로운 NamespaceId 생성 (UUID 기반).
     *
     * @return NamespaceId 인스턴스
     */
    public static NamespaceId generate() {
        return new NamespaceId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NamespaceId that = (NamespaceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "NamespaceId{" + value + '}';
    }
}
