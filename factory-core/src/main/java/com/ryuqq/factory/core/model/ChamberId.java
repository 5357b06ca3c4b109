package com.ryuqq.factory.core.model;

import java.util.UUID;

/**
 * Chamber 식별자.
 *
 * <p>Chamber는 한 소유자가 감독 중인 작업 영역이며, Event가 처음 참조할 때 지연 생성됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong> RunId와 동일한 규칙 (1~255자, 영숫자/하이픈/언더스코어)</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class ChamberId {

    private final String value;

    private ChamberId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ChamberId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ChamberId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ChamberId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    public static ChamberId of(String value) {
        return new ChamberId(value);
    }

    /**
     * Event가 Chamber를 지정하지 않은 경우 사용할 신규 ID 생성.
     *
     * @return "chamber-" 접두사가 붙은 ChamberId
     */
    public static ChamberId generate() {
        return new ChamberId("chamber-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChamberId that = (ChamberId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ChamberId{" + value + '}';
    }
}
