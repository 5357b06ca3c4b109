package com.ryuqq.factory.core.model;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 상위 소스에서 들어온 불변 사실 (작업 트리거).
 *
 * <p>Controller가 정확히 한 번 소비하며, 생성 후 변경되지 않습니다.
 * 같은 id의 재전달은 호출자 책임이며 여기서 중복 제거하지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>payload:</strong> 해석하지 않는 키-값 맵 (scope, message, dependencies 등)</li>
 *   <li><strong>chamberId / ownerId:</strong> 선택 (null 허용)</li>
 * </ul>
 *
 * @param id 이벤트 ID
 * @param source 이벤트 소스
 * @param type 이벤트 종류 (예: "git_push", "health_failure")
 * @param payload 불투명 페이로드 (불변 복사본)
 * @param chamberId 대상 Chamber (null 허용)
 * @param ownerId 소유자 (null 허용)
 * @param timestamp 발생 시각
 * @param priority 우선순위
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record Event(
    String id,
    EventSource source,
    String type,
    Map<String, Object> payload,
    ChamberId chamberId,
    String ownerId,
    Instant timestamp,
    Priority priority
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public Event {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        // payload 값에 null이 섞일 수 있으므로 Map.copyOf 대신 LinkedHashMap 복사
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * 기본 우선순위(NORMAL)와 현재 시각으로 Event 생성.
     *
     * @param source 이벤트 소스
     * @param type 이벤트 종류
     * @param payload 페이로드
     * @param clock 시각 소스
     * @return 생성된 Event (id는 UUID 기반)
     */
    public static Event of(EventSource source, String type, Map<String, Object> payload, Clock clock) {
        return new Event("evt-" + UUID.randomUUID(), source, type, payload, null, null,
            clock.instant(), Priority.NORMAL);
    }

    /**
     * 사용자가 작업을 컨트롤러에 위임하는 수동 요청 Event 생성.
     *
     * <p>message와 scope 중 하나만 있으면 다른 쪽을 같은 값으로 채웁니다.</p>
     *
     * @param ownerId 요청자 (null이면 "anon")
     * @param chamberId 대상 Chamber (null이면 신규 생성)
     * @param message 요청 메시지 (null 허용)
     * @param scope 작업 범위 (null 허용)
     * @param clock 시각 소스
     * @return USER 소스의 "manage_it" Event
     * @throws IllegalArgumentException message와 scope가 모두 비어 있는 경우
     */
    public static Event manualRequest(String ownerId, ChamberId chamberId, String message, String scope, Clock clock) {
        boolean hasMessage = message != null && !message.isBlank();
        boolean hasScope = scope != null && !scope.isBlank();
        if (!hasMessage && !hasScope) {
            throw new IllegalArgumentException("message or scope is required");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", hasMessage ? message : scope);
        payload.put("scope", hasScope ? scope : message);
        return new Event(
            "evt-manage-" + UUID.randomUUID(),
            EventSource.USER,
            "manage_it",
            payload,
            chamberId != null ? chamberId : ChamberId.generate(),
            ownerId != null ? ownerId : "anon",
            clock.instant(),
            Priority.NORMAL
        );
    }

    /**
     * 우선순위만 변경한 새 인스턴스 생성.
     */
    public Event withPriority(Priority priority) {
        return new Event(id, source, type, payload, chamberId, ownerId, timestamp, priority);
    }

    /**
     * Chamber와 소유자를 지정한 새 인스턴스 생성.
     */
    public Event withChamber(ChamberId chamberId, String ownerId) {
        return new Event(id, source, type, payload, chamberId, ownerId, timestamp, priority);
    }
}
