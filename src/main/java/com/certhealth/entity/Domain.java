package com.certhealth.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 모니터링 대상 도메인입니다.
 * 도메인 레지스트리가 소유하며, 점검 엔진은 읽기만 합니다.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class Domain {
    /** 도메인 ID */
    private final String id;
    /** 호스트 이름 */
    private final String hostname;
    /** TLS 포트 (기본 443) */
    @Builder.Default
    private final int port = 443;
    /** 등록한 테넌트(사용자) ID */
    private final String ownerId;
    /** 활성 여부 (비활성 도메인은 스윕 대상에서 제외) */
    @Builder.Default
    private final boolean active = true;
}
