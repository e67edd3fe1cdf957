package com.certhealth.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 대시보드 표시용 도메인 인증서 상태입니다. 등급은 조회 시점에 계산됩니다.
 */
@Getter
@Builder
@ToString
public class CertificateStatusDTO {
    private final Domain domain;
    /** 최신 레코드 (없으면 null) */
    private final CertificateRecord latest;
    private final Tier tier;
    /** 만료까지 남은 일수(올림). 유효한 레코드가 없으면 null */
    private final Long daysRemaining;
}
