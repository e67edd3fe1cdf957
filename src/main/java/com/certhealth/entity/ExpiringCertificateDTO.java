package com.certhealth.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 만료 임박 조회 결과 한 건 (도메인 + 최신 레코드)
 */
@Getter
@Builder
@ToString
public class ExpiringCertificateDTO {
    private final Domain domain;
    private final CertificateRecord certificate;
    private final long daysRemaining;
}
