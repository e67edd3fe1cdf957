package com.certhealth.service;

import com.certhealth.entity.CertificateRecord;
import com.certhealth.entity.CertificateStatusDTO;
import com.certhealth.entity.ExpiringCertificateDTO;
import com.certhealth.entity.TierSummaryDTO;

import java.util.List;
import java.util.Optional;

/**
 * 대시보드/알림 디스패처가 사용하는 조회 서비스입니다.
 * 등급은 저장하지 않고 조회 시점의 시각으로 계산합니다.
 */
public interface CertificateLookupService {

    Optional<CertificateRecord> getLatestCertificate(String domainId);

    List<CertificateRecord> getCertificateHistory(String domainId);

    /** 최신 유효 인증서의 validTo 가 [now, now + lookaheadDays] 인 도메인들 (만료 임박순) */
    List<ExpiringCertificateDTO> queryExpiringCertificates(int lookaheadDays);

    /** 도메인 하나의 최신 레코드 + 등급. 도메인이 없으면 DomainNotFoundException */
    CertificateStatusDTO statusOf(String domainId);

    /** 테넌트의 활성 도메인 상태 목록 */
    List<CertificateStatusDTO> statusesOf(String ownerId);

    /** 테넌트의 등급 집계 */
    TierSummaryDTO summarize(String ownerId);
}
