package com.certhealth.service;

import com.certhealth.entity.CertificateRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 점검 결과 저장소 (append-only) 입니다.
 * 이미 저장된 레코드는 수정/삭제하지 않습니다.
 */
public interface CertificateResultStore {

    /** 레코드 한 건을 추가합니다. record.domainId 와 domainId 가 다르면 IllegalArgumentException */
    void recordCertificateCheck(String domainId, CertificateRecord record);

    /** checkedAt 기준 최신 레코드 */
    Optional<CertificateRecord> getLatestCertificate(String domainId);

    /** 도메인의 전체 이력 (최신순) */
    List<CertificateRecord> getCertificateHistory(String domainId);

    /**
     * 도메인별 최신 레코드 중 유효하고 validTo 가 [from, to] 에 드는 것들
     */
    List<CertificateRecord> findLatestValidExpiringBetween(Instant from, Instant to);
}
