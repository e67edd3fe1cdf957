package com.certhealth.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 한 번의 프로브 결과를 기록한 불변 레코드입니다.
 * 도메인별로 append-only 이력이 쌓이며, checkedAt 기준 최신 레코드가 현재 상태입니다.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class CertificateRecord {
    /** 대상 도메인 ID */
    private final String domainId;
    /** 발급자 CN (없으면 O) */
    private final String issuer;
    /** 주체 CN (없으면 O) */
    private final String subject;
    /** 유효기간 시작 */
    private final Instant validFrom;
    /** 유효기간 종료 */
    private final Instant validTo;
    /** 점검 시각이 유효기간 안에 있었는지 여부 */
    @JsonProperty("isValid")
    private final boolean valid;
    /** 실패 또는 유효기간 밖일 때의 사유 */
    private final String error;
    /** 점검 시각 */
    private final Instant checkedAt;
}
