package com.certhealth.entity;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 단일 호스트 프로브 결과입니다.
 * - 성공: 리프 인증서의 발급자/주체/유효기간과 시간창 판정(valid)을 담습니다.
 * - 실패: 분류된 {@link ProbeError}를 담습니다. 예외로 던지지 않습니다.
 */
@Getter
@ToString
public class ProbeResult {

    static final String EXPIRED_REASON = "Certificate expired";
    static final String NOT_YET_VALID_REASON = "Certificate not yet valid";

    private final String hostname;
    private final int port;
    private final String issuer;
    private final String subject;
    private final Instant notBefore;
    private final Instant notAfter;
    private final boolean valid;
    private final ProbeError error;
    /** 프로브가 판정에 사용한 시각 */
    private final Instant probedAt;
    /** 처리 시간(ms) */
    private final long elapsedMs;

    private ProbeResult(String hostname, int port, String issuer, String subject,
                        Instant notBefore, Instant notAfter, boolean valid,
                        ProbeError error, Instant probedAt, long elapsedMs) {
        this.hostname = hostname;
        this.port = port;
        this.issuer = issuer;
        this.subject = subject;
        this.notBefore = notBefore;
        this.notAfter = notAfter;
        this.valid = valid;
        this.error = error;
        this.probedAt = probedAt;
        this.elapsedMs = elapsedMs;
    }

    /** 핸드셰이크 성공 결과. valid 는 notBefore <= probedAt <= notAfter 로 계산합니다. */
    public static ProbeResult success(String hostname, int port, String issuer, String subject,
                                      Instant notBefore, Instant notAfter, Instant probedAt, long elapsedMs) {
        Objects.requireNonNull(notBefore, "notBefore");
        Objects.requireNonNull(notAfter, "notAfter");
        Objects.requireNonNull(probedAt, "probedAt");
        boolean valid = !probedAt.isBefore(notBefore) && !probedAt.isAfter(notAfter);
        return new ProbeResult(hostname, port, issuer, subject, notBefore, notAfter, valid,
                null, probedAt, elapsedMs);
    }

    public static ProbeResult failure(String hostname, int port, ProbeError error, Instant probedAt, long elapsedMs) {
        Objects.requireNonNull(error, "error");
        return new ProbeResult(hostname, port, null, null, null, null, false,
                error, probedAt, elapsedMs);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<ProbeError> probeError() {
        return Optional.ofNullable(error);
    }

    /**
     * 화면/레코드에 남길 사유 문자열.
     * 실패면 분류 메시지, 성공이지만 유효기간 밖이면 만료/미도래 사유, 그 외에는 null.
     */
    public String errorMessage() {
        if (error != null) {
            return error.message();
        }
        if (valid) {
            return null;
        }
        return probedAt.isAfter(notAfter) ? EXPIRED_REASON : NOT_YET_VALID_REASON;
    }

    /** 이 결과를 도메인의 불변 레코드 한 건으로 변환합니다. */
    public CertificateRecord toRecord(String domainId, Instant checkedAt) {
        return CertificateRecord.builder()
                .domainId(domainId)
                .issuer(issuer)
                .subject(subject)
                .validFrom(notBefore)
                .validTo(notAfter)
                .valid(valid)
                .error(errorMessage())
                .checkedAt(checkedAt)
                .build();
    }
}
