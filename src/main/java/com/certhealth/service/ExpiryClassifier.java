package com.certhealth.service;

import com.certhealth.entity.CertificateRecord;
import com.certhealth.entity.Tier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 최신 인증서 레코드와 현재 시각으로 위험 등급을 계산합니다.
 * 상태가 없는 순수 함수이며 같은 입력에는 항상 같은 등급을 돌려줍니다.
 *
 * <pre>
 *   레코드 없음              → no-cert
 *   isValid == false         → invalid
 *   daysRemaining <= 0       → expired
 *   1..7                     → critical
 *   8..30                    → warning
 *   31 이상                  → valid
 * </pre>
 * daysRemaining 은 (validTo - now) 를 하루 단위로 올림한 값입니다. (6시간 남음 → 1일)
 */
@Component
public class ExpiryClassifier {

    public static final int CRITICAL_DAYS = 7;
    public static final int WARNING_DAYS = 30;

    private static final long DAY_SECONDS = 24L * 60 * 60;

    public Tier classify(Optional<CertificateRecord> record, Instant now) {
        Objects.requireNonNull(record, "record");
        return classify(record.orElse(null), now);
    }

    /**
     * @param record 최신 레코드 (없으면 null)
     */
    public Tier classify(CertificateRecord record, Instant now) {
        Objects.requireNonNull(now, "now");
        if (record == null) {
            return Tier.NO_CERT;
        }
        if (!record.isValid() || record.getValidTo() == null) {
            return Tier.INVALID;
        }
        long days = daysUntil(record.getValidTo(), now);
        if (days <= 0) return Tier.EXPIRED;
        if (days <= CRITICAL_DAYS) return Tier.CRITICAL;
        if (days <= WARNING_DAYS) return Tier.WARNING;
        return Tier.VALID;
    }

    /** 유효한 레코드의 남은 일수 (올림). 판단할 수 없으면 empty */
    public Optional<Long> daysRemaining(CertificateRecord record, Instant now) {
        if (record == null || !record.isValid() || record.getValidTo() == null) {
            return Optional.empty();
        }
        return Optional.of(daysUntil(record.getValidTo(), now));
    }

    /** ceil((validTo - now) / 1일). Instant 전 범위에서 오버플로 없이 계산합니다. */
    static long daysUntil(Instant validTo, Instant now) {
        Duration left = Duration.between(now, validTo);
        long seconds = left.getSeconds();          // 내림된 초, 나노는 항상 0 이상
        long days = Math.floorDiv(seconds, DAY_SECONDS);
        if (Math.floorMod(seconds, DAY_SECONDS) != 0 || left.getNano() != 0) {
            days++;
        }
        return days;
    }
}
