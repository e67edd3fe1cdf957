package com.certhealth.service.impl;

import com.certhealth.entity.CertificateRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCertificateResultStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-15T00:00:00Z");

    private final InMemoryCertificateResultStore store = new InMemoryCertificateResultStore();

    @Test
    void latestIsByCheckedAtNotInsertionOrder() {
        store.recordCertificateCheck("a", record("a", T0.plusSeconds(60), true, T0.plus(Duration.ofDays(90))));
        store.recordCertificateCheck("a", record("a", T0, false, null));

        assertThat(store.getLatestCertificate("a")).get()
                .extracting(CertificateRecord::getCheckedAt).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void historyIsAppendOnlyAndNewestFirst() {
        CertificateRecord first = record("a", T0, true, T0.plus(Duration.ofDays(90)));
        CertificateRecord second = record("a", T0.plus(Duration.ofHours(12)), false, null);
        store.recordCertificateCheck("a", first);
        store.recordCertificateCheck("a", second);

        List<CertificateRecord> history = store.getCertificateHistory("a");

        assertThat(history).containsExactly(second, first);
        history.clear();
        assertThat(store.getCertificateHistory("a")).hasSize(2);
    }

    @Test
    void unknownDomainHasNoRecords() {
        assertThat(store.getLatestCertificate("missing")).isEmpty();
        assertThat(store.getCertificateHistory("missing")).isEmpty();
    }

    @Test
    void refusesRecordFiledUnderAnotherDomain() {
        assertThatThrownBy(() -> store.recordCertificateCheck("b", record("a", T0, true, T0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void expiringUsesOnlyLatestValidRecordInWindow() {
        Instant now = T0;
        // a: 10일 남음 → 포함
        store.recordCertificateCheck("a", record("a", now, true, now.plus(Duration.ofDays(10))));
        // b: 예전엔 임박이었지만 최신은 갱신됨 → 제외
        store.recordCertificateCheck("b", record("b", now.minus(Duration.ofDays(1)), true, now.plus(Duration.ofDays(3))));
        store.recordCertificateCheck("b", record("b", now, true, now.plus(Duration.ofDays(90))));
        // c: 최신이 실패 → 제외
        store.recordCertificateCheck("c", record("c", now, false, null));
        // d: 이미 만료 → 제외
        store.recordCertificateCheck("d", record("d", now, true, now.minusSeconds(1)));
        // e: 2일 남음 → 포함, 정렬상 먼저
        store.recordCertificateCheck("e", record("e", now, true, now.plus(Duration.ofDays(2))));

        List<CertificateRecord> expiring = store.findLatestValidExpiringBetween(now, now.plus(Duration.ofDays(30)));

        assertThat(expiring).extracting(CertificateRecord::getDomainId).containsExactly("e", "a");
    }

    static CertificateRecord record(String domainId, Instant checkedAt, boolean valid, Instant validTo) {
        return CertificateRecord.builder()
                .domainId(domainId)
                .issuer(valid ? "R3" : null)
                .subject(valid ? domainId + ".example" : null)
                .validFrom(valid ? checkedAt.minus(Duration.ofDays(30)) : null)
                .validTo(validTo)
                .valid(valid)
                .error(valid ? null : "Connection refused")
                .checkedAt(checkedAt)
                .build();
    }
}
