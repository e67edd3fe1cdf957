package com.certhealth.service.impl;

import com.certhealth.entity.CertificateRecord;
import com.certhealth.entity.CertificateStatusDTO;
import com.certhealth.entity.Domain;
import com.certhealth.entity.ExpiringCertificateDTO;
import com.certhealth.entity.Tier;
import com.certhealth.entity.TierSummaryDTO;
import com.certhealth.service.DomainNotFoundException;
import com.certhealth.service.DomainRegistry;
import com.certhealth.service.ExpiryClassifier;
import com.certhealth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.certhealth.service.impl.InMemoryCertificateResultStoreTest.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CertificateLookupServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-04-01T00:00:00Z");

    @Mock
    private DomainRegistry registry;

    private final InMemoryCertificateResultStore store = new InMemoryCertificateResultStore();
    private final MutableClock clock = new MutableClock(NOW);
    private CertificateLookupServiceImpl service;

    private final Domain a = domain("a", "tenant-1");
    private final Domain b = domain("b", "tenant-1");
    private final Domain c = domain("c", "tenant-1");

    @BeforeEach
    void setUp() {
        service = new CertificateLookupServiceImpl(store, registry, new ExpiryClassifier(), clock);
        lenient().when(registry.findById(anyString())).thenReturn(Optional.empty());
        lenient().when(registry.findById("a")).thenReturn(Optional.of(a));
        lenient().when(registry.findById("b")).thenReturn(Optional.of(b));
        lenient().when(registry.findById("c")).thenReturn(Optional.of(c));
    }

    @Test
    void expiringJoinsDomainAndSkipsUnknownOrInactive() {
        store.recordCertificateCheck("a", record("a", NOW, true, NOW.plus(Duration.ofDays(6))));
        store.recordCertificateCheck("ghost", record("ghost", NOW, true, NOW.plus(Duration.ofDays(6))));
        Domain inactive = b.toBuilder().active(false).build();
        when(registry.findById("b")).thenReturn(Optional.of(inactive));
        store.recordCertificateCheck("b", record("b", NOW, true, NOW.plus(Duration.ofDays(6))));

        List<ExpiringCertificateDTO> expiring = service.queryExpiringCertificates(30);

        assertThat(expiring).hasSize(1);
        assertThat(expiring.get(0).getDomain()).isEqualTo(a);
        assertThat(expiring.get(0).getDaysRemaining()).isEqualTo(6);
    }

    @Test
    void expiringRespectsLookahead() {
        store.recordCertificateCheck("a", record("a", NOW, true, NOW.plus(Duration.ofDays(20))));

        assertThat(service.queryExpiringCertificates(7)).isEmpty();
        assertThat(service.queryExpiringCertificates(30)).hasSize(1);
        assertThatThrownBy(() -> service.queryExpiringCertificates(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusComputesTierAtQueryTime() {
        store.recordCertificateCheck("a", record("a", NOW, true, NOW.plus(Duration.ofDays(40))));

        assertThat(service.statusOf("a").getTier()).isEqualTo(Tier.VALID);

        clock.advance(Duration.ofDays(15));
        CertificateStatusDTO later = service.statusOf("a");
        assertThat(later.getTier()).isEqualTo(Tier.WARNING);
        assertThat(later.getDaysRemaining()).isEqualTo(25L);
    }

    @Test
    void statusOfUnknownDomainFails() {
        assertThatThrownBy(() -> service.statusOf("zzz")).isInstanceOf(DomainNotFoundException.class);
        assertThatThrownBy(() -> service.getCertificateHistory("zzz")).isInstanceOf(DomainNotFoundException.class);
    }

    @Test
    void summaryCountsEveryTier() {
        when(registry.listActiveDomains("tenant-1")).thenReturn(List.of(a, b, c));
        store.recordCertificateCheck("a", record("a", NOW, true, NOW.plus(Duration.ofDays(3))));
        store.recordCertificateCheck("b", record("b", NOW, false, null));

        TierSummaryDTO summary = service.summarize("tenant-1");

        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getCounts())
                .containsEntry("critical", 1L)
                .containsEntry("invalid", 1L)
                .containsEntry("no-cert", 1L)
                .containsEntry("valid", 0L)
                .hasSize(Tier.values().length);
        assertThat(summary.getExpiringSoon()).isEqualTo(1);
        assertThat(summary.getNeedsAttention()).isEqualTo(2);
    }

    @Test
    void latestDelegatesToStore() {
        CertificateRecord r = record("a", NOW, true, NOW.plus(Duration.ofDays(3)));
        store.recordCertificateCheck("a", r);

        assertThat(service.getLatestCertificate("a")).contains(r);
        assertThat(service.getLatestCertificate("b")).isEmpty();
    }

    private static Domain domain(String id, String owner) {
        return Domain.builder().id(id).hostname(id + ".example.com").ownerId(owner).build();
    }
}
