package com.certhealth.service.impl;

import com.certhealth.entity.CertificateRecord;
import com.certhealth.entity.CertificateStatusDTO;
import com.certhealth.entity.Domain;
import com.certhealth.entity.ExpiringCertificateDTO;
import com.certhealth.entity.Tier;
import com.certhealth.entity.TierSummaryDTO;
import com.certhealth.service.CertificateLookupService;
import com.certhealth.service.CertificateResultStore;
import com.certhealth.service.DomainNotFoundException;
import com.certhealth.service.DomainRegistry;
import com.certhealth.service.ExpiryClassifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service("CertificateLookupService")
public class CertificateLookupServiceImpl implements CertificateLookupService {

    private final CertificateResultStore store;
    private final DomainRegistry registry;
    private final ExpiryClassifier classifier;
    private final Clock clock;

    public CertificateLookupServiceImpl(CertificateResultStore store, DomainRegistry registry,
                                        ExpiryClassifier classifier, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.classifier = classifier;
        this.clock = clock;
    }

    @Override
    public Optional<CertificateRecord> getLatestCertificate(String domainId) {
        return store.getLatestCertificate(domainId);
    }

    @Override
    public List<CertificateRecord> getCertificateHistory(String domainId) {
        requireDomain(domainId);
        return store.getCertificateHistory(domainId);
    }

    @Override
    public List<ExpiringCertificateDTO> queryExpiringCertificates(int lookaheadDays) {
        if (lookaheadDays < 0) {
            throw new IllegalArgumentException("lookaheadDays must not be negative: " + lookaheadDays);
        }
        Instant now = clock.instant();
        Instant until = now.plus(Duration.ofDays(lookaheadDays));

        List<ExpiringCertificateDTO> out = new ArrayList<>();
        for (CertificateRecord r : store.findLatestValidExpiringBetween(now, until)) {
            // 레지스트리에서 사라졌거나 비활성인 도메인은 제외
            Optional<Domain> domain = registry.findById(r.getDomainId()).filter(Domain::isActive);
            domain.ifPresent(d -> out.add(ExpiringCertificateDTO.builder()
                    .domain(d)
                    .certificate(r)
                    .daysRemaining(classifier.daysRemaining(r, now).orElse(0L))
                    .build()));
        }
        return out;
    }

    @Override
    public CertificateStatusDTO statusOf(String domainId) {
        return status(requireDomain(domainId), clock.instant());
    }

    @Override
    public List<CertificateStatusDTO> statusesOf(String ownerId) {
        Instant now = clock.instant();
        return registry.listActiveDomains(ownerId).stream()
                .map(d -> status(d, now))
                .collect(Collectors.toList());
    }

    @Override
    public TierSummaryDTO summarize(String ownerId) {
        List<CertificateStatusDTO> statuses = statusesOf(ownerId);

        // 모든 등급을 0으로 초기화한 뒤 집계
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Tier t : Tier.values()) counts.put(t.label(), 0L);
        long expiringSoon = 0;
        long needsAttention = 0;
        for (CertificateStatusDTO s : statuses) {
            counts.merge(s.getTier().label(), 1L, Long::sum);
            if (s.getTier().expiringSoon()) expiringSoon++;
            if (s.getTier().needsAttention()) needsAttention++;
        }
        return TierSummaryDTO.builder()
                .ownerId(ownerId)
                .total(statuses.size())
                .counts(counts)
                .expiringSoon(expiringSoon)
                .needsAttention(needsAttention)
                .build();
    }

    private CertificateStatusDTO status(Domain domain, Instant now) {
        CertificateRecord latest = store.getLatestCertificate(domain.getId()).orElse(null);
        return CertificateStatusDTO.builder()
                .domain(domain)
                .latest(latest)
                .tier(classifier.classify(latest, now))
                .daysRemaining(classifier.daysRemaining(latest, now).orElse(null))
                .build();
    }

    private Domain requireDomain(String domainId) {
        return registry.findById(domainId).orElseThrow(() -> new DomainNotFoundException(domainId));
    }
}
