package com.certhealth.service.impl;

import com.certhealth.entity.CertificateRecord;
import com.certhealth.service.CertificateResultStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 메모리 기반 결과 저장소 (기본값, certhealth.store.type=memory)
 * 도메인별 리스트에 추가만 하며, 서로 다른 도메인 쓰기는 충돌하지 않습니다.
 */
@Service("CertificateResultStore")
@ConditionalOnProperty(prefix = "certhealth.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCertificateResultStore implements CertificateResultStore {

    private final Map<String, List<CertificateRecord>> history = new ConcurrentHashMap<>();

    @Override
    public void recordCertificateCheck(String domainId, CertificateRecord record) {
        checkOwnership(domainId, record);
        List<CertificateRecord> list = history.computeIfAbsent(domainId, k -> Collections.synchronizedList(new ArrayList<>()));
        list.add(record);
    }

    @Override
    public Optional<CertificateRecord> getLatestCertificate(String domainId) {
        List<CertificateRecord> list = snapshot(domainId);
        CertificateRecord latest = null;
        // 같은 checkedAt 이면 나중에 추가된 레코드가 최신
        for (CertificateRecord r : list) {
            if (latest == null || !r.getCheckedAt().isBefore(latest.getCheckedAt())) {
                latest = r;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public List<CertificateRecord> getCertificateHistory(String domainId) {
        List<CertificateRecord> list = snapshot(domainId);
        Collections.reverse(list);
        list.sort(Comparator.comparing(CertificateRecord::getCheckedAt).reversed());
        return list;
    }

    @Override
    public List<CertificateRecord> findLatestValidExpiringBetween(Instant from, Instant to) {
        return history.keySet().stream()
                .map(this::getLatestCertificate)
                .flatMap(Optional::stream)
                .filter(CertificateRecord::isValid)
                .filter(r -> r.getValidTo() != null
                        && !r.getValidTo().isBefore(from)
                        && !r.getValidTo().isAfter(to))
                .sorted(Comparator.comparing(CertificateRecord::getValidTo))
                .collect(Collectors.toList());
    }

    private List<CertificateRecord> snapshot(String domainId) {
        List<CertificateRecord> list = history.get(domainId);
        if (list == null) return new ArrayList<>();
        synchronized (list) {
            return new ArrayList<>(list);
        }
    }

    static void checkOwnership(String domainId, CertificateRecord record) {
        Objects.requireNonNull(domainId, "domainId");
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(record.getCheckedAt(), "record.checkedAt");
        if (!domainId.equals(record.getDomainId())) {
            throw new IllegalArgumentException("Record for " + record.getDomainId() + " cannot be stored under " + domainId);
        }
    }
}
