package com.certhealth.service.impl;

import com.certhealth.config.CertHealthProperties;
import com.certhealth.entity.Domain;
import com.certhealth.event.DomainCreatedEvent;
import com.certhealth.service.DomainNotFoundException;
import com.certhealth.service.DomainRegistrationService;
import com.certhealth.service.DomainRegistry;
import com.common.service.CommonService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 메모리 기반 도메인 레지스트리입니다.
 * 기동 시 certhealth.targets / certhealth.targets-file 의 타깃을 시드로 등록합니다.
 */
@Slf4j
@Service("DomainRegistry")
public class InMemoryDomainRegistry implements DomainRegistry, DomainRegistrationService {

    private final CertHealthProperties props;
    private final CommonService commonService;
    private final ApplicationEventPublisher publisher;

    private final Map<String, Domain> domains = new ConcurrentHashMap<>();

    public InMemoryDomainRegistry(CertHealthProperties props, CommonService commonService,
                                  ApplicationEventPublisher publisher) {
        this.props = props;
        this.commonService = commonService;
        this.publisher = publisher;
    }

    /** 설정된 시드 타깃 등록 (이벤트 없이, 첫 스윕에서 점검됨) */
    @PostConstruct
    public void seedFromProperties() {
        List<String> targets = commonService.loadTargets(props.getTargets(), props.getTargetsFile());
        for (String t : targets) {
            String[] hp = commonService.parseTarget(t, props.getDefaultPort());
            if (hp == null) {
                log.warn("Ignoring malformed target '{}'", t);
                continue;
            }
            int port = Integer.parseInt(hp[1]);
            if (findActive(hp[0], port).isPresent()) continue;
            Domain d = newDomain(hp[0], port, props.getTargetsOwnerId());
            domains.put(d.getId(), d);
        }
        if (!domains.isEmpty()) {
            log.info("Seeded {} domain(s) from configuration", domains.size());
        }
    }

    @Override
    public List<Domain> listAllActiveDomains() {
        return domains.values().stream()
                .filter(Domain::isActive)
                .sorted(Comparator.comparing(Domain::getHostname).thenComparing(Domain::getPort))
                .collect(Collectors.toList());
    }

    @Override
    public List<Domain> listActiveDomains(String ownerId) {
        if (!commonService.stringNullCheck(ownerId)) {
            throw new IllegalArgumentException("ownerId is required; use listAllActiveDomains() for every tenant");
        }
        return listAllActiveDomains().stream()
                .filter(d -> ownerId.equals(d.getOwnerId()))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Domain> findById(String domainId) {
        if (domainId == null) return Optional.empty();
        return Optional.ofNullable(domains.get(domainId));
    }

    @Override
    public Domain register(String target, String ownerId) {
        if (!commonService.stringNullCheck(ownerId)) {
            throw new IllegalArgumentException("ownerId is required");
        }
        String[] hp = commonService.parseTarget(target, props.getDefaultPort());
        if (hp == null) {
            throw new IllegalArgumentException("Invalid target: " + target);
        }
        int port = Integer.parseInt(hp[1]);
        Domain created;
        synchronized (domains) {
            if (findActive(hp[0], port).isPresent()) {
                throw new IllegalStateException("Domain already registered: " + hp[0] + ":" + port);
            }
            created = newDomain(hp[0], port, ownerId);
            domains.put(created.getId(), created);
        }
        log.info("Registered domain {} ({}:{}) for owner {}", created.getId(), created.getHostname(), port, ownerId);

        // 즉시 점검 트리거
        publisher.publishEvent(new DomainCreatedEvent(this, created));
        return created;
    }

    @Override
    public Domain deactivate(String domainId) {
        Domain updated = domains.computeIfPresent(domainId, (id, d) -> d.toBuilder().active(false).build());
        if (updated == null) {
            throw new DomainNotFoundException(domainId);
        }
        log.info("Deactivated domain {} ({})", domainId, updated.getHostname());
        return updated;
    }

    private Optional<Domain> findActive(String hostname, int port) {
        return domains.values().stream()
                .filter(Domain::isActive)
                .filter(d -> d.getHostname().equals(hostname) && d.getPort() == port)
                .findFirst();
    }

    private static Domain newDomain(String hostname, int port, String ownerId) {
        return Domain.builder()
                .id(UUID.randomUUID().toString())
                .hostname(hostname)
                .port(port)
                .ownerId(ownerId)
                .active(true)
                .build();
    }
}
