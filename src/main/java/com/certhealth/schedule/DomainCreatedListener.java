package com.certhealth.schedule;

import com.certhealth.event.DomainCreatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 신규 도메인 등록 이벤트를 받아 해당 도메인 하나만 즉시 점검합니다.
 */
@Slf4j
@Component
public class DomainCreatedListener {

    private final CertificateScanScheduler scheduler;

    public DomainCreatedListener(CertificateScanScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @EventListener
    public void onDomainCreated(DomainCreatedEvent event) {
        log.debug("Initial certificate scan for new domain {}", event.getDomain().getHostname());
        scheduler.scanDomain(event.getDomain());
    }
}
