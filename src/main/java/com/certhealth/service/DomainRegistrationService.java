package com.certhealth.service;

import com.certhealth.entity.Domain;

/**
 * 도메인 등록/비활성화 (레지스트리의 쓰기 측) 입니다.
 * 등록이 끝나면 {@link com.certhealth.event.DomainCreatedEvent} 가 발행됩니다.
 */
public interface DomainRegistrationService {

    /**
     * @param target  "host" 또는 "host:port"
     * @param ownerId 소유 테넌트 ID
     * @throws IllegalArgumentException 대상/소유자가 올바르지 않을 때
     * @throws IllegalStateException    같은 host:port 가 이미 활성 상태로 등록되어 있을 때
     */
    Domain register(String target, String ownerId);

    /** 도메인을 비활성화합니다. 이력은 그대로 남습니다. */
    Domain deactivate(String domainId);
}
