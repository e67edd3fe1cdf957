package com.certhealth.service;

import com.certhealth.entity.Domain;

import java.util.List;
import java.util.Optional;

/**
 * 도메인 레지스트리 (외부 협력자) 읽기 인터페이스입니다.
 * 전체 테넌트 조회와 테넌트별 조회를 별도 메서드로 구분합니다.
 */
public interface DomainRegistry {

    /** 모든 테넌트의 활성 도메인 (주기 스윕 전용) */
    List<Domain> listAllActiveDomains();

    /** 한 테넌트의 활성 도메인. ownerId 가 비어 있으면 IllegalArgumentException */
    List<Domain> listActiveDomains(String ownerId);

    Optional<Domain> findById(String domainId);
}
