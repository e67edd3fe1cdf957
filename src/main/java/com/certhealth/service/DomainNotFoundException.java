package com.certhealth.service;

/**
 * 요청한 도메인이 레지스트리에 없을 때 던집니다.
 */
public class DomainNotFoundException extends RuntimeException {

    private final String domainId;

    public DomainNotFoundException(String domainId) {
        super("Domain not found: " + domainId);
        this.domainId = domainId;
    }

    public String getDomainId() {
        return domainId;
    }
}
