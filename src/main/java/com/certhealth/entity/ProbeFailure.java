package com.certhealth.entity;

/**
 * 프로브 실패 분류입니다. 모두 스윕에 치명적이지 않으며 레코드로 변환됩니다.
 */
public enum ProbeFailure {
    DNS_RESOLUTION_FAILED("DNS resolution failed"),
    CONNECTION_REFUSED("Connection refused"),
    CONNECTION_TIMEOUT("Connection timeout"),
    TLS_HANDSHAKE_FAILED("TLS handshake failed"),
    NO_CERTIFICATE_PRESENTED("No certificate found");

    private final String description;

    ProbeFailure(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
