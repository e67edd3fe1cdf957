package com.certhealth.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 최신 인증서 레코드와 현재 시각으로 계산하는 위험 등급입니다. 저장하지 않습니다.
 */
public enum Tier {
    VALID("valid"),
    WARNING("warning"),
    CRITICAL("critical"),
    EXPIRED("expired"),
    INVALID("invalid"),
    NO_CERT("no-cert");

    private final String label;

    Tier(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** 대시보드에서 조치가 필요한 등급인지 (만료/무효/인증서 없음) */
    public boolean needsAttention() {
        return this == EXPIRED || this == INVALID || this == NO_CERT;
    }

    /** 만료 임박 등급인지 (warning/critical) */
    public boolean expiringSoon() {
        return this == WARNING || this == CRITICAL;
    }
}
