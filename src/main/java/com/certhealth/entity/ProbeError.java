package com.certhealth.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 분류된 프로브 실패와 원인 상세입니다.
 */
@Getter
@EqualsAndHashCode
public class ProbeError {

    private final ProbeFailure failure;
    /** 원인 예외 메시지 등 (없을 수 있음) */
    private final String detail;

    public ProbeError(ProbeFailure failure, String detail) {
        this.failure = Objects.requireNonNull(failure, "failure");
        this.detail = detail;
    }

    public static ProbeError of(ProbeFailure failure) {
        return new ProbeError(failure, null);
    }

    /** 대시보드에 그대로 노출되는 문자열 (ex. "Connection timeout: connect timed out") */
    public String message() {
        if (detail == null || detail.isBlank()) {
            return failure.description();
        }
        return failure.description() + ": " + detail;
    }

    @Override
    public String toString() {
        return message();
    }
}
