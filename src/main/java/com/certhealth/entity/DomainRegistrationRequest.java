package com.certhealth.entity;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 도메인 등록 요청 바디입니다.
 */
@Getter
@Setter
@ToString
public class DomainRegistrationRequest {
    /** 호스트 이름 (host 또는 host:port) */
    @NotBlank
    private String hostname;
    /** 포트 (생략 시 hostname 의 포트 또는 기본 포트) */
    @Min(1)
    @Max(65535)
    private Integer port;
    /** 소유 테넌트 ID */
    @NotBlank
    private String ownerId;

    /** 레지스트리에 넘길 "host[:port]" 타깃 문자열 */
    public String toTarget() {
        return port == null ? hostname.trim() : hostname.trim() + ":" + port;
    }
}
