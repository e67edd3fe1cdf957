package com.certhealth.service;

import com.certhealth.entity.ProbeResult;

import java.time.Duration;

/**
 * 호스트 하나에 TLS 핸드셰이크를 수행해 리프 인증서 정보를 읽는 프로버입니다.
 * - 저장소에 쓰지 않습니다. (부수효과 없음)
 * - 분류 가능한 실패는 예외 대신 {@link ProbeResult#failure} 로 돌려줍니다.
 */
public interface CertificateProber {

    int DEFAULT_PORT = 443;

    /**
     * @param hostname 대상 호스트
     * @param port     TLS 포트
     * @param timeout  연결/읽기 타임아웃 (양수, 필수)
     */
    ProbeResult probe(String hostname, int port, Duration timeout);

    default ProbeResult probe(String hostname, Duration timeout) {
        return probe(hostname, DEFAULT_PORT, timeout);
    }
}
