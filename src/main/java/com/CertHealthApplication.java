package com;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 애플리케이션의 진입점(메인 클래스)입니다.
 * - @SpringBootApplication : 컴포넌트 스캔, 자동 설정, 설정 바인딩 등 부트 핵심을 활성화합니다.
 * - 주기 스윕 타이머는 CertificateScanScheduler 가 직접 소유합니다.
 *   (기동 여부는 properties의 certhealth.scheduling-enabled 로 제어)
 */
@SpringBootApplication
public class CertHealthApplication {

    /** 자바 애플리케이션 시작 진입점 (내장 톰캣을 띄워 HTTP 서버가 구동됩니다) */
    public static void main(String[] args) {

        SpringApplication.run(CertHealthApplication.class, args);
    }
}
