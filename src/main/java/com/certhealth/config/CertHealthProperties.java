package com.certhealth.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * application.properties 의 "certhealth.*" 키들을 객체로 바인딩하는 설정 클래스입니다.
 * - @ConfigurationProperties(prefix = "certhealth") : "certhealth." 접두사의 속성을 이 클래스 필드에 주입
 */
@Component
@ConfigurationProperties(prefix = "certhealth")
@ToString
@Getter
@Setter
public class CertHealthProperties {

    /** 스케줄러 활성화 여부 (true면 기동 시 주기 스윕 타이머 시작) */
    private boolean schedulingEnabled = true;

    /** 스윕 시작 간격 */
    private Duration sweepInterval = Duration.ofHours(12);

    /** 타이머가 스윕 도래 여부를 확인하는 주기 */
    private Duration tickInterval = Duration.ofMinutes(1);

    /** 첫 틱까지의 지연 */
    private Duration initialDelay = Duration.ofSeconds(30);

    /** 스윕 전체 데드라인 (초과 시 남은 프로브는 버림) */
    private Duration sweepDeadline = Duration.ofHours(2);

    /** 호스트당 소켓 타임아웃(초) */
    private int timeoutSeconds = 10;

    /** 동시 체크 스레드 수 */
    private int workers = 10;

    /** 같은 호스트에 대한 프로브 시작 최소 간격 */
    private Duration hostPacing = Duration.ofSeconds(1);

    /** 타깃에 포트가 없을 때 사용할 포트 */
    private int defaultPort = 443;

    /** 만료 임박 조회 기본 일수 */
    private int expiringLookaheadDays = 30;

    /** 쉼표로 나열한 시드 타깃 목록 (host 또는 host:port) */
    private List<String> targets = new ArrayList<>();

    /** 한 줄 한 타깃의 파일 경로 (상대/절대 모두 가능) */
    private String targetsFile = null;

    /** 시드 타깃을 등록할 소유자 ID */
    private String targetsOwnerId = "system";

    /** 점검 결과 저장소 설정 */
    private Store store = new Store();

    /** 내부 클래스로 저장소 설정을 캡슐화 */
    @ToString
    @Getter
    @Setter
    public static class Store {
        /** memory 또는 jdbc */
        private String type = "memory";
    }

    /** 워커 수는 1..64 로 제한합니다. */
    public int effectiveWorkers() {
        return Math.min(64, Math.max(1, workers));
    }
}
