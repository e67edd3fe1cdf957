package com.certhealth.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 스윕 한 번의 실행 요약입니다.
 */
@Getter
@Builder
@ToString
public class SweepReport {
    private final Instant startedAt;
    private final Instant finishedAt;
    /** 스냅샷에 포함된 도메인 수 */
    private final int total;
    /** 레코드가 저장된 수 */
    private final int recorded;
    /** 이미 진행 중이라 건너뛴 수 */
    private final int skipped;
    /** 저장 실패 등 운영 오류 수 */
    private final int errors;
    /** 취소/데드라인으로 버려진 수 */
    private final int abandoned;
    /** 도메인 목록 조회 실패 등으로 스윕 자체가 중단되었는지 */
    private final boolean aborted;

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
