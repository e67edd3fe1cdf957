package com.certhealth.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 스케줄러 상태 (마지막 스윕 결과, 다음 스윕 예정 시각)
 */
@Getter
@Builder
@ToString
public class SweepStatusDTO {
    private final boolean timerRunning;
    private final boolean sweeping;
    private final SweepReport lastReport;
    private final Instant nextSweepAt;
}
