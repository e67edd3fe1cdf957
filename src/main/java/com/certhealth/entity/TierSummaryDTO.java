package com.certhealth.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * 테넌트별 등급 집계입니다.
 */
@Getter
@Builder
@ToString
public class TierSummaryDTO {
    private final String ownerId;
    private final int total;
    /** 등급 라벨(valid, no-cert ...) 별 도메인 수 */
    private final Map<String, Long> counts;
    /** warning + critical */
    private final long expiringSoon;
    /** expired + invalid + no-cert */
    private final long needsAttention;
}
