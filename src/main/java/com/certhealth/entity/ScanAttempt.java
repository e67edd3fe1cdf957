package com.certhealth.entity;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 스케줄러 내부에서만 쓰는 진행 중 스캔 정보입니다. (저장하지 않음)
 * 도메인별로 동시에 하나의 PROBING 만 허용하기 위해 사용합니다.
 */
@Getter
@ToString
public class ScanAttempt {

    public enum State { PENDING, PROBING, SUCCEEDED, FAILED, RECORDED }

    private final String domainId;
    private final Instant startedAt;
    private volatile State state;

    public ScanAttempt(String domainId, Instant startedAt) {
        this.domainId = domainId;
        this.startedAt = startedAt;
        this.state = State.PENDING;
    }

    /**
     * PENDING → PROBING → {SUCCEEDED, FAILED} → RECORDED 순서로만 진행합니다.
     *
     * @throws IllegalStateException 순서를 벗어난 전이
     */
    public synchronized void moveTo(State next) {
        if (!canMove(state, next)) {
            throw new IllegalStateException("Scan of " + domainId + " cannot move from " + state + " to " + next);
        }
        this.state = next;
    }

    private static boolean canMove(State from, State to) {
        switch (from) {
            case PENDING: return to == State.PROBING;
            case PROBING: return to == State.SUCCEEDED || to == State.FAILED;
            case SUCCEEDED:
            case FAILED: return to == State.RECORDED;
            default: return false;
        }
    }
}
