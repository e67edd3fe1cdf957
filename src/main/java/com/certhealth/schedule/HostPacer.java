package com.certhealth.schedule;

import com.certhealth.config.CertHealthProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 같은 호스트에 대한 프로브 시작 간격을 최소 interval 로 벌립니다.
 * 호출 스레드는 자기 차례가 올 때까지 대기합니다.
 */
@Component
public class HostPacer {

    private static final int PRUNE_THRESHOLD = 1024;

    /** 대기 방법 (테스트에서 교체) */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;

    /** 호스트별 다음 프로브 가능 시각 */
    private final Map<String, Instant> nextAllowed = new ConcurrentHashMap<>();

    @Autowired
    public HostPacer(CertHealthProperties props, Clock clock) {
        this(props.getHostPacing(), clock, d -> Thread.sleep(d.toMillis()));
    }

    public HostPacer(Duration interval, Clock clock, Sleeper sleeper) {
        this.interval = interval == null || interval.isNegative() ? Duration.ZERO : interval;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * hostname 에 대한 다음 슬롯을 예약하고 그 시각까지 대기합니다.
     *
     * @return 실제로 대기한 시간
     */
    public Duration await(String hostname) throws InterruptedException {
        if (interval.isZero()) return Duration.ZERO;

        Instant now = clock.instant();
        Instant next = nextAllowed.compute(hostname, (h, prev) ->
                (prev == null || prev.isBefore(now) ? now : prev).plus(interval));
        Instant slot = next.minus(interval);

        if (nextAllowed.size() > PRUNE_THRESHOLD) {
            nextAllowed.entrySet().removeIf(e -> e.getValue().isBefore(now));
        }

        Duration wait = Duration.between(now, slot);
        if (wait.isNegative() || wait.isZero()) return Duration.ZERO;
        sleeper.sleep(wait);
        return wait;
    }
}
