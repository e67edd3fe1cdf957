package com.certhealth.schedule;

import com.certhealth.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HostPacerTest {

    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final List<Duration> sleeps = new ArrayList<>();

    @Test
    void firstProbeOfHostDoesNotWait() throws Exception {
        HostPacer pacer = new HostPacer(Duration.ofSeconds(1), clock, sleeps::add);

        assertThat(pacer.await("a.example.com")).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void backToBackProbesOfSameHostAreSpacedByInterval() throws Exception {
        HostPacer pacer = new HostPacer(Duration.ofSeconds(1), clock, sleeps::add);

        pacer.await("a.example.com");
        Duration second = pacer.await("a.example.com");
        Duration third = pacer.await("a.example.com");

        assertThat(second).isEqualTo(Duration.ofSeconds(1));
        assertThat(third).isEqualTo(Duration.ofSeconds(2));
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void differentHostsAreIndependent() throws Exception {
        HostPacer pacer = new HostPacer(Duration.ofSeconds(1), clock, sleeps::add);

        pacer.await("a.example.com");
        assertThat(pacer.await("b.example.com")).isZero();
    }

    @Test
    void slotFreesUpOnceIntervalHasPassed() throws Exception {
        HostPacer pacer = new HostPacer(Duration.ofSeconds(1), clock, sleeps::add);

        pacer.await("a.example.com");
        clock.advance(Duration.ofMillis(1500));

        assertThat(pacer.await("a.example.com")).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void zeroIntervalDisablesPacing() throws Exception {
        HostPacer pacer = new HostPacer(Duration.ZERO, clock, sleeps::add);

        pacer.await("a.example.com");
        pacer.await("a.example.com");

        assertThat(sleeps).isEmpty();
    }
}
