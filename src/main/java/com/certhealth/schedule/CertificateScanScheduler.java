package com.certhealth.schedule;

import com.certhealth.config.CertHealthProperties;
import com.certhealth.entity.CertificateRecord;
import com.certhealth.entity.Domain;
import com.certhealth.entity.ProbeResult;
import com.certhealth.entity.ScanAttempt;
import com.certhealth.entity.SweepReport;
import com.certhealth.service.CertificateProber;
import com.certhealth.service.CertificateResultStore;
import com.certhealth.service.DomainRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 주기 스윕과 즉시 점검을 담당하는 스케줄러입니다.
 * - 자체 타이머(start/stop)와 주입된 Clock 으로 스윕 도래 여부를 판단합니다.
 * - 프로브는 고정 크기 워커 풀에서 실행됩니다.
 * - 같은 도메인은 동시에 하나만 PROBING 상태가 될 수 있습니다.
 * - 스윕 데드라인/중지 시 진행 중 프로브의 결과는 저장하지 않고 버립니다.
 * - 실패한 프로브는 같은 스윕 안에서 재시도하지 않습니다. (다음 스윕이 재시도)
 */
@Slf4j
@Component
public class CertificateScanScheduler implements SmartLifecycle, DisposableBean {

    enum Outcome { RECORDED, ERROR, ABANDONED }

    private final CertificateProber prober;
    private final DomainRegistry registry;
    private final CertificateResultStore store;
    private final HostPacer pacer;
    private final CertHealthProperties props;
    private final Clock clock;

    private final ExecutorService workers;
    private final ConcurrentMap<String, ScanAttempt> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    /** 즉시 점검용 컨텍스트 (destroy 시에만 취소) */
    private final ScanContext onDemand = new ScanContext("on-demand");

    private ScheduledExecutorService timer;
    private volatile boolean running;
    private volatile Instant nextSweepAt;
    private volatile SweepReport lastReport;
    private volatile ScanContext currentSweep;

    public CertificateScanScheduler(CertificateProber prober, DomainRegistry registry, CertificateResultStore store,
                                    HostPacer pacer, CertHealthProperties props, Clock clock) {
        this.prober = prober;
        this.registry = registry;
        this.store = store;
        this.pacer = pacer;
        this.props = props;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(props.effectiveWorkers(), namedThreads("cert-probe"));
    }

    // ------------------------------------------------------------------ lifecycle

    /** 주기 타이머를 시작합니다. 첫 틱은 initial-delay 뒤이며 첫 틱에서 바로 스윕합니다. */
    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) return;
            timer = Executors.newSingleThreadScheduledExecutor(namedThreads("cert-sweep-timer"));
            timer.scheduleWithFixedDelay(this::safeTick,
                    props.getInitialDelay().toMillis(),
                    Math.max(1, props.getTickInterval().toMillis()),
                    TimeUnit.MILLISECONDS);
            running = true;
            log.info("Certificate sweep timer started (interval={}, workers={})",
                    props.getSweepInterval(), props.effectiveWorkers());
        }
    }

    /** 타이머를 멈추고 진행 중인 스윕을 취소합니다. 즉시 점검은 계속 받을 수 있습니다. */
    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            cancelSweep();
            if (!running) return;
            running = false;
            timer.shutdownNow();
            timer = null;
            log.info("Certificate sweep timer stopped");
        }
    }

    /**
     * 진행 중인 스윕을 취소합니다. 아직 저장되지 않은 결과는 버려집니다.
     *
     * @return 취소할 스윕이 있었으면 true
     */
    public boolean cancelSweep() {
        ScanContext sweep = currentSweep;
        if (sweep == null) return false;
        sweep.cancel();
        log.warn("Certificate sweep cancelled");
        return true;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isSchedulingEnabled();
    }

    @Override
    public void destroy() {
        stop();
        onDemand.cancel();
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------ periodic sweep

    /**
     * 스윕이 도래했으면 실행합니다. (타이머가 주기적으로 호출)
     * 이미 스윕이 진행 중이면 건너뜁니다.
     */
    public void tick() {
        Instant now = clock.instant();
        Instant due = nextSweepAt;
        if (due != null && now.isBefore(due)) return;
        if (!sweeping.compareAndSet(false, true)) {
            // 다음 틱에서 다시 확인하므로 nextSweepAt 은 그대로 둡니다.
            log.debug("Sweep still running at {}, skipping tick", now);
            return;
        }
        nextSweepAt = now.plus(props.getSweepInterval());
        sweepClaimed();
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // 타이머 루프가 죽지 않도록 여기서 끊습니다.
            log.error("Certificate sweep tick failed", e);
        }
    }

    /**
     * 활성 도메인 스냅샷을 한 번 떠서 도메인마다 정확히 한 번씩 프로브합니다.
     * 스냅샷 이후 추가된 도메인은 다음 스윕에서 점검됩니다.
     *
     * @throws IllegalStateException 다른 스윕이 진행 중일 때
     */
    public SweepReport runSweep() {
        if (!sweeping.compareAndSet(false, true)) {
            throw new IllegalStateException("A certificate sweep is already running");
        }
        return sweepClaimed();
    }

    /** sweeping 플래그를 획득한 뒤에만 호출합니다. 끝나면 플래그를 돌려놓습니다. */
    private SweepReport sweepClaimed() {
        try {
            Instant startedAt = clock.instant();
            ScanContext sweep = new ScanContext("sweep@" + startedAt);
            currentSweep = sweep;
            SweepReport report = sweep(sweep, startedAt);
            lastReport = report;
            log.info("Certificate sweep finished: total={}, recorded={}, skipped={}, errors={}, abandoned={}, took={}ms",
                    report.getTotal(), report.getRecorded(), report.getSkipped(), report.getErrors(),
                    report.getAbandoned(), report.duration().toMillis());
            return report;
        } finally {
            currentSweep = null;
            sweeping.set(false);
        }
    }

    private SweepReport sweep(ScanContext sweep, Instant startedAt) {
        // 1) 활성 도메인 스냅샷 (한 번만)
        List<Domain> snapshot;
        try {
            snapshot = List.copyOf(registry.listAllActiveDomains());
        } catch (RuntimeException e) {
            log.error("Could not enumerate active domains, sweep aborted", e);
            return SweepReport.builder()
                    .startedAt(startedAt).finishedAt(clock.instant())
                    .aborted(true)
                    .build();
        }
        log.info("Certificate sweep started for {} domain(s)", snapshot.size());

        // 2) 도메인별 작업 제출 (이미 진행 중이면 건너뜀)
        int skipped = 0;
        int abandoned = 0;
        List<CompletableFuture<ScanResult>> futures = new ArrayList<>();
        for (Domain domain : snapshot) {
            ScanAttempt attempt = claim(domain);
            if (attempt == null) {
                log.warn("Domain {} ({}) is already being probed, skipped in this sweep", domain.getId(), domain.getHostname());
                skipped++;
                continue;
            }
            try {
                futures.add(submit(domain, attempt, sweep));
            } catch (RejectedExecutionException e) {
                release(domain, attempt);
                abandoned++;
            }
        }

        // 3) 데드라인 안에서 결과 수집
        int recorded = 0;
        int errors = 0;
        long deadline = System.nanoTime() + props.getSweepDeadline().toNanos();
        for (CompletableFuture<ScanResult> f : futures) {
            try {
                // 취소 이후에는 기다리지 않고 이미 끝난 결과만 집계
                ScanResult r = sweep.isCancelled()
                        ? f.getNow(ScanResult.ABANDONED)
                        : f.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                switch (r.outcome) {
                    case RECORDED: recorded++; break;
                    case ERROR: errors++; break;
                    default: abandoned++;
                }
            } catch (TimeoutException e) {
                log.warn("Certificate sweep exceeded its deadline of {}, abandoning remaining probes", props.getSweepDeadline());
                sweep.cancel();
                abandoned++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sweep.cancel();
                abandoned++;
            } catch (ExecutionException e) {
                log.error("Unexpected failure in probe task", e.getCause());
                errors++;
            }
        }

        return SweepReport.builder()
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .total(snapshot.size())
                .recorded(recorded)
                .skipped(skipped)
                .errors(errors)
                .abandoned(abandoned)
                .aborted(false)
                .build();
    }

    // ------------------------------------------------------------------ on-demand scan

    /**
     * 도메인 하나를 즉시 점검합니다. (신규 등록 등)
     * 이미 진행 중이거나 결과가 버려지면 empty 로 완료됩니다.
     */
    public CompletableFuture<Optional<CertificateRecord>> scanDomain(Domain domain) {
        Objects.requireNonNull(domain, "domain");
        ScanAttempt attempt = claim(domain);
        if (attempt == null) {
            log.warn("Domain {} ({}) is already being probed, on-demand scan skipped", domain.getId(), domain.getHostname());
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            return submit(domain, attempt, onDemand).thenApply(r -> Optional.ofNullable(r.record));
        } catch (RejectedExecutionException e) {
            release(domain, attempt);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    // ------------------------------------------------------------------ single domain work

    private CompletableFuture<ScanResult> submit(Domain domain, ScanAttempt attempt, ScanContext ctx) {
        return CompletableFuture.supplyAsync(() -> scan(domain, attempt, ctx), workers);
    }

    /** Pending → Probing → {Succeeded, Failed} → Recorded */
    ScanResult scan(Domain domain, ScanAttempt attempt, ScanContext ctx) {
        try {
            if (ctx.isCancelled()) return ScanResult.ABANDONED;
            pacer.await(domain.getHostname());
            if (ctx.isCancelled()) return ScanResult.ABANDONED;

            attempt.moveTo(ScanAttempt.State.PROBING);
            ProbeResult result = prober.probe(domain.getHostname(), domain.getPort(),
                    Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
            attempt.moveTo(result.isSuccess() ? ScanAttempt.State.SUCCEEDED : ScanAttempt.State.FAILED);

            CertificateRecord record = result.toRecord(domain.getId(), clock.instant());
            boolean written;
            try {
                written = ctx.recordIfActive(() -> store.recordCertificateCheck(domain.getId(), record));
            } catch (RuntimeException e) {
                log.error("Failed to store certificate check for domain {} ({})", domain.getId(), domain.getHostname(), e);
                return ScanResult.ERROR;
            }
            if (!written) {
                log.debug("Discarded probe result for {} after {} was cancelled", domain.getHostname(), ctx.name);
                return ScanResult.ABANDONED;
            }
            attempt.moveTo(ScanAttempt.State.RECORDED);
            if (log.isDebugEnabled()) {
                log.debug("Probed {}:{} valid={} error={} ({}ms)", domain.getHostname(), domain.getPort(),
                        record.isValid(), record.getError(), result.getElapsedMs());
            }
            return new ScanResult(Outcome.RECORDED, record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScanResult.ABANDONED;
        } catch (RuntimeException e) {
            log.error("Unexpected error while probing domain {} ({})", domain.getId(), domain.getHostname(), e);
            return ScanResult.ERROR;
        } finally {
            release(domain, attempt);
        }
    }

    /** 도메인 잠금 획득. 이미 진행 중이면 null */
    private ScanAttempt claim(Domain domain) {
        ScanAttempt attempt = new ScanAttempt(domain.getId(), clock.instant());
        return inFlight.putIfAbsent(domain.getId(), attempt) == null ? attempt : null;
    }

    private void release(Domain domain, ScanAttempt attempt) {
        inFlight.remove(domain.getId(), attempt);
    }

    // ------------------------------------------------------------------ status

    public boolean isInFlight(String domainId) {
        return inFlight.containsKey(domainId);
    }

    public boolean isSweeping() {
        return sweeping.get();
    }

    public Optional<SweepReport> lastSweepReport() {
        return Optional.ofNullable(lastReport);
    }

    /** 다음 스윕 예정 시각. 아직 한 번도 돌지 않았으면 empty (다음 틱에 실행) */
    public Optional<Instant> nextSweepAt() {
        return Optional.ofNullable(nextSweepAt);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    static final class ScanResult {
        static final ScanResult ABANDONED = new ScanResult(Outcome.ABANDONED, null);
        static final ScanResult ERROR = new ScanResult(Outcome.ERROR, null);

        final Outcome outcome;
        final CertificateRecord record;

        ScanResult(Outcome outcome, CertificateRecord record) {
            this.outcome = outcome;
            this.record = record;
        }
    }
}
