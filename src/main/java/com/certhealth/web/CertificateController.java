package com.certhealth.web;

import com.certhealth.config.CertHealthProperties;
import com.certhealth.entity.ExpiringCertificateDTO;
import com.certhealth.entity.SweepReport;
import com.certhealth.entity.SweepStatusDTO;
import com.certhealth.entity.TierSummaryDTO;
import com.certhealth.schedule.CertificateScanScheduler;
import com.certhealth.service.CertificateLookupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP API 엔드포인트를 제공하는 컨트롤러 계층입니다.
 * - /api/check POST : 전체 스윕을 즉시 실행하고 요약을 반환합니다.
 * - /api/certificates/* GET : 만료 임박 조회, 등급 집계
 */
@Tag(name = "Certificates", description = "인증서 점검 관련 API")
@Validated
@RestController
@RequestMapping("/api")
public class CertificateController {

    private final CertificateScanScheduler scheduler;
    private final CertificateLookupService lookupService;
    private final CertHealthProperties props;

    /** 생성자 주입 */
    public CertificateController(CertificateScanScheduler scheduler, CertificateLookupService lookupService,
                                 CertHealthProperties props) {
        this.scheduler = scheduler;
        this.lookupService = lookupService;
        this.props = props;
    }

    /**
     * 즉시 스윕을 트리거하는 POST 엔드포인트 (이미 진행 중이면 409)
     * @return 스윕 요약
     */
    @Operation(summary = "SSL 즉시 점검 실행", description = "모든 활성 도메인의 TLS 인증서를 즉시 점검합니다.")
    @PostMapping("/check")
    public ResponseEntity<SweepReport> certCheckNow() {
        return ResponseEntity.ok(scheduler.runSweep());
    }

    @Operation(summary = "만료 임박 인증서", description = "최신 유효 인증서가 days 일 안에 만료되는 도메인을 반환합니다.")
    @GetMapping("/certificates/expiring")
    public ResponseEntity<List<ExpiringCertificateDTO>> expiring(
            @RequestParam(required = false) @Min(0) @Max(3650) Integer days) {
        int lookahead = days == null ? props.getExpiringLookaheadDays() : days;
        return ResponseEntity.ok(lookupService.queryExpiringCertificates(lookahead));
    }

    @Operation(summary = "등급 집계", description = "소유자의 도메인을 등급별로 집계합니다.")
    @GetMapping("/certificates/summary")
    public ResponseEntity<TierSummaryDTO> summary(@RequestParam String ownerId) {
        return ResponseEntity.ok(lookupService.summarize(ownerId));
    }

    @Operation(summary = "스윕 상태", description = "마지막 스윕 결과와 다음 스윕 예정 시각을 반환합니다.")
    @GetMapping("/sweeps/last")
    public ResponseEntity<SweepStatusDTO> sweepStatus() {
        return ResponseEntity.ok(SweepStatusDTO.builder()
                .timerRunning(scheduler.isRunning())
                .sweeping(scheduler.isSweeping())
                .lastReport(scheduler.lastSweepReport().orElse(null))
                .nextSweepAt(scheduler.nextSweepAt().orElse(null))
                .build());
    }
}
