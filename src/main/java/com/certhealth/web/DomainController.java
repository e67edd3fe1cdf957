package com.certhealth.web;

import com.certhealth.entity.CertificateRecord;
import com.certhealth.entity.CertificateStatusDTO;
import com.certhealth.entity.Domain;
import com.certhealth.entity.DomainRegistrationRequest;
import com.certhealth.schedule.CertificateScanScheduler;
import com.certhealth.service.CertificateLookupService;
import com.certhealth.service.DomainNotFoundException;
import com.certhealth.service.DomainRegistrationService;
import com.certhealth.service.DomainRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 도메인 등록/조회 및 단일 도메인 즉시 점검 API 입니다.
 */
@Tag(name = "Domains", description = "모니터링 도메인 관련 API")
@RestController
@RequestMapping("/api/domains")
public class DomainController {

    private final DomainRegistrationService registrationService;
    private final DomainRegistry registry;
    private final CertificateLookupService lookupService;
    private final CertificateScanScheduler scheduler;

    /** 생성자 주입 */
    public DomainController(DomainRegistrationService registrationService, DomainRegistry registry,
                            CertificateLookupService lookupService, CertificateScanScheduler scheduler) {
        this.registrationService = registrationService;
        this.registry = registry;
        this.lookupService = lookupService;
        this.scheduler = scheduler;
    }

    @Operation(summary = "도메인 등록", description = "도메인을 등록하고 최초 인증서 점검을 즉시 시작합니다.")
    @PostMapping
    public ResponseEntity<Domain> register(@Valid @RequestBody DomainRegistrationRequest request) {
        Domain created = registrationService.register(request.toTarget(), request.getOwnerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "테넌트 도메인 목록", description = "소유자의 활성 도메인과 최신 인증서 등급을 반환합니다.")
    @GetMapping
    public ResponseEntity<List<CertificateStatusDTO>> list(@RequestParam String ownerId) {
        return ResponseEntity.ok(lookupService.statusesOf(ownerId));
    }

    @Operation(summary = "도메인 비활성화")
    @DeleteMapping("/{id}")
    public ResponseEntity<Domain> deactivate(@PathVariable String id) {
        return ResponseEntity.ok(registrationService.deactivate(id));
    }

    @Operation(summary = "도메인 즉시 점검", description = "도메인 하나의 인증서를 즉시 점검하고 새 레코드를 반환합니다.")
    @PostMapping("/{id}/check")
    public CompletableFuture<ResponseEntity<CertificateRecord>> checkNow(@PathVariable String id) {
        Domain domain = registry.findById(id).orElseThrow(() -> new DomainNotFoundException(id));
        // 이미 점검 중이거나 결과가 버려졌으면 409
        return scheduler.scanDomain(domain).thenApply(result -> result
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build()));
    }

    @Operation(summary = "최신 인증서 상태", description = "최신 레코드와 조회 시점 기준 등급을 반환합니다.")
    @GetMapping("/{id}/certificate")
    public ResponseEntity<CertificateStatusDTO> latest(@PathVariable String id) {
        return ResponseEntity.ok(lookupService.statusOf(id));
    }

    @Operation(summary = "인증서 점검 이력", description = "도메인의 점검 레코드를 최신순으로 반환합니다.")
    @GetMapping("/{id}/certificates")
    public ResponseEntity<List<CertificateRecord>> history(@PathVariable String id) {
        return ResponseEntity.ok(lookupService.getCertificateHistory(id));
    }
}
