package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.settlement.dto.BulkPayoutRequest;
import com.flagship.settlement_engine.settlement.dto.CreatePayoutRequest;
import com.flagship.settlement_engine.settlement.dto.PayoutResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/payouts")
@RequiredArgsConstructor
@Slf4j
public class PayoutController {

    private final SettlementOrchestrator orchestrator;

    @PostMapping("/create")
    public ResponseEntity<PayoutResponse> create(
            @Valid @RequestBody CreatePayoutRequest request,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        log.info("Payout request: professionalId={}, amount={}, method={}",
            request.getProfessionalId(), request.getAmount(), request.getPayoutMethod());
        Payout payout = orchestrator.createPayout(
            request.getProfessionalId(),
            request.getAmount(),
            PayoutMethod.fromValue(request.getPayoutMethod()),
            request.getBankDetails() != null ? request.getBankDetails().toDomain() : null,
            request.getReference(),
            callerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(PayoutResponse.from(payout));
    }

    @GetMapping("/pending")
    public ResponseEntity<List<PayoutResponse>> pending() {
        return ResponseEntity.ok(orchestrator.pendingPayouts().stream().map(PayoutResponse::from).toList());
    }

    @GetMapping("/{payoutId}")
    public ResponseEntity<PayoutResponse> getPayout(@PathVariable("payoutId") UUID payoutId) {
        return ResponseEntity.ok(PayoutResponse.from(orchestrator.getPayout(payoutId)));
    }

    @GetMapping("/professional/{professionalId}")
    public ResponseEntity<List<PayoutResponse>> forProfessional(@PathVariable("professionalId") String professionalId) {
        return ResponseEntity.ok(orchestrator.payoutsForProfessional(professionalId).stream()
            .map(PayoutResponse::from)
            .toList());
    }

    @PostMapping("/process-bulk")
    public ResponseEntity<List<PayoutResponse>> processBulk(
            @Valid @RequestBody BulkPayoutRequest request,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        return ResponseEntity.ok(orchestrator.processBulkPayouts(request.getPayoutIds(), callerId).stream()
            .map(PayoutResponse::from)
            .toList());
    }
}
