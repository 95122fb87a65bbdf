package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.settlement.dto.MonthlySettlementRequest;
import com.flagship.settlement_engine.settlement.dto.OffsetRequest;
import com.flagship.settlement_engine.settlement.dto.OffsetResponse;
import com.flagship.settlement_engine.settlement.dto.SettlementErrorResponse;
import com.flagship.settlement_engine.settlement.dto.SettlementResponse;
import com.flagship.settlement_engine.settlement.dto.SettlementRunResponse;
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
@RequestMapping("/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementOrchestrator orchestrator;

    @PostMapping("/offset")
    public ResponseEntity<OffsetResponse> offset(
            @Valid @RequestBody OffsetRequest request,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        log.info("Offset request: {} -> {}, amount={}",
            request.getProfessionalAId(), request.getProfessionalBId(), request.getOffsetAmount());
        OffsetRecord offset = orchestrator.processBalanceOffset(request.getProfessionalAId(),
            request.getProfessionalBId(), request.getOffsetAmount(), request.getDescription(), callerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(OffsetResponse.from(offset));
    }

    @GetMapping("/offsets/professional/{professionalId}")
    public ResponseEntity<List<OffsetResponse>> offsetsForProfessional(
            @PathVariable("professionalId") String professionalId) {
        return ResponseEntity.ok(orchestrator.offsetsForProfessional(professionalId).stream()
            .map(OffsetResponse::from)
            .toList());
    }

    /**
     * Runs synchronously; the response carries the invoices and the per-professional report.
     */
    @PostMapping("/monthly")
    public ResponseEntity<SettlementResponse> runMonthly(
            @Valid @RequestBody MonthlySettlementRequest request,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        log.info("Monthly settlement requested for {}/{} by {}", request.getMonth(), request.getYear(), callerId);
        MonthlySettlement settlement = orchestrator.runMonthlySettlement(
            request.getMonth(), request.getYear(), callerId);
        return ResponseEntity.ok(SettlementResponse.from(settlement));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<SettlementRunResponse> getRun(@PathVariable("runId") UUID runId) {
        return ResponseEntity.ok(SettlementRunResponse.from(orchestrator.getRun(runId)));
    }

    @GetMapping("/runs/{runId}/errors")
    public ResponseEntity<List<SettlementErrorResponse>> runErrors(@PathVariable("runId") UUID runId) {
        return ResponseEntity.ok(orchestrator.errorsForRun(runId).stream()
            .map(SettlementErrorResponse::from)
            .toList());
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<SettlementRunResponse> cancelRun(@PathVariable("runId") UUID runId) {
        return ResponseEntity.ok(SettlementRunResponse.from(orchestrator.cancelRun(runId)));
    }
}
