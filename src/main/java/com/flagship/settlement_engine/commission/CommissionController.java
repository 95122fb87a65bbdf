package com.flagship.settlement_engine.commission;

import com.flagship.settlement_engine.commission.dto.CommissionFactResponse;
import com.flagship.settlement_engine.commission.dto.MonthlyCommissionSummaryResponse;
import com.flagship.settlement_engine.commission.dto.RecordCommissionRequest;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.exception.ValidationException;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/commissions")
@RequiredArgsConstructor
@Slf4j
public class CommissionController {

    private final CommissionPostingService postingService;
    private final CommissionLedgerService commissionLedger;
    private final SettlementProperties settlementProperties;

    @PostMapping("/record")
    public ResponseEntity<List<CommissionFactResponse>> recordCommission(
            @Valid @RequestBody RecordCommissionRequest request,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        log.info("Commission record request: jobId={}, professionalId={}, type={}, value={}",
            request.getJobId(), request.getProfessionalId(), request.getCommissionType(), request.getJobValue());

        List<CommissionFact> facts = postingService.postJobCompletion(request.toJobCompletion(callerId));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponses(facts));
    }

    @GetMapping("/job/{jobId}")
    public ResponseEntity<List<CommissionFactResponse>> factsForJob(@PathVariable("jobId") String jobId) {
        return ResponseEntity.ok(toResponses(commissionLedger.factsForJob(jobId)));
    }

    @GetMapping("/professional/{professionalId}")
    public ResponseEntity<List<CommissionFactResponse>> commissionsForProfessional(
            @PathVariable("professionalId") String professionalId,
            @RequestParam(name = "status", required = false) CommissionFactStatus status) {
        return ResponseEntity.ok(toResponses(
            commissionLedger.commissionsForProfessional(professionalId, Optional.ofNullable(status))));
    }

    @GetMapping("/professional/{professionalId}/unpaid")
    public ResponseEntity<List<CommissionFactResponse>> unpaidCommissions(
            @PathVariable("professionalId") String professionalId) {
        return ResponseEntity.ok(toResponses(commissionLedger.unpaidCommissions(professionalId)));
    }

    @GetMapping("/professional/{professionalId}/monthly")
    public ResponseEntity<MonthlyCommissionSummaryResponse> monthlyCommissions(
            @PathVariable("professionalId") String professionalId,
            @RequestParam("month") int month,
            @RequestParam("year") int year) {
        if (month < 1 || month > 12) {
            throw new ValidationException("month must be between 1 and 12, got " + month);
        }
        MonthlyCommissionSummary summary = commissionLedger.monthlyCommissions(
            professionalId, month, year, settlementProperties.zoneId());
        return ResponseEntity.ok(MonthlyCommissionSummaryResponse.from(summary));
    }

    private static List<CommissionFactResponse> toResponses(List<CommissionFact> facts) {
        return facts.stream().map(CommissionFactResponse::from).toList();
    }
}
