package com.flagship.settlement_engine.balance;

import com.flagship.settlement_engine.balance.dto.AutopaySettingsRequest;
import com.flagship.settlement_engine.balance.dto.BalanceMovementResponse;
import com.flagship.settlement_engine.balance.dto.BalanceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/balances")
@RequiredArgsConstructor
@Slf4j
public class BalanceController {

    private final BalanceLedgerService balanceLedger;

    @GetMapping("/{professionalId}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("professionalId") String professionalId) {
        return ResponseEntity.ok(BalanceResponse.from(balanceLedger.getBalance(professionalId)));
    }

    @GetMapping
    public ResponseEntity<List<BalanceResponse>> listBalances(
            @RequestParam(name = "with_outstanding", defaultValue = "false") boolean withOutstanding) {
        return ResponseEntity.ok(balanceLedger.listBalances(withOutstanding).stream()
            .map(BalanceResponse::from)
            .toList());
    }

    @GetMapping("/{professionalId}/movements")
    public ResponseEntity<List<BalanceMovementResponse>> movements(
            @PathVariable("professionalId") String professionalId) {
        return ResponseEntity.ok(balanceLedger.movements(professionalId).stream()
            .map(BalanceMovementResponse::from)
            .toList());
    }

    @PostMapping("/{professionalId}/recalculate")
    public ResponseEntity<BalanceResponse> recalculate(
            @PathVariable("professionalId") String professionalId,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        log.info("Balance recalculation for {} requested by {}", professionalId, callerId);
        return ResponseEntity.ok(BalanceResponse.from(balanceLedger.recalculate(professionalId)));
    }

    @PutMapping("/{professionalId}/autopay")
    public ResponseEntity<BalanceResponse> updateAutopay(
            @PathVariable("professionalId") String professionalId,
            @Valid @RequestBody AutopaySettingsRequest request) {
        Balance balance = Boolean.TRUE.equals(request.getEnabled())
            ? balanceLedger.enableAutopay(professionalId, request.getPaymentMethodId())
            : balanceLedger.disableAutopay(professionalId,
                request.getReason() != null ? request.getReason() : "disabled on request");
        return ResponseEntity.ok(BalanceResponse.from(balance));
    }
}
