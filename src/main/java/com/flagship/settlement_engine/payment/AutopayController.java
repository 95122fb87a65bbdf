package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.payment.dto.AutopayRunRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/autopay")
@RequiredArgsConstructor
@Slf4j
public class AutopayController {

    private final AutopayService autopayService;
    private final Clock clock;

    @PostMapping("/run")
    public ResponseEntity<AutopayBatchResult> run(@Valid @RequestBody(required = false) AutopayRunRequest request) {
        AutopayRunRequest effective = request != null ? request : new AutopayRunRequest();
        Instant asOf = effective.getAsOf() != null ? effective.getAsOf() : clock.instant();
        log.info("Manual autopay run: asOf={}, period={}/{}", asOf, effective.getMonth(), effective.getYear());
        return ResponseEntity.ok(autopayService.processAutopayBatch(asOf, effective.getMonth(), effective.getYear()));
    }
}
