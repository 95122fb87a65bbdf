package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.gateway.GatewayProvider;
import com.flagship.settlement_engine.payment.dto.PaymentResponse;
import com.flagship.settlement_engine.payment.dto.ProcessPaymentRequest;
import com.flagship.settlement_engine.payment.dto.RefundPaymentRequest;
import com.flagship.settlement_engine.payment.dto.RefundResponse;
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
@RequestMapping("/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentProcessingService paymentService;

    /**
     * 201 for a new payment, whatever its outcome; 200 when the Idempotency-Key
     * matched an earlier request.
     */
    @PostMapping("/process")
    public ResponseEntity<PaymentResponse> processPayment(
            @Valid @RequestBody ProcessPaymentRequest request,
            @RequestHeader(name = "Idempotency-Key", required = false) String idempotencyKey,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        log.info("Payment request: invoiceId={}, amount={}, provider={}, idempotencyKey={}",
            request.getInvoiceId(), request.getAmount(), request.getGatewayProvider(), idempotencyKey);

        GatewayProvider provider = request.getGatewayProvider() == null
            ? null : GatewayProvider.fromValue(request.getGatewayProvider());
        PaymentOutcome outcome = paymentService.processPayment(request.getInvoiceId(), request.getAmount(),
            request.getPaymentMethod(), provider, idempotencyKey, callerId);

        HttpStatus status = outcome.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PaymentResponse.from(outcome.getPayment()));
    }

    @GetMapping("/{paymentId}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("paymentId") UUID paymentId) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.getPayment(paymentId)));
    }

    @GetMapping("/invoice/{invoiceId}")
    public ResponseEntity<List<PaymentResponse>> paymentsForInvoice(@PathVariable("invoiceId") UUID invoiceId) {
        return ResponseEntity.ok(paymentService.paymentsForInvoice(invoiceId).stream()
            .map(PaymentResponse::from)
            .toList());
    }

    @PostMapping("/{paymentId}/refund")
    public ResponseEntity<RefundResponse> refund(
            @PathVariable("paymentId") UUID paymentId,
            @Valid @RequestBody RefundPaymentRequest request,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        log.info("Refund request: paymentId={}, amount={}", paymentId, request.getAmount());
        Refund refund = paymentService.refundPayment(paymentId, request.getAmount(), request.getReason(), callerId);
        return ResponseEntity.ok(RefundResponse.from(refund));
    }

    @GetMapping("/{paymentId}/refunds")
    public ResponseEntity<List<RefundResponse>> refunds(@PathVariable("paymentId") UUID paymentId) {
        return ResponseEntity.ok(paymentService.refundsForPayment(paymentId).stream()
            .map(RefundResponse::from)
            .toList());
    }
}
