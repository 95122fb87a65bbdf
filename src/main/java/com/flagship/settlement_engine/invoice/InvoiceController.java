package com.flagship.settlement_engine.invoice;

import com.flagship.settlement_engine.invoice.dto.GenerateInvoiceRequest;
import com.flagship.settlement_engine.invoice.dto.InvoiceResponse;
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
@RequestMapping("/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private final InvoiceService invoiceService;

    /**
     * 201 with the new invoice, or 200 with the live invoice already covering the period.
     */
    @PostMapping("/generate")
    public ResponseEntity<InvoiceResponse> generate(
            @Valid @RequestBody GenerateInvoiceRequest request,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        log.info("Invoice generation request: professionalId={}, period={}/{}",
            request.getProfessionalId(), request.getMonth(), request.getYear());

        InvoiceGeneration generation = invoiceService.generateMonthlyInvoice(
            request.getProfessionalId(), request.getMonth(), request.getYear(), callerId);
        HttpStatus status = generation.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(InvoiceResponse.from(generation.getInvoice()));
    }

    @GetMapping("/{invoiceId}")
    public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable("invoiceId") UUID invoiceId) {
        return ResponseEntity.ok(InvoiceResponse.from(invoiceService.getInvoice(invoiceId)));
    }

    @GetMapping("/professional/{professionalId}")
    public ResponseEntity<List<InvoiceResponse>> invoicesForProfessional(
            @PathVariable("professionalId") String professionalId) {
        return ResponseEntity.ok(invoiceService.invoicesForProfessional(professionalId).stream()
            .map(InvoiceResponse::from)
            .toList());
    }

    @PostMapping("/{invoiceId}/cancel")
    public ResponseEntity<InvoiceResponse> cancel(
            @PathVariable("invoiceId") UUID invoiceId,
            @RequestHeader(name = "X-Caller-Id", defaultValue = "system") String callerId) {
        return ResponseEntity.ok(InvoiceResponse.from(invoiceService.cancelInvoice(invoiceId, callerId)));
    }
}
