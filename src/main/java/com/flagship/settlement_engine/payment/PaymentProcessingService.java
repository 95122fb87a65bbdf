package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.balance.ProfessionalLockRegistry;
import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.consumer.IdempotentEventProcessor;
import com.flagship.settlement_engine.exception.AmountMismatchException;
import com.flagship.settlement_engine.exception.GatewayException;
import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import com.flagship.settlement_engine.exception.InvoiceAlreadyPaidException;
import com.flagship.settlement_engine.exception.ResourceNotFoundException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.gateway.ChargeRequest;
import com.flagship.settlement_engine.gateway.GatewayProvider;
import com.flagship.settlement_engine.gateway.GatewayResult;
import com.flagship.settlement_engine.gateway.PaymentGateway;
import com.flagship.settlement_engine.gateway.PaymentGatewayRegistry;
import com.flagship.settlement_engine.gateway.RefundRequest;
import com.flagship.settlement_engine.gateway.WebhookNotification;
import com.flagship.settlement_engine.invoice.Invoice;
import com.flagship.settlement_engine.invoice.InvoiceService;
import com.flagship.settlement_engine.invoice.InvoiceStatus;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.payment.event.PaymentCompletedEvent;
import com.flagship.settlement_engine.payment.event.PaymentFailedEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Charges invoices through the payment gateways.
 *
 * A payment runs in three phases so that no lock or transaction is held
 * while a provider is called:
 * 1. Under the professional's lock: validate the invoice, insert a PROCESSING payment
 * 2. No lock, no transaction: call the gateway
 * 3. Under the lock again: complete (invoice PAID, facts PAID, outstanding reduced),
 *    fail, or leave PROCESSING until the provider's webhook arrives
 *
 * Gateway errors never escape {@link #processPayment}; they become FAILED payments.
 * Nothing is retried synchronously.
 */
@Service
@Slf4j
public class PaymentProcessingService {

    static final String AGGREGATE_TYPE = "Payment";
    static final String WEBHOOK_CONSUMER_GROUP = "gateway-webhooks";

    private final PaymentRepository paymentRepository;
    private final RefundRepository refundRepository;
    private final InvoiceService invoiceService;
    private final PaymentGatewayRegistry gateways;
    private final IdempotencyService idempotencyService;
    private final IdempotentEventProcessor eventProcessor;
    private final OutboxService outboxService;
    private final ProfessionalLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final SettlementMetrics metrics;

    public PaymentProcessingService(PaymentRepository paymentRepository,
                                    RefundRepository refundRepository,
                                    InvoiceService invoiceService,
                                    PaymentGatewayRegistry gateways,
                                    IdempotencyService idempotencyService,
                                    IdempotentEventProcessor eventProcessor,
                                    OutboxService outboxService,
                                    ProfessionalLockRegistry locks,
                                    TransactionTemplate transactionTemplate,
                                    SettlementMetrics metrics) {
        this.paymentRepository = paymentRepository;
        this.refundRepository = refundRepository;
        this.invoiceService = invoiceService;
        this.gateways = gateways;
        this.idempotencyService = idempotencyService;
        this.eventProcessor = eventProcessor;
        this.outboxService = outboxService;
        this.locks = locks;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
    }

    /**
     * Pays an invoice in full.
     *
     * @param provider       null selects the configured default provider
     * @param idempotencyKey optional; a key seen before returns the payment it created
     * @throws InvoiceAlreadyPaidException     if the invoice is PAID
     * @throws InvalidStateTransitionException if the invoice is not payable or already has a payment in flight
     * @throws AmountMismatchException         if amount differs from the invoice's amount due
     */
    public PaymentOutcome processPayment(UUID invoiceId, BigDecimal amount, String paymentMethod,
                                         GatewayProvider provider, String idempotencyKey, String initiatedBy) {
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            var existing = idempotencyService.findPaymentId(idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotency key {} already used by payment {}", idempotencyKey, existing.get());
                return PaymentOutcome.replayed(getPayment(existing.get()));
            }
        }
        ValidationException.requirePositive(amount, "amount");
        if (paymentMethod == null || paymentMethod.isBlank()) {
            throw new ValidationException("payment_method is required");
        }
        GatewayProvider effectiveProvider = provider != null ? provider : gateways.defaultProvider();
        PaymentGateway gateway = gateways.get(effectiveProvider);

        Invoice invoice = invoiceService.getInvoice(invoiceId);
        validatePayable(invoice, amount);

        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        MDC.put(CorrelationContext.PROFESSIONAL_ID_MDC_KEY, invoice.getProfessionalId());
        try {
            Payment payment;
            try {
                payment = locks.withLock(invoice.getProfessionalId(), () -> transactionTemplate.execute(status -> {
                    Invoice current = invoiceService.getInvoice(invoiceId);
                    validatePayable(current, amount);
                    if (paymentRepository.existsByInvoiceIdAndStatus(invoiceId, PaymentStatus.PROCESSING)) {
                        throw new InvalidStateTransitionException(
                            "Invoice " + current.getInvoiceNumber() + " already has a payment in progress");
                    }

                    Payment initiated = Payment.initiate(invoiceId, current.getProfessionalId(), Money.round(amount),
                        paymentMethod, effectiveProvider, initiatedBy);
                    paymentRepository.saveAndFlush(PaymentEntity.fromDomain(initiated, idempotencyKey));
                    return initiated;
                }));
            } catch (DataIntegrityViolationException e) {
                if (idempotencyKey == null) {
                    throw e;
                }
                log.info("Concurrent request with idempotency key {} won the race", idempotencyKey);
                return PaymentOutcome.replayed(paymentRepository.findByIdempotencyKey(idempotencyKey)
                    .map(PaymentEntity::toDomain)
                    .orElseThrow(() -> e));
            }
            idempotencyService.remember(idempotencyKey, payment.getId());

            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, payment.getId().toString());
            log.info("Charging {} for invoice {} via {}", amount, invoice.getInvoiceNumber(), effectiveProvider);

            GatewayResult result;
            try {
                result = gateway.charge(ChargeRequest.builder()
                    .paymentId(payment.getId())
                    .invoiceId(invoiceId)
                    .professionalId(invoice.getProfessionalId())
                    .amount(payment.getAmount())
                    .currency(gateways.currency())
                    .paymentMethod(paymentMethod)
                    .description("Invoice " + invoice.getInvoiceNumber())
                    .build());
            } catch (GatewayException e) {
                log.warn("Gateway {} failed for payment {} (code={}, retryable={}): {}",
                    effectiveProvider, payment.getId(), e.getErrorCode(), e.isRetryable(), e.getMessage());
                return PaymentOutcome.created(failPayment(payment.getId(), e.getErrorCode() + ": " + e.getMessage(),
                    null, e.isRetryable()));
            }

            return PaymentOutcome.created(switch (result.getOutcome()) {
                case SUCCEEDED -> completePayment(payment.getId(), result.getTransactionId());
                case PENDING -> awaitConfirmation(payment.getId(), result.getTransactionId());
                case DECLINED -> {
                    // providers reuse decline references, so they stay out of the unique transaction column
                    log.info("Payment {} declined by {} (reference {})",
                        payment.getId(), effectiveProvider, result.getTransactionId());
                    yield failPayment(payment.getId(), result.failureReason(), null, result.isRetryable());
                }
            });
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PROFESSIONAL_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    /**
     * Refunds part or all of a completed payment. Balances are not touched.
     *
     * @throws GatewayException if the provider declines or fails the refund
     */
    public Refund refundPayment(UUID paymentId, BigDecimal amount, String reason, String requestedBy) {
        ValidationException.requirePositive(amount, "amount");
        Payment payment = getPayment(paymentId);
        checkRefundable(payment, amount);

        GatewayResult result = gateways.get(payment.getGatewayProvider()).refund(RefundRequest.builder()
            .paymentId(paymentId)
            .transactionId(payment.getGatewayTransactionId())
            .amount(Money.round(amount))
            .currency(gateways.currency())
            .reason(reason)
            .build());
        if (result.getOutcome() == GatewayResult.Outcome.DECLINED) {
            log.warn("Refund of {} on payment {} declined: {}", amount, paymentId, result.failureReason());
            throw new GatewayException("Refund declined by " + payment.getGatewayProvider() + ": "
                + result.failureReason(), false);
        }

        return locks.withLock(payment.getProfessionalId(), () -> transactionTemplate.execute(status -> {
            PaymentEntity entity = load(paymentId);
            Payment current = entity.toDomain();
            checkRefundable(current, amount);
            Payment refunded = current.recordRefund(Money.round(amount));
            entity.updateFromDomain(refunded);
            paymentRepository.save(entity);

            Refund refund = Refund.of(paymentId, Money.round(amount), reason, result.getTransactionId(), requestedBy);
            refundRepository.save(RefundEntity.fromDomain(refund));
            metrics.recordPayment(payment.getGatewayProvider().name(),
                refunded.getStatus() == PaymentStatus.REFUNDED ? "refunded" : "partially_refunded");
            log.info("Refunded {} of payment {} (total refunded {}, status {})",
                amount, paymentId, refunded.getRefundedAmount(), refunded.getStatus());
            return refund;
        }));
    }

    /**
     * Applies a provider callback to the payment it concerns. Replays of the same
     * callback are recognised and ignored.
     *
     * @return true if the callback changed anything
     */
    public boolean processWebhook(String providerName, String payload, Map<String, String> headers) {
        GatewayProvider provider = GatewayProvider.fromValue(providerName);
        Map<String, String> normalizedHeaders = headers.entrySet().stream()
            .collect(Collectors.toMap(e -> e.getKey().toLowerCase(Locale.ROOT), Map.Entry::getValue, (a, b) -> a));
        WebhookNotification notification = gateways.get(provider).parseWebhook(payload, normalizedHeaders);

        if (!notification.isFinal()) {
            log.debug("Ignoring non-final {} webhook for {}", provider, notification.getExternalId());
            metrics.recordWebhook(provider.name(), "ignored");
            return false;
        }

        Payment payment = paymentRepository
            .findByGatewayProviderAndGatewayTransactionId(provider, notification.getExternalId())
            .map(PaymentEntity::toDomain)
            .orElse(null);
        if (payment == null) {
            log.warn("{} webhook for unknown transaction {}", provider, notification.getExternalId());
            metrics.recordWebhook(provider.name(), "unknown_transaction");
            return false;
        }

        boolean processed = locks.withLock(payment.getProfessionalId(), () -> eventProcessor.processEvent(
            notification.eventKey(), "Webhook" + notification.getStatus(), AGGREGATE_TYPE,
            payment.getId().toString(), WEBHOOK_CONSUMER_GROUP,
            () -> {
                if (notification.getStatus() == WebhookNotification.Status.SUCCEEDED) {
                    completePayment(payment.getId(), notification.getExternalId());
                } else {
                    failPayment(payment.getId(), notification.getError(), notification.getExternalId(), true);
                }
            }));
        metrics.recordWebhook(provider.name(), processed ? "processed" : "duplicate");
        return processed;
    }

    public Payment getPayment(UUID paymentId) {
        return load(paymentId).toDomain();
    }

    public List<Payment> paymentsForInvoice(UUID invoiceId) {
        return paymentRepository.findByInvoiceIdOrderByCreatedAtDesc(invoiceId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    public List<Refund> refundsForPayment(UUID paymentId) {
        return refundRepository.findByPaymentIdOrderByProcessedAtAsc(paymentId).stream()
            .map(RefundEntity::toDomain)
            .toList();
    }

    /**
     * Completes a PROCESSING payment and settles its invoice. A payment already in a
     * final state is returned unchanged.
     */
    Payment completePayment(UUID paymentId, String transactionId) {
        Payment snapshot = getPayment(paymentId);
        return locks.withLock(snapshot.getProfessionalId(), () -> transactionTemplate.execute(status -> {
            PaymentEntity entity = load(paymentId);
            Payment current = entity.toDomain();
            if (current.isFinal()) {
                log.info("Payment {} already {}, completion ignored", paymentId, current.getStatus());
                return current;
            }
            Payment completed = current.complete(transactionId);
            entity.updateFromDomain(completed);
            paymentRepository.save(entity);

            invoiceService.settleInvoice(completed.getInvoiceId(), paymentId);
            outboxService.saveEvent(AGGREGATE_TYPE, paymentId,
                PaymentCompletedEvent.EVENT_TYPE, PaymentCompletedEvent.fromPayment(completed));
            metrics.recordPayment(completed.getGatewayProvider().name(), "completed");
            log.info("Payment {} completed (tx={})", paymentId, completed.getGatewayTransactionId());
            return completed;
        }));
    }

    Payment failPayment(UUID paymentId, String reason, String transactionId, boolean retryable) {
        Payment snapshot = getPayment(paymentId);
        return locks.withLock(snapshot.getProfessionalId(), () -> transactionTemplate.execute(status -> {
            PaymentEntity entity = load(paymentId);
            Payment current = entity.toDomain();
            if (current.isFinal()) {
                log.info("Payment {} already {}, failure ignored", paymentId, current.getStatus());
                return current;
            }
            Payment failed = current.fail(reason != null ? reason : "unknown gateway failure", transactionId);
            entity.updateFromDomain(failed);
            paymentRepository.save(entity);

            outboxService.saveEvent(AGGREGATE_TYPE, paymentId,
                PaymentFailedEvent.EVENT_TYPE, PaymentFailedEvent.fromPayment(failed, retryable));
            metrics.recordPayment(failed.getGatewayProvider().name(), "failed");
            log.warn("Payment {} failed (retryable={}): {}", paymentId, retryable, failed.getFailureReason());
            return failed;
        }));
    }

    private Payment awaitConfirmation(UUID paymentId, String transactionId) {
        Payment snapshot = getPayment(paymentId);
        return locks.withLock(snapshot.getProfessionalId(), () -> transactionTemplate.execute(status -> {
            PaymentEntity entity = load(paymentId);
            Payment pending = entity.toDomain().awaitConfirmation(transactionId);
            entity.updateFromDomain(pending);
            paymentRepository.save(entity);
            metrics.recordPayment(pending.getGatewayProvider().name(), "pending");
            log.info("Payment {} awaiting provider confirmation (tx={})", paymentId, transactionId);
            return pending;
        }));
    }

    private void validatePayable(Invoice invoice, BigDecimal amount) {
        if (invoice.getStatus() == InvoiceStatus.PAID) {
            throw new InvoiceAlreadyPaidException(invoice.getId());
        }
        if (!invoice.getStatus().isPayable()) {
            throw new InvalidStateTransitionException(String.format(
                "Invoice %s is %s and cannot be paid", invoice.getInvoiceNumber(), invoice.getStatus()));
        }
        if (amount.compareTo(invoice.amountDue()) != 0) {
            throw new AmountMismatchException(invoice.getId(), invoice.amountDue(), amount);
        }
    }

    private static void checkRefundable(Payment payment, BigDecimal amount) {
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new InvalidStateTransitionException(String.format(
                "Payment %s is %s; only COMPLETED payments can be refunded", payment.getId(), payment.getStatus()));
        }
        if (amount.compareTo(payment.refundableAmount()) > 0) {
            throw new ValidationException(String.format(
                "Refund %s exceeds refundable amount %s", amount, payment.refundableAmount()));
        }
    }

    private PaymentEntity load(UUID paymentId) {
        return paymentRepository.findById(paymentId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }
}
