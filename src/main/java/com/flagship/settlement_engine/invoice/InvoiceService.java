package com.flagship.settlement_engine.invoice;

import com.flagship.settlement_engine.balance.BalanceLedgerService;
import com.flagship.settlement_engine.balance.ProfessionalLockRegistry;
import com.flagship.settlement_engine.commission.CommissionFact;
import com.flagship.settlement_engine.commission.CommissionLedgerService;
import com.flagship.settlement_engine.common.Money;
import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import com.flagship.settlement_engine.exception.ResourceNotFoundException;
import com.flagship.settlement_engine.exception.ValidationException;
import com.flagship.settlement_engine.invoice.event.InvoiceIssuedEvent;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import com.flagship.settlement_engine.payment.PaymentRepository;
import com.flagship.settlement_engine.payment.PaymentStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Invoice lifecycle: monthly generation, settlement by payment or credit,
 * cancellation and overdue marking.
 *
 * Generation runs under the professional's lock in one transaction:
 * 1. Return the live invoice for the period if there is one
 * 2. Collect RECORDED platform facts completed before the period end
 * 3. Persist the draft, mark the facts INVOICED, send it
 * 4. Consume available credits oldest first; a fully credited invoice is paid on the spot
 * 5. Write InvoiceIssued to the outbox
 */
@Service
@Slf4j
public class InvoiceService {

    static final String AGGREGATE_TYPE = "Invoice";

    private final InvoiceRepository invoiceRepository;
    private final InvoiceCreditRepository creditRepository;
    private final CommissionLedgerService commissionLedger;
    private final BalanceLedgerService balanceLedger;
    private final PaymentRepository paymentRepository;
    private final OutboxService outboxService;
    private final ProfessionalLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final SettlementMetrics metrics;
    private final SettlementProperties properties;
    private final Clock clock;

    public InvoiceService(InvoiceRepository invoiceRepository,
                          InvoiceCreditRepository creditRepository,
                          CommissionLedgerService commissionLedger,
                          BalanceLedgerService balanceLedger,
                          PaymentRepository paymentRepository,
                          OutboxService outboxService,
                          ProfessionalLockRegistry locks,
                          TransactionTemplate transactionTemplate,
                          SettlementMetrics metrics,
                          SettlementProperties properties,
                          Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.creditRepository = creditRepository;
        this.commissionLedger = commissionLedger;
        this.balanceLedger = balanceLedger;
        this.paymentRepository = paymentRepository;
        this.outboxService = outboxService;
        this.locks = locks;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates the professional's invoice for a month, or returns the live one.
     *
     * @throws ValidationException with code NOTHING_TO_INVOICE if no recorded commission falls in the period
     */
    public InvoiceGeneration generateMonthlyInvoice(String professionalId, int month, int year, String createdBy) {
        BillingPeriod period = BillingPeriod.of(month, year);
        MDC.put(CorrelationContext.PROFESSIONAL_ID_MDC_KEY, professionalId);
        try {
            return locks.withLock(professionalId, () -> transactionTemplate.execute(status -> {
                InvoiceEntity live = invoiceRepository.findByActivePeriodKey(period.activeKey(professionalId))
                    .orElse(null);
                if (live != null) {
                    log.info("Professional {} already has invoice {} for {}/{}",
                        professionalId, live.getInvoiceNumber(), month, year);
                    return InvoiceGeneration.existing(live.toDomain());
                }

                List<CommissionFact> facts = commissionLedger.findInvoiceableFacts(
                    professionalId, period.end(properties.zoneId()));
                if (facts.isEmpty()) {
                    throw new ValidationException(ValidationException.NOTHING_TO_INVOICE, String.format(
                        "No recorded commission for %s up to %d/%d", professionalId, month, year));
                }

                Invoice invoice = Invoice.draft(
                    professionalId,
                    period,
                    facts.stream().map(InvoiceLineItem::of).toList(),
                    properties.getVatRate(),
                    LocalDate.now(clock.withZone(properties.zoneId())),
                    properties.getPaymentTermsDays(),
                    createdBy
                );
                InvoiceEntity entity = invoiceRepository.saveAndFlush(InvoiceEntity.fromDomain(invoice));
                MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoice.getId().toString());

                commissionLedger.markInvoiced(facts.stream().map(CommissionFact::getId).toList(), invoice.getId());
                invoice = applyAvailableCredits(invoice.send());

                if (invoice.amountDue().signum() == 0) {
                    invoice = invoice.markPaid(clock.instant());
                    commissionLedger.markInvoicePaid(invoice.getId(), null);
                    clearInvoicedDebt(invoice, invoice.getId());
                    log.info("Invoice {} fully covered by credits", invoice.getInvoiceNumber());
                }

                entity.updateFromDomain(invoice);
                invoiceRepository.save(entity);
                outboxService.saveEvent(AGGREGATE_TYPE, invoice.getId(),
                    InvoiceIssuedEvent.EVENT_TYPE, InvoiceIssuedEvent.fromInvoice(invoice));
                metrics.incrementInvoicesIssued();

                log.info("Issued invoice {} to {}: subtotal={}, vat={}, total={}, credit={}, lines={}",
                    invoice.getInvoiceNumber(), professionalId, invoice.getSubtotal(), invoice.getVatAmount(),
                    invoice.getTotalAmount(), invoice.getCreditApplied(), invoice.getLineItems().size());
                return InvoiceGeneration.created(invoice);
            }));
        } finally {
            MDC.remove(CorrelationContext.PROFESSIONAL_ID_MDC_KEY);
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Marks an invoice paid by a completed payment: invoice PAID, its facts PAID,
     * the subtotal off the professional's outstanding commissions.
     *
     * Must run inside the caller's transaction, under the professional's lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Invoice settleInvoice(UUID invoiceId, UUID paymentId) {
        InvoiceEntity entity = load(invoiceId);
        Invoice paid = entity.toDomain().markPaid(clock.instant());
        entity.updateFromDomain(paid);
        invoiceRepository.save(entity);

        commissionLedger.markInvoicePaid(invoiceId, paymentId);
        clearInvoicedDebt(paid, paymentId);
        log.info("Invoice {} paid by payment {}", paid.getInvoiceNumber(), paymentId);
        return paid;
    }

    /**
     * Whatever part of the subtotal was no longer outstanding goes back as credit on the next invoice.
     */
    private void clearInvoicedDebt(Invoice paid, UUID settlementId) {
        BigDecimal settled = balanceLedger.settleInvoicedDebt(paid.getProfessionalId(), paid.getSubtotal(), settlementId);
        BigDecimal excess = paid.getSubtotal().subtract(settled);
        if (excess.signum() > 0) {
            creditRepository.save(InvoiceCreditEntity.fromDomain(InvoiceCredit.overpaidOn(paid, excess)));
            log.info("Invoice {} covered {} already settled by offsets, credited to {}",
                paid.getInvoiceNumber(), excess, paid.getProfessionalId());
        }
    }

    /**
     * Cancels an unpaid invoice. Its facts return to RECORDED, the period slot is
     * freed and any credit it consumed is handed back as a new credit.
     */
    public Invoice cancelInvoice(UUID invoiceId, String cancelledBy) {
        Invoice current = getInvoice(invoiceId);
        return locks.withLock(current.getProfessionalId(), () -> transactionTemplate.execute(status -> {
            InvoiceEntity entity = load(invoiceId);
            if (paymentRepository.existsByInvoiceIdAndStatus(invoiceId, PaymentStatus.PROCESSING)) {
                throw new InvalidStateTransitionException(
                    "Invoice " + entity.getInvoiceNumber() + " has a payment in progress");
            }
            Invoice cancelled = entity.toDomain().cancel();
            entity.updateFromDomain(cancelled);
            invoiceRepository.save(entity);

            commissionLedger.releaseFromInvoice(invoiceId);
            if (cancelled.getCreditApplied().signum() > 0) {
                creditRepository.save(InvoiceCreditEntity.fromDomain(InvoiceCredit.returnedFrom(cancelled)));
            }
            log.info("Invoice {} cancelled by {}", cancelled.getInvoiceNumber(), cancelledBy);
            return cancelled;
        }));
    }

    /**
     * Moves SENT invoices past due date plus grace to OVERDUE.
     *
     * @return number of invoices marked
     */
    public int markOverdueInvoices(LocalDate today) {
        LocalDate cutoff = today.minusDays(properties.getOverdueGraceDays());
        List<InvoiceEntity> candidates = invoiceRepository.findByStatusAndDueDateBefore(InvoiceStatus.SENT, cutoff);
        int marked = 0;
        for (InvoiceEntity candidate : candidates) {
            Boolean changed = locks.withLock(candidate.getProfessionalId(), () -> transactionTemplate.execute(s -> {
                InvoiceEntity entity = load(candidate.getId());
                if (entity.getStatus() != InvoiceStatus.SENT) {
                    return false;
                }
                entity.updateFromDomain(entity.toDomain().markOverdue());
                invoiceRepository.save(entity);
                return true;
            }));
            if (Boolean.TRUE.equals(changed)) {
                marked++;
                log.info("Invoice {} is overdue (due {})", candidate.getInvoiceNumber(), candidate.getDueDate());
            }
        }
        return marked;
    }

    @Scheduled(cron = "${settlement.overdue-cron}", zone = "${settlement.zone}")
    public void markOverdueInvoicesDaily() {
        int marked = markOverdueInvoices(LocalDate.now(clock.withZone(properties.zoneId())));
        log.info("Overdue marking finished: {} invoices marked", marked);
    }

    /**
     * Records credit to be deducted from the professional's next invoice.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public InvoiceCredit createCredit(String professionalId, BigDecimal amount, UUID payoutId) {
        InvoiceCredit credit = InvoiceCredit.fromPayout(professionalId, Money.round(amount), payoutId);
        creditRepository.save(InvoiceCreditEntity.fromDomain(credit));
        log.info("Invoice credit of {} created for {} from payout {}", amount, professionalId, payoutId);
        return credit;
    }

    @Transactional(readOnly = true)
    public List<InvoiceCredit> creditsForProfessional(String professionalId) {
        return creditRepository.findByProfessionalIdOrderByCreatedAtAsc(professionalId)
            .stream()
            .map(InvoiceCreditEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Invoice getInvoice(UUID invoiceId) {
        return load(invoiceId).toDomain();
    }

    @Transactional(readOnly = true)
    public List<Invoice> invoicesForProfessional(String professionalId) {
        return invoiceRepository.findByProfessionalIdOrderByPeriodYearDescPeriodMonthDescCreatedAtDesc(professionalId)
            .stream()
            .map(InvoiceEntity::toDomain)
            .toList();
    }

    /**
     * Invoices that can still be charged, oldest due date first.
     */
    @Transactional(readOnly = true)
    public List<Invoice> payableInvoices() {
        return invoiceRepository.findByStatusInOrderByDueDateAsc(List.of(InvoiceStatus.SENT, InvoiceStatus.OVERDUE))
            .stream()
            .map(InvoiceEntity::toDomain)
            .toList();
    }

    private Invoice applyAvailableCredits(Invoice invoice) {
        List<InvoiceCreditEntity> credits = creditRepository.findByProfessionalIdAndStatusOrderByCreatedAtAsc(
            invoice.getProfessionalId(), InvoiceCreditStatus.AVAILABLE);
        for (InvoiceCreditEntity entity : credits) {
            if (invoice.amountDue().signum() == 0) {
                break;
            }
            InvoiceCredit before = entity.toDomain();
            InvoiceCredit after = before.consume(invoice.amountDue(), invoice.getId());
            BigDecimal used = after.usedSince(before);
            invoice = invoice.applyCredit(used);
            entity.updateFromDomain(after);
            creditRepository.save(entity);
            log.debug("Applied credit {} of {} to invoice {}", before.getId(), used, invoice.getInvoiceNumber());
        }
        return invoice;
    }

    private InvoiceEntity load(UUID invoiceId) {
        return invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }
}
