package com.flagship.settlement_engine;

import com.flagship.settlement_engine.commission.CommissionFact;
import com.flagship.settlement_engine.commission.CommissionPostingService;
import com.flagship.settlement_engine.commission.CommissionType;
import com.flagship.settlement_engine.commission.JobCompletion;
import com.flagship.settlement_engine.gateway.GatewayProvider;
import com.flagship.settlement_engine.gateway.StripeGateway;
import com.flagship.settlement_engine.invoice.Invoice;
import com.flagship.settlement_engine.invoice.InvoiceGeneration;
import com.flagship.settlement_engine.invoice.InvoiceService;
import com.flagship.settlement_engine.settlement.bank.BankTransferClient;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;

/**
 * Shared Spring context for the integration tests: H2 in PostgreSQL mode, Flyway
 * migrations, no Kafka, Redis or schedulers.
 *
 * The database outlives a single test, so every test works on fresh professional
 * ids and a billing period of its own. The Stripe adapter and the bank client are
 * mocked here, once, so all subclasses reuse the same context.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class AbstractIntegrationTest {

    @MockBean
    protected StripeGateway stripeGateway;

    @MockBean
    protected BankTransferClient bankTransferClient;

    @Autowired
    protected CommissionPostingService commissionPostingService;

    @Autowired
    protected InvoiceService invoiceService;

    @BeforeEach
    void stubGatewayProvider() {
        when(stripeGateway.provider()).thenReturn(GatewayProvider.STRIPE);
    }

    protected static String newProfessionalId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Noon UTC on the 15th, well inside the month in the settlement zone.
     */
    protected static Instant midMonth(int year, int month) {
        return LocalDate.of(year, month, 15).atTime(12, 0).toInstant(ZoneOffset.UTC);
    }

    /**
     * A general-category customer job: the platform takes 10% of the job value.
     */
    protected List<CommissionFact> postCustomerJob(String professionalId, String jobValue, Instant completedAt) {
        return commissionPostingService.postJobCompletion(JobCompletion.builder()
            .jobId("job-" + UUID.randomUUID())
            .professionalId(professionalId)
            .jobValue(new BigDecimal(jobValue))
            .commissionType(CommissionType.CUSTOMER_JOB)
            .category("general")
            .completedAt(completedAt)
            .recordedBy("test")
            .build());
    }

    /**
     * A general-category referral job with a single referrer: 5% to the referrer, 5% to the platform.
     */
    protected List<CommissionFact> postReferralJob(String professionalId, String referrerId, String jobValue,
                                                   Instant completedAt) {
        return commissionPostingService.postJobCompletion(JobCompletion.builder()
            .jobId("job-" + UUID.randomUUID())
            .professionalId(professionalId)
            .jobValue(new BigDecimal(jobValue))
            .commissionType(CommissionType.REFERRAL_JOB)
            .category("general")
            .referrerId(referrerId)
            .completedAt(completedAt)
            .recordedBy("test")
            .build());
    }

    protected Invoice invoiceFor(String professionalId, int month, int year) {
        InvoiceGeneration generation = invoiceService.generateMonthlyInvoice(professionalId, month, year, "test");
        return generation.getInvoice();
    }
}
