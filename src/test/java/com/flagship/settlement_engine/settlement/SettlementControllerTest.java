package com.flagship.settlement_engine.settlement;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.AbstractIntegrationTest;
import com.flagship.settlement_engine.settlement.bank.BankTransferResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class SettlementControllerTest extends AbstractIntegrationTest {

    private static final String BANK_DETAILS = """
        {"bank_name": "Leumi", "branch_number": "800", "account_number": "123456789",
         "account_holder_name": "Dana Levi"}
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("POST /settlements/offset nets a credit against a debt")
    void testOffsetEndpoint() throws Exception {
        String creditor = newProfessionalId("creditor");
        String debtor = newProfessionalId("debtor");
        postReferralJob(newProfessionalId("payer"), creditor, "1000.00", midMonth(2023, 11));
        postCustomerJob(debtor, "1000.00", midMonth(2023, 11));

        mockMvc.perform(post("/settlements/offset")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Caller-Id", "finance-ops")
                .content("""
                    {"professional_a_id": "%s", "professional_b_id": "%s", "offset_amount": 40.00,
                     "description": "shared job"}
                    """.formatted(creditor, debtor)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.offset_amount").value(40.0))
            .andExpect(jsonPath("$.processed_by").value("finance-ops"));

        mockMvc.perform(get("/balances/{id}", creditor))
            .andExpect(jsonPath("$.pending_revenue_shares").value(10.0));
        mockMvc.perform(get("/balances/{id}", debtor))
            .andExpect(jsonPath("$.outstanding_commissions").value(60.0));
        mockMvc.perform(get("/settlements/offsets/professional/{id}", debtor))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));

        mockMvc.perform(post("/settlements/offset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"professional_a_id": "%s", "professional_b_id": "%s", "offset_amount": 20.00}
                    """.formatted(creditor, debtor)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"));
    }

    @Test
    @DisplayName("Payout endpoints: minimum amount, bank transfer and bulk processing")
    void testPayoutEndpoints() throws Exception {
        String professionalId = newProfessionalId("earner");
        postReferralJob(newProfessionalId("payer"), professionalId, "10000.00", midMonth(2023, 11));

        mockMvc.perform(post("/payouts/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"professional_id": "%s", "amount": 50.00, "payout_method": "BANK_TRANSFER",
                     "bank_details": %s}
                    """.formatted(professionalId, BANK_DETAILS)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        MvcResult created = mockMvc.perform(post("/payouts/create")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"professional_id": "%s", "amount": 300.00, "payout_method": "BANK_TRANSFER",
                     "bank_details": %s, "reference": "NOV-2023"}
                    """.formatted(professionalId, BANK_DETAILS)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("QUEUED"))
            .andExpect(jsonPath("$.bank_details.account_holder_name").value("Dana Levi"))
            .andReturn();
        JsonNode payout = objectMapper.readTree(created.getResponse().getContentAsString());
        String payoutId = payout.get("id").asText();

        mockMvc.perform(get("/balances/{id}", professionalId))
            .andExpect(jsonPath("$.pending_revenue_shares").value(200.0));

        when(bankTransferClient.transfer(any())).thenReturn(BankTransferResult.accepted("BANK-REF-9"));
        mockMvc.perform(post("/payouts/process-bulk")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"payout_ids\": [\"%s\"]}".formatted(payoutId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].status").value("COMPLETED"));

        mockMvc.perform(get("/payouts/{id}", payoutId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"));
        mockMvc.perform(get("/payouts/professional/{id}", professionalId))
            .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    @DisplayName("Unknown runs and payouts are 404, bad monthly requests are 400")
    void testNotFoundAndValidation() throws Exception {
        mockMvc.perform(get("/settlements/runs/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        mockMvc.perform(post("/settlements/runs/{id}/cancel", UUID.randomUUID()))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/payouts/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());

        mockMvc.perform(post("/settlements/monthly")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"month\": 13, \"year\": 2023}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }
}
