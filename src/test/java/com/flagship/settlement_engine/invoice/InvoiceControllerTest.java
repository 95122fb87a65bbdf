package com.flagship.settlement_engine.invoice;

import com.flagship.settlement_engine.AbstractIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class InvoiceControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private static String generateBody(String professionalId) {
        return "{\"professional_id\": \"%s\", \"month\": 12, \"year\": 2023}".formatted(professionalId);
    }

    @Test
    @DisplayName("POST /invoices/generate answers 201 once, then 200 with the same invoice")
    void testGenerateIsIdempotent() throws Exception {
        String professionalId = newProfessionalId("inv");
        postCustomerJob(professionalId, "1000.00", midMonth(2023, 12));

        mockMvc.perform(post("/invoices/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(generateBody(professionalId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.invoice_number").value(startsWith("INV-202312-")))
            .andExpect(jsonPath("$.status").value("SENT"))
            .andExpect(jsonPath("$.subtotal").value(100.0))
            .andExpect(jsonPath("$.vat_amount").value(17.0))
            .andExpect(jsonPath("$.total_amount").value(117.0))
            .andExpect(jsonPath("$.line_items", hasSize(1)));

        mockMvc.perform(post("/invoices/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(generateBody(professionalId)))
            .andExpect(status().isOk());

        mockMvc.perform(get("/invoices/professional/{id}", professionalId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    @DisplayName("An empty period answers 400 NOTHING_TO_INVOICE")
    void testNothingToInvoice() throws Exception {
        mockMvc.perform(post("/invoices/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(generateBody(newProfessionalId("idle"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("NOTHING_TO_INVOICE"));
    }

    @Test
    @DisplayName("Cancelling an invoice releases it; cancelling twice is a conflict")
    void testCancel() throws Exception {
        String professionalId = newProfessionalId("inv");
        postCustomerJob(professionalId, "500.00", midMonth(2023, 12));
        Invoice invoice = invoiceFor(professionalId, 12, 2023);

        mockMvc.perform(post("/invoices/{id}/cancel", invoice.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));
        mockMvc.perform(post("/invoices/{id}/cancel", invoice.getId()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"));

        mockMvc.perform(get("/invoices/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }
}
