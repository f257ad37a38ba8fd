package com.paymentengine.api.controller;

import com.paymentengine.common.Currency;
import com.paymentengine.common.Money;
import com.paymentengine.payments.PaymentRecord;
import com.paymentengine.payments.PaymentRecordService;
import com.paymentengine.payments.PaymentStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract of the payments API, including error mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PaymentRecordService paymentRecordService;

    @Test
    void testCreateAndGetPayment() throws Exception {
        String agreementId = UUID.randomUUID().toString();
        String body = "{\"agreementId\":\"" + agreementId + "\",\"payerId\":\"payer-1\","
            + "\"instrumentId\":\"pm_card_visa\",\"amount\":25.00,\"currency\":\"USD\"}";

        mockMvc.perform(post("/api/v1/payments").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.retryCount").value(0));

        mockMvc.perform(get("/api/v1/payments/agreement/{id}", agreementId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void testCreatePaymentValidation() throws Exception {
        String body = "{\"agreementId\":\"a-1\",\"payerId\":\"\",\"instrumentId\":\"pm_card_visa\","
            + "\"amount\":-5,\"currency\":\"USD\"}";

        mockMvc.perform(post("/api/v1/payments").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.payerId").exists())
            .andExpect(jsonPath("$.amount").exists());
    }

    @Test
    void testUnknownPaymentIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/payments/{id}", "missing-payment"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value("404"))
            .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void testCancelSucceededPaymentIsConflict() throws Exception {
        PaymentRecord record = paymentRecordService.create(UUID.randomUUID().toString(), "payer-1",
            "pm_card_visa", Money.of("25.00", Currency.USD));
        record.setStatus(PaymentStatus.SUCCEEDED);
        paymentRecordService.save(record);

        mockMvc.perform(post("/api/v1/payments/{id}/cancel", record.getPaymentId()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value("409"));
    }

    @Test
    void testCancelPendingPayment() throws Exception {
        PaymentRecord record = paymentRecordService.create(UUID.randomUUID().toString(), "payer-1",
            "pm_card_visa", Money.of("25.00", Currency.USD));

        mockMvc.perform(post("/api/v1/payments/{id}/cancel", record.getPaymentId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));
    }
}
