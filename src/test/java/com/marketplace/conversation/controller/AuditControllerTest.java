package com.marketplace.conversation.controller;

import com.marketplace.conversation.model.AuditOutcome;
import com.marketplace.conversation.service.AuditTrailService;
import com.marketplace.conversation.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditController.class)
class AuditControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuditTrailService auditTrail;

    @Test
    void recent_defaultsToAllBuyers() throws Exception {
        when(auditTrail.recent(isNull(), eq(100))).thenReturn(List.of(
                TestDataFactory.auditEntry("A-2", "B-2", "message_sent", AuditOutcome.SENT),
                TestDataFactory.auditEntry("A-1", "B-1", "action_pending", AuditOutcome.PENDING)));

        mockMvc.perform(get("/api/v1/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].action").value("message_sent"))
                .andExpect(jsonPath("$[1].outcome").value("PENDING"));
    }

    @Test
    void recent_filteredByBuyer() throws Exception {
        when(auditTrail.recent("B-1", 5)).thenReturn(List.of(
                TestDataFactory.auditEntry("A-1", "B-1", "action_rejected", AuditOutcome.REJECTED)));

        mockMvc.perform(get("/api/v1/audit?buyerId=B-1&limit=5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].buyerId").value("B-1"))
                .andExpect(jsonPath("$[0].actor").value("AUTOMATED"));
    }
}
