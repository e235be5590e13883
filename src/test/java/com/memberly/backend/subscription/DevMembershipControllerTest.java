package com.memberly.backend.subscription;

import com.memberly.backend.subscription.controller.dev.DevMembershipController;
import com.memberly.backend.subscription.service.ExpirySweepException;
import com.memberly.backend.subscription.service.SubscriptionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DevMembershipController.class)
@ActiveProfiles("dev")
class DevMembershipControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean SubscriptionService subscriptionService;

    @Test
    void expireSweep_runsSweepOnce() throws Exception {
        mvc.perform(post("/api/dev/memberships/expire-sweep"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        verify(subscriptionService, times(1)).deactivateExpired();
    }

    @Test
    void expireSweep_partialFailure_returns500WithFailedIds() throws Exception {
        doThrow(new ExpirySweepException(List.of(3L), List.of(new IllegalStateException("DB_TIMEOUT"))))
                .when(subscriptionService).deactivateExpired();

        mvc.perform(post("/api/dev/memberships/expire-sweep").header("X-Request-Id", "sweep-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("EXPIRY_SWEEP_PARTIAL_FAILURE"))
                .andExpect(jsonPath("$.failedMemberIds[0]").value(3))
                .andExpect(jsonPath("$.failedMemberIds.length()").value(1))
                .andExpect(jsonPath("$.requestId").value("sweep-1"));
    }
}
