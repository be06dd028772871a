package com.kincircle.trust.controller;

import com.kincircle.trust.service.AssistantGateway;
import com.kincircle.trust.service.SessionGuard;
import com.kincircle.trust.service.error.AssistantUnavailableException;
import com.kincircle.trust.service.error.RateLimitedException;
import com.kincircle.trust.service.model.Principal;
import com.kincircle.trust.service.model.RedactionSettings;
import com.kincircle.trust.service.model.Role;
import com.kincircle.trust.service.model.SessionState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AssistantController.class)
class AssistantControllerTest {

    private static final String BODY =
            "{\"question\":\"How is Mom?\",\"context\":[\"a\"],\"subjectName\":\"Mom\"}";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private AssistantGateway gateway;

    @MockBean
    private SessionGuard sessionGuard;

    @Test
    void answersAndPassesPrivacySettings() throws Exception {
        when(sessionGuard.getState()).thenReturn(SessionState.ACTIVE);
        when(gateway.ask(any(), anyString(), anyList(), any())).thenReturn("Fine.");

        mvc.perform(post("/api/assistant/query")
                        .header("X-Principal-Id", "c1").header("X-Principal-Role", "CONTRIBUTOR")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Fine."));

        verify(gateway).ask(new Principal("c1", Role.CONTRIBUTOR), "How is Mom?", List.of("a"),
                new RedactionSettings("Mom", true, null));
    }

    @Test
    void spentBudgetIs429WithRetryAfter() throws Exception {
        when(sessionGuard.getState()).thenReturn(SessionState.ACTIVE);
        when(gateway.ask(any(), anyString(), anyList(), any()))
                .thenThrow(new RateLimitedException("chat-api", 1_500));

        mvc.perform(post("/api/assistant/query")
                        .header("X-Principal-Id", "c1").header("X-Principal-Role", "CONTRIBUTOR")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "2"))
                .andExpect(jsonPath("$.error").value("RATE_LIMITED"));
    }

    @Test
    void unreachableProxyIs502() throws Exception {
        when(sessionGuard.getState()).thenReturn(SessionState.ACTIVE);
        when(gateway.ask(any(), eq("How is Mom?"), anyList(), any()))
                .thenThrow(new AssistantUnavailableException("Assistant call failed: connection refused"));

        mvc.perform(post("/api/assistant/query")
                        .header("X-Principal-Id", "c1").header("X-Principal-Role", "CONTRIBUTOR")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("ASSISTANT_UNAVAILABLE"));
    }

    @Test
    void unrelatedIllegalStateIsAnInternalError() throws Exception {
        when(sessionGuard.getState()).thenReturn(SessionState.ACTIVE);
        when(gateway.ask(any(), anyString(), anyList(), any()))
                .thenThrow(new IllegalStateException("bean not initialized"));

        mvc.perform(post("/api/assistant/query")
                        .header("X-Principal-Id", "c1").header("X-Principal-Role", "CONTRIBUTOR")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"));
    }

    @Test
    void lockedSessionIs423() throws Exception {
        when(sessionGuard.getState()).thenReturn(SessionState.LOCKED);

        mvc.perform(post("/api/assistant/query")
                        .header("X-Principal-Id", "c1").header("X-Principal-Role", "CONTRIBUTOR")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isLocked());
    }
}
