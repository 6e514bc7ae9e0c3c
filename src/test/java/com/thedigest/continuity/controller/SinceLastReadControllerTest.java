package com.thedigest.continuity.controller;

import com.thedigest.continuity.dto.Brief;
import com.thedigest.continuity.dto.ContinuityStateView;
import com.thedigest.continuity.dto.SinceLastReadPayload;
import com.thedigest.continuity.dto.SnapshotCounts;
import com.thedigest.continuity.dto.SnapshotState;
import com.thedigest.continuity.model.Depth;
import com.thedigest.continuity.service.CandidateStoreUnavailableException;
import com.thedigest.continuity.service.ContinuityEngine;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SinceLastReadControllerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-02-17T12:00:00Z");

    @Mock
    private ContinuityEngine continuityEngine;

    @Mock
    private RequestThrottle throttle;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SinceLastReadController controller = new SinceLastReadController(
                continuityEngine, new ApiRequestAuthenticator("s3cret"), throttle);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void getUsesHeaderClientIdAndSetsCookie() throws Exception {
        when(throttle.tryAcquire(any())).thenReturn(true);
        when(continuityEngine.getSinceLastRead("device-1", "10m")).thenReturn(payload("device-1"));

        mockMvc.perform(get("/api/since-last-read")
                        .param("depth", "10m")
                        .header("X-Digest-Client-Id", "device-1")
                        .cookie(new Cookie("the_digest_client_id", "cookie-id")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.clientId").value("device-1"))
                .andExpect(jsonPath("$.state.depth").value("medium"))
                .andExpect(jsonPath("$.state.isFirstVisit").value(false))
                .andExpect(jsonPath("$.brief.headline").value("No major new updates since Feb 17, 10:00 AM UTC"))
                .andExpect(header().string("Set-Cookie", containsString("the_digest_client_id=device-1")))
                .andExpect(header().string("Set-Cookie", containsString("Max-Age=31536000")));
    }

    @Test
    void getFallsBackToCookieThenAnonymous() throws Exception {
        when(throttle.tryAcquire(any())).thenReturn(true);
        when(continuityEngine.getSinceLastRead(eq("cookie-id"), any())).thenReturn(payload("cookie-id"));
        when(continuityEngine.getSinceLastRead(eq("anonymous"), any())).thenReturn(payload("anonymous"));

        mockMvc.perform(get("/api/since-last-read").cookie(new Cookie("the_digest_client_id", "cookie-id")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.clientId").value("cookie-id"));
        mockMvc.perform(get("/api/since-last-read"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.clientId").value("anonymous"));
    }

    @Test
    void throttledRequestsGet429() throws Exception {
        when(throttle.tryAcquire(any())).thenReturn(false);

        mockMvc.perform(get("/api/since-last-read"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Too many requests"));
        verify(continuityEngine, never()).getSinceLastRead(any(), any());
    }

    @Test
    void candidateStoreOutageMapsTo503() throws Exception {
        when(throttle.tryAcquire(any())).thenReturn(true);
        when(continuityEngine.getSinceLastRead(any(), any()))
                .thenThrow(new CandidateStoreUnavailableException("Failed to fetch delta articles", new RuntimeException()));

        mockMvc.perform(get("/api/since-last-read"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Failed to fetch delta articles"));
    }

    @Test
    void postRequiresBearerToken() throws Exception {
        mockMvc.perform(post("/api/since-last-read")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"depth\": \"deep\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Missing Authorization header"));

        mockMvc.perform(post("/api/since-last-read")
                        .header("Authorization", "Bearer wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"depth\": \"deep\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid API token"));

        verify(continuityEngine, never()).acknowledge(any(), any(), any());
    }

    @Test
    void postAcknowledgesWatermark() throws Exception {
        when(throttle.tryAcquire(any())).thenReturn(true);
        when(continuityEngine.acknowledge("device-1", "deep", "2026-02-17T11:00:00Z"))
                .thenReturn(new ContinuityStateView("device-1", OffsetDateTime.parse("2026-02-17T11:00:00Z"), Depth.DEEP));

        mockMvc.perform(post("/api/since-last-read")
                        .header("Authorization", "Bearer s3cret")
                        .header("X-Digest-Client-Id", "device-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"depth\": \"deep\", \"untilAt\": \"2026-02-17T11:00:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.state.clientId").value("device-1"))
                .andExpect(jsonPath("$.state.preferredDepth").value("deep"))
                .andExpect(header().string("Set-Cookie", containsString("the_digest_client_id=device-1")));
    }

    @Test
    void postWithoutBodyAcknowledgesUpToNow() throws Exception {
        when(throttle.tryAcquire(any())).thenReturn(true);
        when(continuityEngine.acknowledge("anonymous", null, null))
                .thenReturn(new ContinuityStateView("anonymous", NOW, Depth.SHALLOW));

        mockMvc.perform(post("/api/since-last-read").header("Authorization", "Bearer s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.preferredDepth").value("shallow"));
    }

    private static SinceLastReadPayload payload(String clientId) {
        return SinceLastReadPayload.builder()
                .state(SnapshotState.builder()
                        .clientId(clientId)
                        .depth(Depth.MEDIUM)
                        .lastSeenAt(NOW.minusHours(2))
                        .sinceAt(NOW.minusHours(2))
                        .untilAt(NOW)
                        .isFirstVisit(false)
                        .snapshotHash("0123456789abcdef01234567")
                        .build())
                .counts(new SnapshotCounts(0, 0, 0))
                .highlights(List.of())
                .citations(List.of())
                .brief(new Brief("No major new updates since Feb 17, 10:00 AM UTC",
                        "You are caught up. No meaningful deltas were detected in your tracked feed.",
                        List.of(), List.of(), List.of()))
                .build();
    }
}
