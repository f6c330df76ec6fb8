package com.automate.ScanOps.Controller;

import com.automate.ScanOps.Config.SecurityConfig;
import com.automate.ScanOps.Models.AuthenticatedUser;
import com.automate.ScanOps.Models.RunStatus;
import com.automate.ScanOps.Service.JwtService;
import com.automate.ScanOps.Service.RunService;
import com.automate.ScanOps.Service.SmartScanService;
import com.automate.ScanOps.dto.request.CreateRunRequest;
import com.automate.ScanOps.dto.response.RunResponse;
import com.automate.ScanOps.dto.response.RunStatusSnapshot;
import com.automate.ScanOps.exception.ScanAdmissionConflictException;
import com.automate.ScanOps.exception.TargetRejectedException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {RunController.class, SmartScanController.class})
@Import({SecurityConfig.class, JwtService.class})
class ControllerSecurityTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-0123456789";
    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000e1");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RunService runService;
    @MockBean
    private SmartScanService smartScanService;

    private static String token(List<String> roles, long ttlMillis) {
        return Jwts.builder()
                .claim("user_id", USER_ID.toString())
                .claim("email", "eng@scanops.local")
                .claim("roles", roles)
                .claim("token_type", "access")
                .setIssuedAt(new Date())
                .setExpiration(new Date(System.currentTimeMillis() + ttlMillis))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();
    }

    private static String bearer(String... roles) {
        return "Bearer " + token(List.of(roles), 60_000);
    }

    private static RunResponse runResponse(UUID runId, UUID scopeId) {
        return new RunResponse(runId, USER_ID, "nmap", 1, scopeId, "scanme.example.com", Map.of(),
                List.of("nmap", "scanme.example.com"), 300, RunStatus.PENDING, null, null, null, null, null, null,
                LocalDateTime.now(), null, null);
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/runs"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        verifyNoInteractions(runService);
    }

    @Test
    void expiredTokenIsUnauthorized() throws Exception {
        String expired = "Bearer " + token(List.of("ENGINEER"), -3_600_000);
        mockMvc.perform(get("/api/runs").header(HttpHeaders.AUTHORIZATION, expired))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void viewerCannotLaunchRuns() throws Exception {
        mockMvc.perform(post("/api/runs")
                        .header(HttpHeaders.AUTHORIZATION, bearer("VIEWER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool\":\"nmap\",\"scopeId\":\"" + UUID.randomUUID() + "\",\"target\":\"scanme.example.com\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
        verifyNoInteractions(runService);
    }

    @Test
    void engineerLaunchesRunAsThemselves() throws Exception {
        UUID runId = UUID.randomUUID();
        UUID scopeId = UUID.randomUUID();
        when(runService.create(any(AuthenticatedUser.class), any(CreateRunRequest.class)))
                .thenReturn(runResponse(runId, scopeId));

        mockMvc.perform(post("/api/runs")
                        .header(HttpHeaders.AUTHORIZATION, bearer("ROLE_ENGINEER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool\":\"nmap\",\"scopeId\":\"" + scopeId + "\",\"target\":\"scanme.example.com\","
                                + "\"params\":{\"ports\":\"80\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.runId").value(runId.toString()))
                .andExpect(jsonPath("$.status").value("PENDING"));

        ArgumentCaptor<AuthenticatedUser> user = ArgumentCaptor.forClass(AuthenticatedUser.class);
        ArgumentCaptor<CreateRunRequest> request = ArgumentCaptor.forClass(CreateRunRequest.class);
        verify(runService).create(user.capture(), request.capture());
        assertEquals(USER_ID, user.getValue().userId());
        assertEquals(List.of("ENGINEER"), user.getValue().roles());
        assertEquals("80", request.getValue().params().get("ports"));
    }

    @Test
    void missingToolIsValidationError() throws Exception {
        mockMvc.perform(post("/api/runs")
                        .header(HttpHeaders.AUTHORIZATION, bearer("ENGINEER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scopeId\":\"" + UUID.randomUUID() + "\",\"target\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void targetRejectionKeepsItsReason() throws Exception {
        when(runService.create(any(AuthenticatedUser.class), any(CreateRunRequest.class)))
                .thenThrow(TargetRejectedException.outOfScope("Target \"evil.org\" is not in the allowed scope"));

        mockMvc.perform(post("/api/runs")
                        .header(HttpHeaders.AUTHORIZATION, bearer("ENGINEER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool\":\"nmap\",\"scopeId\":\"" + UUID.randomUUID() + "\",\"target\":\"evil.org\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TARGET_OUT_OF_SCOPE"))
                .andExpect(jsonPath("$.message").value("Target \"evil.org\" is not in the allowed scope"));
    }

    @Test
    void viewerMayReadStatus() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.getStatus(any(AuthenticatedUser.class), eq(runId)))
                .thenReturn(new RunStatusSnapshot(runId, "scanme.example.com", RunStatus.RUNNING, null, "", "", null, null));

        mockMvc.perform(get("/api/runs/" + runId + "/status").header(HttpHeaders.AUTHORIZATION, bearer("VIEWER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void admissionConflictIsReportedAs409() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(smartScanService.start(any(AuthenticatedUser.class), eq(sessionId)))
                .thenThrow(new ScanAdmissionConflictException(sessionId, UUID.randomUUID()));

        mockMvc.perform(post("/api/smart-scans/" + sessionId + "/start").header(HttpHeaders.AUTHORIZATION, bearer("ENGINEER")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SCAN_ALREADY_RUNNING"));
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/smart-scans/not-a-uuid").header(HttpHeaders.AUTHORIZATION, bearer("ENGINEER")))
                .andExpect(status().isBadRequest());
    }
}
