package com.example.investigator.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.investigator.model.Domain;
import com.example.investigator.model.InvestigationRequest;
import com.example.investigator.model.InvestigationResponse;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.model.SynthesisResult;
import com.example.investigator.model.SynthesisStrategy;
import com.example.investigator.model.Verdict;
import com.example.investigator.service.AuthorityWeightTable;
import com.example.investigator.service.EmbeddedLogIndex;
import com.example.investigator.service.InvalidRequestException;
import com.example.investigator.service.InvestigationOrchestrator;
import com.example.investigator.specialist.SpecialistRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({InvestigationController.class, SimulationController.class})
class InvestigationControllerTest {

    private static final String CRASH_LOOP =
            """
            {
              "request_id": "req-7",
              "alert": {
                "name": "KubePodCrashLooping",
                "labels": {"namespace": "shop", "pod": "checkout-7d9"},
                "severity": "critical",
                "description": "Back-off restarting failed container"
              }
            }
            """;

    @Autowired private MockMvc mockMvc;

    @MockBean private InvestigationOrchestrator orchestrator;
    @MockBean private SpecialistRegistry registry;
    @MockBean private AuthorityWeightTable weightTable;
    @MockBean private EmbeddedLogIndex logIndex;

    @Test
    void investigateReturnsSnakeCaseResponse() throws Exception {
        SpecialistFinding platform =
                SpecialistFinding.ok(
                        Domain.PLATFORM,
                        "FAIL: OOMKilled",
                        0.9,
                        List.of("Pod status:\ncheckout-7d9 CrashLoopBackOff"),
                        "Raise the memory limit",
                        List.of("kubectl_get_pods"),
                        120);
        SpecialistFinding network = SpecialistFinding.timeout(Domain.NETWORK, Duration.ofSeconds(15));
        Mockito.when(orchestrator.investigate(ArgumentMatchers.any()))
                .thenReturn(
                        InvestigationResponse.of(
                                "req-7",
                                List.of(network, platform),
                                new SynthesisResult(
                                        Verdict.ACTIONABLE,
                                        0.9,
                                        "platform (0.90): FAIL: OOMKilled",
                                        "Raise the memory limit",
                                        SynthesisStrategy.RULE_BASED),
                                1530));

        mockMvc.perform(
                        post("/v1/investigate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(CRASH_LOOP))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request_id").value("req-7"))
                .andExpect(jsonPath("$.verdict").value("ACTIONABLE"))
                .andExpect(jsonPath("$.strategy").value("rule-based"))
                .andExpect(jsonPath("$.fallback_used").value(true))
                .andExpect(jsonPath("$.suggested_action").value("Raise the memory limit"))
                .andExpect(jsonPath("$.latency_ms").value(1530))
                .andExpect(jsonPath("$.findings[0].domain").value("network"))
                .andExpect(jsonPath("$.findings[0].status").value("TIMEOUT"))
                .andExpect(jsonPath("$.findings[0].confidence").value(0.0))
                .andExpect(jsonPath("$.findings[1].tools_used[0]").value("kubectl_get_pods"));

        ArgumentCaptor<InvestigationRequest> captor =
                ArgumentCaptor.forClass(InvestigationRequest.class);
        Mockito.verify(orchestrator).investigate(captor.capture());
        Assertions.assertEquals(
                "checkout-7d9", captor.getValue().alert().label("pod"));
    }

    @Test
    void missingAlertNameIsRejectedWithoutInvestigating() throws Exception {
        mockMvc.perform(
                        post("/v1/investigate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"request_id\":\"req-8\",\"alert\":{\"labels\":{}}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"))
                .andExpect(jsonPath("$.message").value("alert.name must not be blank"));

        Mockito.verifyNoInteractions(orchestrator);
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mockMvc.perform(
                        post("/v1/investigate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"request_id\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));

        Mockito.verifyNoInteractions(orchestrator);
    }

    @Test
    void invalidRequestFromOrchestratorIsClientError() throws Exception {
        Mockito.when(orchestrator.investigate(ArgumentMatchers.any()))
                .thenThrow(new InvalidRequestException("alert.name must not be blank"));

        mockMvc.perform(
                        post("/v1/investigate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(CRASH_LOOP))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        Mockito.when(orchestrator.investigate(ArgumentMatchers.any()))
                .thenThrow(new IllegalStateException("executor rejected task"));

        mockMvc.perform(
                        post("/v1/investigate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(CRASH_LOOP))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("internal_error"));
    }

    @Test
    void internalIllegalArgumentIsNotBlamedOnCaller() throws Exception {
        Mockito.when(orchestrator.investigate(ArgumentMatchers.any()))
                .thenThrow(new IllegalArgumentException("Unknown specialist domain: mainframe"));

        mockMvc.perform(
                        post("/v1/investigate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(CRASH_LOOP))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("internal_error"))
                .andExpect(jsonPath("$.message").value("Investigation failed"));
    }

    @Test
    void healthReportsService() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("alert-investigator"));
    }

    @Test
    void agentsListsDomainsAndWeights() throws Exception {
        Mockito.when(registry.domains()).thenReturn(List.of(Domain.values()));
        Mockito.when(weightTable.describe())
                .thenReturn(Map.of("workload", Map.of(Domain.PLATFORM, 1.0, Domain.SECURITY, 0.4)));

        mockMvc.perform(get("/v1/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agents.length()").value(5))
                .andExpect(jsonPath("$.agents[0]").value("data"))
                .andExpect(jsonPath("$.weights.workload.platform").value(1.0))
                .andExpect(jsonPath("$.weights.workload.security").value(0.4));
    }

    @Test
    void simulationSwitchesLogScenario() throws Exception {
        Mockito.when(logIndex.currentScenario()).thenReturn("pod-crashloop");

        mockMvc.perform(post("/api/v1/simulation/logs").param("scenario", "pod-crashloop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scenario").value("pod-crashloop"));

        Mockito.verify(logIndex).loadScenario("pod-crashloop");
    }

    @Test
    void unknownSimulationScenarioIsClientError() throws Exception {
        Mockito.doThrow(new IllegalArgumentException("Unknown log scenario 'meteor'"))
                .when(logIndex)
                .loadScenario("meteor");

        mockMvc.perform(post("/api/v1/simulation/logs").param("scenario", "meteor"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown log scenario 'meteor'"));
    }
}
