package com.example.vrpassistant.controller;

import com.example.vrpassistant.context.ContextStore;
import com.example.vrpassistant.context.InMemoryContextStore;
import com.example.vrpassistant.model.SessionContext;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import com.example.vrpassistant.solver.SolverClient;
import com.example.vrpassistant.solver.SolverException;
import com.example.vrpassistant.testutil.VrpFixtures;
import com.example.vrpassistant.validation.ComplexityLimits;
import com.example.vrpassistant.validation.ComplexityValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VrpControllerTest {

    @Mock
    private SolverClient solverClient;

    private ContextStore contextStore;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        contextStore = new InMemoryContextStore(Clock.systemUTC());
        VrpController controller = new VrpController(new ComplexityValidator(), ComplexityLimits.DEFAULT,
                solverClient, contextStore);
        client = WebTestClient.bindToController(controller, new HealthController(contextStore)).build();
    }

    @Test
    void testSolve_MissingSessionHeader() {
        client.post().uri("/vrp/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VrpFixtures.problem(1, 1))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.type").isEqualTo("validation");

        verifyNoInteractions(solverClient);
    }

    @Test
    void testSolve_RejectsEmptyProblem() {
        client.post().uri("/vrp/solve")
                .header("X-Session-Id", "s1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"jobs\":[],\"resources\":[{\"name\":\"van-1\"}]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.type").isEqualTo("complexity_limit")
                .jsonPath("$.error").isEqualTo("VRP problem too complex:\n\n1. At least 1 job is required")
                .jsonPath("$.details.errors[0]").isEqualTo("At least 1 job is required")
                .jsonPath("$.details.actualComplexity.jobCount").isEqualTo(0)
                .jsonPath("$.details.actualComplexity.resourceCount").isEqualTo(1);

        verifyNoInteractions(solverClient);
        assertTrue(contextStore.get("s1").isEmpty());
    }

    @Test
    void testSolve_StoresSolvedContext() {
        // Given
        VrpSolution solution = VrpFixtures.solution(VrpFixtures.trip("van-0", 1000L, 600L, "job-0"));
        when(solverClient.solve(any())).thenReturn(Mono.just(solution));

        // When
        client.post().uri("/vrp/solve")
                .header("X-Session-Id", "s1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VrpFixtures.problem(2, 1))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("sol-1")
                .jsonPath("$.trips[0].resource").isEqualTo("van-0");

        // Then
        SessionContext context = contextStore.get("s1").orElseThrow();
        assertEquals(solution, context.getSolution());
        assertEquals(2, context.getProblem().getJobs().size());
    }

    @Test
    void testSolve_SolverFailureMapsStatus() {
        // Given
        when(solverClient.solve(any())).thenReturn(Mono.error(new SolverException("Invalid API key", "authentication", 401)));

        // When / Then
        client.post().uri("/vrp/solve")
                .header("X-Session-Id", "s1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VrpFixtures.problem(2, 1))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid API key")
                .jsonPath("$.type").isEqualTo("authentication");

        assertTrue(contextStore.get("s1").isEmpty());
    }

    @Test
    void testValidate_ReportsWarnings() {
        client.post().uri("/vrp/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VrpFixtures.problem(200, 1))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.valid").isEqualTo(true)
                .jsonPath("$.warnings[0]").isEqualTo("Approaching job limit (200/250)");
    }

    @Test
    void testContextLifecycle() {
        // store
        client.post().uri("/vrp/context")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(ContextRequest.builder().sessionId("s1").request(VrpFixtures.problem(1, 1)).build())
                .exchange()
                .expectStatus().isOk();

        client.get().uri("/vrp/context")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(1)
                .jsonPath("$.sessions[0]").isEqualTo("s1");

        client.put().uri("/vrp/context/s1/solution")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VrpFixtures.solution(VrpFixtures.trip("van-0", 10L, 10L, "job-0")))
                .exchange()
                .expectStatus().isOk();
        assertTrue(contextStore.get("s1").orElseThrow().hasSolution());

        client.get().uri("/vrp/context/s1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sessionId").isEqualTo("s1")
                .jsonPath("$.solution.id").isEqualTo("sol-1");

        client.delete().uri("/vrp/context/s1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(true);

        client.get().uri("/vrp/context/s1")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.type").isEqualTo("not_found");
    }

    @Test
    void testStoreContext_RequiresProblem() {
        client.post().uri("/vrp/context")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(ContextRequest.builder().sessionId("s1").build())
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("request is required");
    }

    @Test
    void testUpdateSolution_UnknownSession() {
        client.put().uri("/vrp/context/missing/solution")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VrpSolution.builder().id("x").build())
                .exchange()
                .expectStatus().isNotFound();

        assertTrue(contextStore.get("missing").isEmpty());
    }

    @Test
    void testHealth_ReportsSessionCount() {
        // Given
        contextStore.save("s1", VrpProblem.builder().job(VrpFixtures.job("j", 1)).build(), null);

        // When / Then
        client.get().uri("/vrp/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.activeSessions").isEqualTo(1)
                .jsonPath("$.contextStore").isEqualTo("UP");
    }
}
