package com.example.vrpassistant.solver;

import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link SolverClient} for the Solvice synchronous solve endpoint.
 */
@Component
public class SolviceSolverClient implements SolverClient {

    private static final Logger logger = LoggerFactory.getLogger(SolviceSolverClient.class);

    static final String SOLVE_PATH = "/v2/vrp/solve/sync";

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;

    public SolviceSolverClient(WebClient.Builder webClientBuilder,
                               @Value("${app.solver.base-url:https://api.solvice.io}") String baseUrl,
                               @Value("${app.solver.api-key:}") String apiKey,
                               @Value("${app.solver.timeout-ms:120000}") long timeoutMs) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.apiKey = apiKey;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Mono<VrpSolution> solve(VrpProblem problem) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new SolverException("Solvice API key not configured", "authentication", 500));
        }

        logger.info("Solving VRP problem with {} jobs and {} resources",
                problem.getJobs().size(), problem.getResources().size());

        return webClient.post()
                .uri(SOLVE_PATH)
                .header(HttpHeaders.AUTHORIZATION, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(problem)
                .retrieve()
                .bodyToMono(VrpSolution.class)
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof SolverException), SolviceSolverClient::mapError);
    }

    static SolverException mapError(Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            int status = response.getStatusCode().value();
            if (status == 401 || status == 403) {
                return new SolverException("Invalid API key", "authentication", 401, error);
            }
            if (status == 400 || status == 422) {
                return new SolverException("Invalid request data", "validation", 400, error);
            }
            if (status == 408 || status == 504) {
                return new SolverException("Request timeout", "timeout", 408, error);
            }
        }
        if (error instanceof TimeoutException) {
            return new SolverException("Request timeout", "timeout", 408, error);
        }
        if (error instanceof WebClientRequestException) {
            return new SolverException("Network error", "network", 503, error);
        }

        logger.error("VRP solver error: {}", error.getMessage(), error);
        return new SolverException("Internal server error", "server", 500, error);
    }
}
