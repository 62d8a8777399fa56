package com.axiom.gateway.infrastructure.client;

import com.axiom.gateway.domain.admission.Dependencies;
import com.axiom.gateway.domain.error.UpstreamUnavailableException;
import com.axiom.gateway.domain.ivcu.CodeGenerationClient;
import com.axiom.gateway.domain.ivcu.GeneratedCode;
import com.axiom.gateway.domain.ivcu.GenerationRequest;
import com.axiom.observability.SpanHelper;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP adapter for the AI generation service: {@code POST /generate}.
 */
public class RestCodeGenerationClient implements CodeGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(RestCodeGenerationClient.class);

    private final RestClient restClient;
    private final SpanHelper spans;

    public RestCodeGenerationClient(RestClient restClient, SpanHelper spans) {
        this.restClient = restClient;
        this.spans = spans;
    }

    @Override
    public GeneratedCode generate(GenerationRequest request) {
        return spans.outbound(Dependencies.GENERATION, "generate", () -> call(request));
    }

    private GeneratedCode call(GenerationRequest request) {
        GenerateResponse response;
        try {
            response = restClient.post()
                    .uri("/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new GenerateBody(request.ivcuId(), request.projectId(), request.intent(),
                            request.language(), request.constraints()))
                    .retrieve()
                    .body(GenerateResponse.class);
        } catch (RestClientException e) {
            log.error("Generation call failed for ivcu {}", request.ivcuId(), e);
            throw new UpstreamUnavailableException(Dependencies.GENERATION, "AI service unavailable", e);
        }
        if (response == null || response.code() == null || response.code().isBlank()) {
            throw new UpstreamUnavailableException(Dependencies.GENERATION, "AI service returned no code", null);
        }
        return new GeneratedCode(response.code(), response.cost() != null ? response.cost() : BigDecimal.ZERO,
                response.modelId());
    }

    record GenerateBody(
            @JsonProperty("ivcu_id") UUID ivcuId,
            @JsonProperty("project_id") UUID projectId,
            @JsonProperty("intent") String intent,
            @JsonProperty("language") String language,
            @JsonProperty("constraints") List<String> constraints) {
    }

    record GenerateResponse(
            @JsonProperty("code") String code,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("model_id") String modelId,
            @JsonProperty("cost") BigDecimal cost) {
    }
}
