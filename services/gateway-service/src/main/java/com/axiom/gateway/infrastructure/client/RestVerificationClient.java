package com.axiom.gateway.infrastructure.client;

import com.axiom.gateway.domain.admission.Dependencies;
import com.axiom.gateway.domain.error.UpstreamUnavailableException;
import com.axiom.gateway.domain.ivcu.VerificationClient;
import com.axiom.gateway.domain.ivcu.VerificationReport;
import com.axiom.gateway.domain.ivcu.VerifierResult;
import com.axiom.observability.SpanHelper;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP adapter for the verification service: {@code POST /verify}.
 */
public class RestVerificationClient implements VerificationClient {

    private static final Logger log = LoggerFactory.getLogger(RestVerificationClient.class);

    private final RestClient restClient;
    private final SpanHelper spans;

    public RestVerificationClient(RestClient restClient, SpanHelper spans) {
        this.restClient = restClient;
        this.spans = spans;
    }

    @Override
    public VerificationReport verify(String code, String language) {
        return spans.outbound(Dependencies.VERIFICATION, "verify", () -> call(code, language));
    }

    private VerificationReport call(String code, String language) {
        VerifyResponse response;
        try {
            response = restClient.post()
                    .uri("/verify")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new VerifyBody(code, language))
                    .retrieve()
                    .body(VerifyResponse.class);
        } catch (RestClientException e) {
            log.error("Verification call failed", e);
            throw new UpstreamUnavailableException(Dependencies.VERIFICATION, "verification service unavailable", e);
        }
        if (response == null || response.verifierResults() == null) {
            throw new UpstreamUnavailableException(Dependencies.VERIFICATION,
                    "verification service returned no results", null);
        }
        try {
            List<VerifierResult> results = response.verifierResults().stream()
                    .map(r -> new VerifierResult(r.name(), r.tier() != null ? r.tier() : 0,
                            Boolean.TRUE.equals(r.passed()), r.confidence() != null ? r.confidence() : 0.0,
                            r.messages()))
                    .toList();
            return new VerificationReport(results, response.cost());
        } catch (IllegalArgumentException e) {
            throw new UpstreamUnavailableException(Dependencies.VERIFICATION,
                    "verification service returned malformed results", e);
        }
    }

    record VerifyBody(@JsonProperty("code") String code, @JsonProperty("language") String language) {
    }

    record VerifyResponse(
            @JsonProperty("passed") Boolean passed,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("verifier_results") List<VerifierPayload> verifierResults,
            @JsonProperty("cost") BigDecimal cost) {
    }

    record VerifierPayload(
            @JsonProperty("name") String name,
            @JsonProperty("tier") Integer tier,
            @JsonProperty("passed") Boolean passed,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("messages") List<String> messages) {
    }
}
