package com.axiom.gateway.infrastructure.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.axiom.gateway.domain.admission.Dependencies;
import com.axiom.gateway.domain.error.UpstreamUnavailableException;
import com.axiom.gateway.domain.ivcu.GeneratedCode;
import com.axiom.gateway.domain.ivcu.GenerationRequest;
import com.axiom.gateway.domain.ivcu.VerificationReport;
import com.axiom.observability.SpanHelper;
import io.opentelemetry.api.OpenTelemetry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@DisplayName("REST collaborator clients")
class RestClientsTest {

    private static final String BASE_URL = "http://collaborator.test";

    private final SpanHelper spans = new SpanHelper(OpenTelemetry.noop().getTracer("test"));

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Nested
    @DisplayName("generation")
    class Generation {

        private final UUID ivcuId = UUID.randomUUID();
        private final UUID projectId = UUID.randomUUID();

        private GenerationRequest request() {
            return new GenerationRequest(ivcuId, projectId, "sort a list", List.of("no recursion"), "python");
        }

        @Test
        @DisplayName("should post the request in snake_case and map the response")
        void generates() {
            server.expect(requestTo(BASE_URL + "/generate"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.ivcu_id").value(ivcuId.toString()))
                    .andExpect(jsonPath("$.project_id").value(projectId.toString()))
                    .andExpect(jsonPath("$.constraints[0]").value("no recursion"))
                    .andRespond(withSuccess("""
                            {"code": "def f(): pass", "confidence": 0.9, "model_id": "m-1", "cost": 0.07}
                            """, MediaType.APPLICATION_JSON));

            GeneratedCode code = new RestCodeGenerationClient(restClient, spans).generate(request());

            assertThat(code.code()).isEqualTo("def f(): pass");
            assertThat(code.modelId()).isEqualTo("m-1");
            assertThat(code.cost()).isEqualByComparingTo("0.07");
            server.verify();
        }

        @Test
        @DisplayName("should default a missing cost to zero")
        void missingCost() {
            server.expect(requestTo(BASE_URL + "/generate"))
                    .andRespond(withSuccess("{\"code\": \"x = 1\"}", MediaType.APPLICATION_JSON));

            assertThat(new RestCodeGenerationClient(restClient, spans).generate(request()).cost())
                    .isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("should report a server error as the generation dependency being unavailable")
        void serverError() {
            server.expect(requestTo(BASE_URL + "/generate")).andRespond(withServerError());

            assertThatThrownBy(() -> new RestCodeGenerationClient(restClient, spans).generate(request()))
                    .isInstanceOfSatisfying(UpstreamUnavailableException.class,
                            e -> assertThat(e.dependency()).isEqualTo(Dependencies.GENERATION));
        }

        @Test
        @DisplayName("should reject a response without code")
        void blankCode() {
            server.expect(requestTo(BASE_URL + "/generate"))
                    .andRespond(withSuccess("{\"code\": \"  \"}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> new RestCodeGenerationClient(restClient, spans).generate(request()))
                    .isInstanceOf(UpstreamUnavailableException.class)
                    .hasMessageContaining("no code");
        }
    }

    @Nested
    @DisplayName("verification")
    class Verification {

        @Test
        @DisplayName("should map each verifier result and the run cost")
        void verifies() {
            server.expect(requestTo(BASE_URL + "/verify"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.language").value("python"))
                    .andRespond(withSuccess("""
                            {"passed": true, "cost": 0.01, "verifier_results": [
                              {"name": "syntax", "tier": 0, "passed": true, "confidence": 1.0},
                              {"name": "types", "tier": 1, "passed": false, "confidence": 0.4,
                               "messages": ["int is not str"]}
                            ]}
                            """, MediaType.APPLICATION_JSON));

            VerificationReport report = new RestVerificationClient(restClient, spans).verify("x = 1", "python");

            assertThat(report.results()).hasSize(2);
            assertThat(report.results().get(1).passed()).isFalse();
            assertThat(report.results().get(1).messages()).containsExactly("int is not str");
            assertThat(report.cost()).isEqualByComparingTo("0.01");
            server.verify();
        }

        @Test
        @DisplayName("should treat out-of-range verifier values as a malformed response")
        void malformedResults() {
            server.expect(requestTo(BASE_URL + "/verify"))
                    .andRespond(withSuccess("""
                            {"verifier_results": [{"name": "types", "tier": 7, "passed": true, "confidence": 0.9}]}
                            """, MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> new RestVerificationClient(restClient, spans).verify("x = 1", "python"))
                    .isInstanceOf(UpstreamUnavailableException.class)
                    .hasMessageContaining("malformed");
        }

        @Test
        @DisplayName("should reject a response without verifier results")
        void missingResults() {
            server.expect(requestTo(BASE_URL + "/verify"))
                    .andRespond(withSuccess("{\"passed\": true}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> new RestVerificationClient(restClient, spans).verify("x = 1", "python"))
                    .isInstanceOfSatisfying(UpstreamUnavailableException.class,
                            e -> assertThat(e.dependency()).isEqualTo(Dependencies.VERIFICATION));
        }
    }
}
