package com.axiom.gateway.config;

import com.axiom.gateway.domain.ivcu.CodeGenerationClient;
import com.axiom.gateway.domain.ivcu.VerificationClient;
import com.axiom.gateway.infrastructure.client.RestCodeGenerationClient;
import com.axiom.gateway.infrastructure.client.RestVerificationClient;
import com.axiom.observability.SpanHelper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP clients for the generation and verification collaborators. Each gets its own
 * {@link RestClient} so timeouts can differ.
 */
@Configuration
public class ClientConfig {

    @Bean
    public CodeGenerationClient codeGenerationClient(RestClient.Builder builder, ClientProperties clients,
                                                     SpanHelper spans) {
        return new RestCodeGenerationClient(restClient(builder, clients.generation()), spans);
    }

    @Bean
    public VerificationClient verificationClient(RestClient.Builder builder, ClientProperties clients,
                                                 SpanHelper spans) {
        return new RestVerificationClient(restClient(builder, clients.verification()), spans);
    }

    static RestClient restClient(RestClient.Builder builder, ClientProperties.Endpoint endpoint) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) endpoint.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) endpoint.readTimeout().toMillis());
        // The builder bean is prototype-scoped, but clone anyway so both clients stay independent.
        return builder.clone()
                .baseUrl(endpoint.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
