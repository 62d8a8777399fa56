package com.axiom.gateway.api;

import com.axiom.gateway.api.dto.TokenRequest;
import com.axiom.gateway.api.dto.TokenResponse;
import com.axiom.security.TokenAuthenticator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues bearer tokens without checking credentials. Only registered when
 * {@code axiom.security.dev-token-endpoint=true}; for local development and tests.
 */
@RestController
@RequestMapping("/api/v1/auth")
@ConditionalOnProperty(prefix = "axiom.security", name = "dev-token-endpoint", havingValue = "true")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final TokenAuthenticator authenticator;

    public AuthController(TokenAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @PostMapping("/token")
    public TokenResponse issueToken(@Valid @RequestBody TokenRequest request) {
        log.warn("Issuing development token for user {}", request.userId());
        String token = authenticator.issueToken(request.userId(), request.email(), request.platformRole());
        return TokenResponse.bearer(token, authenticator.tokenLifetime().toSeconds());
    }
}
