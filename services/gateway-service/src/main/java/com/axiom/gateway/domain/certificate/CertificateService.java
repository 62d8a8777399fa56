package com.axiom.gateway.domain.certificate;

import com.axiom.gateway.domain.ivcu.VerifierResult;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes and checks the cryptographic fields of proof certificates.
 *
 * <p>{@code hashChain = sha256(codeHash|astHash|intentId|timestamp)} with the timestamp in
 * ISO-8601 UTC at second precision, and {@code signature = hmacSha256(hashChain)} under the
 * service secret. Verifier results are signed as {@code name|passed|confidence}. All digests
 * are lowercase hex. Comparisons run in constant time.
 */
public class CertificateService {

    private static final Logger log = LoggerFactory.getLogger(CertificateService.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SEPARATOR = "|";
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec signingKey;
    private final String verifierVersion;
    private final Clock clock;

    public CertificateService(String signingSecret, String verifierVersion, Clock clock) {
        if (signingSecret == null || signingSecret.isBlank()) {
            throw new IllegalArgumentException("certificate signing secret must not be blank");
        }
        this.signingKey = new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.verifierVersion = verifierVersion;
        this.clock = clock;
    }

    public ProofCertificate generateCertificate(UUID ivcuId, UUID intentId, String code, ProofType proofType,
                                                List<VerifierResult> verifierResults) {
        return generateCertificate(ivcuId, intentId, code, proofType, verifierResults, List.of(), new byte[0]);
    }

    /**
     * Builds a signed certificate for verified code. The certificate is not stored.
     */
    public ProofCertificate generateCertificate(UUID ivcuId, UUID intentId, String code, ProofType proofType,
                                                List<VerifierResult> verifierResults,
                                                List<FormalAssertion> assertions, byte[] proofData) {
        if (code == null) {
            throw new IllegalArgumentException("code must not be null");
        }
        Instant now = clock.instant();
        Instant timestamp = now.truncatedTo(ChronoUnit.SECONDS);

        String codeHash = sha256Hex(code);
        String astHash = sha256Hex(StructuralCanonicalizer.canonicalize(code));
        List<VerifierSignature> signatures = verifierResults.stream()
                .map(result -> new VerifierSignature(result.name(), signVerifierResult(result), now))
                .toList();
        String hashChain = computeHashChain(codeHash, astHash, intentId, timestamp);
        String signature = hmacSha256Hex(hashChain);

        return new ProofCertificate(UUID.randomUUID(), ivcuId, proofType, verifierVersion, timestamp,
                intentId, astHash, codeHash, signatures, assertions, proofData, hashChain, signature, now);
    }

    /**
     * Recomputes the hash chain from the stored fields, then the signature over the stored chain.
     *
     * @throws IntegrityViolationException on the first mismatch
     */
    public void verifyIntegrity(ProofCertificate certificate) {
        String expectedChain = computeHashChain(certificate.codeHash(), certificate.astHash(),
                certificate.intentId(), certificate.timestamp());
        if (!constantTimeEquals(expectedChain, certificate.hashChain())) {
            log.error("Hash chain mismatch for certificate {}", certificate.id());
            throw new IntegrityViolationException(certificate.id(),
                    IntegrityViolationException.Reason.HASH_CHAIN_MISMATCH);
        }
        if (!constantTimeEquals(hmacSha256Hex(certificate.hashChain()), certificate.signature())) {
            log.error("Signature mismatch for certificate {}", certificate.id());
            throw new IntegrityViolationException(certificate.id(),
                    IntegrityViolationException.Reason.SIGNATURE_MISMATCH);
        }
    }

    public String computeHashChain(String codeHash, String astHash, UUID intentId, Instant timestamp) {
        return sha256Hex(String.join(SEPARATOR, codeHash, astHash, String.valueOf(intentId),
                formatTimestamp(timestamp)));
    }

    /** ISO-8601 UTC at second precision, e.g. {@code 2024-05-01T12:00:00Z}. */
    public static String formatTimestamp(Instant timestamp) {
        return DateTimeFormatter.ISO_INSTANT.format(timestamp.truncatedTo(ChronoUnit.SECONDS));
    }

    public String signVerifierResult(VerifierResult result) {
        return hmacSha256Hex(String.join(SEPARATOR, result.name(), String.valueOf(result.passed()),
                String.format(Locale.ROOT, "%.6f", result.confidence())));
    }

    public static String sha256Hex(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String hmacSha256Hex(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return HEX.formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    public String verifierVersion() {
        return verifierVersion;
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
