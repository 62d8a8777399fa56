package com.axiom.gateway.infrastructure.persistence;

import com.axiom.gateway.domain.certificate.CertificateRepository;
import com.axiom.gateway.domain.certificate.CertificateService;
import com.axiom.gateway.domain.certificate.FormalAssertion;
import com.axiom.gateway.domain.certificate.ProofCertificate;
import com.axiom.gateway.domain.certificate.ProofType;
import com.axiom.gateway.domain.certificate.VerifierSignature;
import com.axiom.gateway.domain.error.DuplicateCertificateException;
import com.axiom.gateway.domain.error.PersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Insert-only certificate storage on {@code proof_certificates}. The table's
 * {@code (ivcu_id, proof_type)} unique constraint rejects second certificates; existing rows
 * are never updated. The certificate timestamp is stored as its canonical ISO-8601 text so
 * the hash chain can be recomputed from the row exactly.
 */
@Repository
public class JdbcCertificateRepository implements CertificateRepository {

    private static final String COLUMNS = """
            id, ivcu_id, proof_type, verifier_version, issued_at, intent_id, ast_hash, code_hash,
            verifier_signatures, assertions, proof_data, hash_chain, signature, created_at
            """;

    private static final TypeReference<List<VerifierSignature>> SIGNATURES = new TypeReference<>() {
    };
    private static final TypeReference<List<FormalAssertion>> ASSERTIONS = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcCertificateRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insert(ProofCertificate certificate) {
        String sql = "INSERT INTO proof_certificates (" + COLUMNS + """
                ) VALUES (:id, :ivcuId, :proofType, :verifierVersion, :issuedAt, :intentId, :astHash, :codeHash,
                          :verifierSignatures, :assertions, :proofData, :hashChain, :signature, :createdAt)
                """;
        var params = new MapSqlParameterSource()
                .addValue("id", certificate.id())
                .addValue("ivcuId", certificate.ivcuId())
                .addValue("proofType", certificate.proofType().value())
                .addValue("verifierVersion", certificate.verifierVersion())
                .addValue("issuedAt", CertificateService.formatTimestamp(certificate.timestamp()))
                .addValue("intentId", certificate.intentId())
                .addValue("astHash", certificate.astHash())
                .addValue("codeHash", certificate.codeHash())
                .addValue("verifierSignatures", toJson(certificate.verifierSignatures()))
                .addValue("assertions", toJson(certificate.assertions()))
                .addValue("proofData", certificate.proofData())
                .addValue("hashChain", certificate.hashChain())
                .addValue("signature", certificate.signature())
                .addValue("createdAt", Timestamp.from(certificate.createdAt()));
        try {
            JdbcErrors.run("insert certificate", () -> jdbcTemplate.update(sql, params));
        } catch (PersistenceException e) {
            if (e.getCause() instanceof DuplicateKeyException) {
                throw new DuplicateCertificateException(certificate.ivcuId().toString(),
                        certificate.proofType().value(), e.getCause());
            }
            throw e;
        }
    }

    @Override
    public Optional<ProofCertificate> findById(UUID id) {
        String sql = "SELECT " + COLUMNS + " FROM proof_certificates WHERE id = :id";
        return JdbcErrors.translate("read certificate", () -> jdbcTemplate.query(sql,
                new MapSqlParameterSource().addValue("id", id),
                (rs, rowNum) -> mapCertificate(rs)).stream().findFirst());
    }

    @Override
    public List<ProofCertificate> findByIvcuId(UUID ivcuId) {
        String sql = "SELECT " + COLUMNS + " FROM proof_certificates WHERE ivcu_id = :ivcuId ORDER BY created_at";
        return JdbcErrors.translate("read certificates", () -> jdbcTemplate.query(sql,
                new MapSqlParameterSource().addValue("ivcuId", ivcuId),
                (rs, rowNum) -> mapCertificate(rs)));
    }

    private ProofCertificate mapCertificate(ResultSet rs) throws SQLException {
        String proofType = rs.getString("proof_type");
        return new ProofCertificate(
                rs.getObject("id", UUID.class),
                rs.getObject("ivcu_id", UUID.class),
                ProofType.fromValue(proofType)
                        .orElseThrow(() -> new PersistenceException("unknown proof type '" + proofType + "'", null)),
                rs.getString("verifier_version"),
                Instant.parse(rs.getString("issued_at")),
                rs.getObject("intent_id", UUID.class),
                rs.getString("ast_hash"),
                rs.getString("code_hash"),
                fromJson(rs.getString("verifier_signatures"), SIGNATURES),
                fromJson(rs.getString("assertions"), ASSERTIONS),
                rs.getBytes("proof_data"),
                rs.getString("hash_chain"),
                rs.getString("signature"),
                rs.getTimestamp("created_at").toInstant());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("failed to serialize certificate field", e);
        }
    }

    private <T> List<T> fromJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("failed to read certificate field", e);
        }
    }
}
