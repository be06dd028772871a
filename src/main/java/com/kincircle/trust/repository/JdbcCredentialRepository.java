package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.AlgorithmVersion;
import com.kincircle.trust.service.model.Credential;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trust.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcCredentialRepository implements CredentialRepository {

    private final JdbcTemplate jdbc;
    private final Clock clock;

    @Override
    public Optional<Credential> find(String principalId) {
        String sql = """
            SELECT salt_hex, hash_hex, algorithm_version
            FROM trust_credential
            WHERE principal_id = ?
        """;
        return jdbc.query(sql, rm(), principalId).stream().findFirst();
    }

    @Override
    @Transactional
    public void save(String principalId, Credential credential) {
        long now = clock.millis();
        int updated = jdbc.update("""
            UPDATE trust_credential
            SET salt_hex = ?, hash_hex = ?, algorithm_version = ?, updated_at_ms = ?
            WHERE principal_id = ?
        """, credential.saltHex(), credential.hashHex(), credential.algorithmVersion().code(), now, principalId);
        if (updated == 0) {
            jdbc.update("""
                INSERT INTO trust_credential (principal_id, salt_hex, hash_hex, algorithm_version, updated_at_ms)
                VALUES (?, ?, ?, ?, ?)
            """, principalId, credential.saltHex(), credential.hashHex(), credential.algorithmVersion().code(), now);
        }
    }

    @Override
    public boolean delete(String principalId) {
        return jdbc.update("DELETE FROM trust_credential WHERE principal_id = ?", principalId) > 0;
    }

    private RowMapper<Credential> rm() {
        return (rs, i) -> new Credential(
                rs.getString("salt_hex"),
                rs.getString("hash_hex"),
                AlgorithmVersion.fromCode(rs.getInt("algorithm_version"))
        );
    }
}
