package com.example.fleet.infra.db;

import com.example.fleet.core.store.RevokedCredential;
import com.example.fleet.core.store.SlaveRecord;
import com.example.fleet.core.store.SlaveStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public class JdbcSlaveStore implements SlaveStore {
    private static final String SLAVE_COLUMNS =
            "host_id,cert_serial,platform,version,issued_at,expires_at,last_seen,enabled";

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcSlaveStore(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    private static final RowMapper<SlaveRecord> SLAVE_MAPPER = (rs, rowNum) -> new SlaveRecord(
            rs.getString("host_id"),
            rs.getString("cert_serial"),
            rs.getString("platform"),
            rs.getString("version"),
            instant(rs, "issued_at"),
            instant(rs, "expires_at"),
            instant(rs, "last_seen"),
            rs.getBoolean("enabled")
    );

    private static final RowMapper<RevokedCredential> REVOKED_MAPPER = (rs, rowNum) -> new RevokedCredential(
            rs.getString("id"),
            rs.getString("host_id"),
            rs.getString("cert_serial"),
            instant(rs, "revoked_at"),
            rs.getString("reason")
    );

    @Override
    public SlaveRecord createSlave(String hostId, String certSerial, String platform, Instant issuedAt, Instant expiresAt) {
        Timestamp now = now();
        jdbc.update("INSERT INTO slave_servers (id,host_id,cert_serial,platform,issued_at,expires_at,enabled,created_at,updated_at) "
                        + "VALUES (?,?,?,?,?,?,TRUE,?,?)",
                UUID.randomUUID().toString(), hostId, certSerial, platform,
                Timestamp.from(issuedAt), Timestamp.from(expiresAt), now, now);
        return findSlave(hostId).orElseThrow();
    }

    @Override
    public Optional<SlaveRecord> findSlave(String hostId) {
        List<SlaveRecord> list = jdbc.query("SELECT " + SLAVE_COLUMNS + " FROM slave_servers WHERE host_id=?",
                SLAVE_MAPPER, hostId);
        return list.stream().findFirst();
    }

    @Override
    public List<SlaveRecord> listSlaves() {
        return jdbc.query("SELECT " + SLAVE_COLUMNS + " FROM slave_servers ORDER BY host_id", SLAVE_MAPPER);
    }

    @Override
    public void updateLastSeen(String hostId) {
        Timestamp now = now();
        jdbc.update("UPDATE slave_servers SET last_seen=?, updated_at=? WHERE host_id=?", now, now, hostId);
    }

    @Override
    public void updateSlaveEnabled(String hostId, boolean enabled) {
        jdbc.update("UPDATE slave_servers SET enabled=?, updated_at=? WHERE host_id=?", enabled, now(), hostId);
    }

    @Override
    public void updateSlaveVersion(String hostId, String version) {
        jdbc.update("UPDATE slave_servers SET version=?, updated_at=? WHERE host_id=?", version, now(), hostId);
    }

    @Override
    public void revokeCredential(String hostId, String certSerial, String reason) {
        jdbc.update("INSERT INTO revoked_slave_credentials (id,host_id,cert_serial,revoked_at,reason) VALUES (?,?,?,?,?)",
                UUID.randomUUID().toString(), hostId, certSerial, now(), reason);
    }

    @Override
    public boolean isCredentialRevoked(String certSerial) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM revoked_slave_credentials WHERE cert_serial=?",
                Integer.class, certSerial);
        return count != null && count > 0;
    }

    @Override
    public List<RevokedCredential> listRevokedCredentials() {
        return jdbc.query("SELECT id,host_id,cert_serial,revoked_at,reason FROM revoked_slave_credentials "
                + "ORDER BY revoked_at DESC", REVOKED_MAPPER);
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
