package com.fleetsync.core.db;

import com.fleetsync.core.provider.ProviderStateStore;
import com.fleetsync.core.provider.TokenLease;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

import static com.fleetsync.core.db.Pg.instant;
import static com.fleetsync.core.db.Pg.ts;

/**
 * Токен и backoff в строке provider_state (id = 1): общие для всех процессов
 * на одном аккаунте провайдера.
 */
public final class PgProviderStateStore implements ProviderStateStore {

    @Override
    public Optional<TokenLease> loadToken() {
        final String sql = "SELECT token, server_id, token_expires_at FROM provider_state WHERE id = 1";
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()
        ) {
            if (!rs.next()) return Optional.empty();
            String token = rs.getString(1);
            Instant expiresAt = instant(rs.getTimestamp(3));
            if (token == null || expiresAt == null) return Optional.empty();
            return Optional.of(new TokenLease(token, rs.getString(2), expiresAt));
        } catch (SQLException e) {
            throw new RuntimeException("loadToken failed sqlstate=" + e.getSQLState(), e);
        }
    }

    @Override
    public void saveToken(TokenLease lease) {
        update("UPDATE provider_state SET token = ?, server_id = ?, token_expires_at = ?, updated_at = now() WHERE id = 1",
                lease.token(), lease.serverId(), ts(lease.expiresAt()));
    }

    @Override
    public void clearToken() {
        update("UPDATE provider_state SET token = NULL, token_expires_at = NULL, updated_at = now() WHERE id = 1");
    }

    @Override
    public long backoffUntil() {
        final String sql = "SELECT backoff_until FROM provider_state WHERE id = 1";
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()
        ) {
            if (!rs.next()) return 0L;
            Timestamp t = rs.getTimestamp(1);
            return t == null ? 0L : t.getTime();
        } catch (SQLException e) {
            throw new RuntimeException("backoffUntil failed sqlstate=" + e.getSQLState(), e);
        }
    }

    @Override
    public void extendBackoff(long untilMs) {
        update("""
                UPDATE provider_state
                SET backoff_until = greatest(coalesce(backoff_until, to_timestamp(0)), ?),
                    updated_at = now()
                WHERE id = 1
                """, new Timestamp(untilMs));
    }

    private static void update(String sql, Object... args) {
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("provider_state update failed sqlstate=" + e.getSQLState(), e);
        }
    }
}
