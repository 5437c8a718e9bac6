package com.fleetsync.core.db;

import com.fleetsync.core.ignition.IgnitionMethod;
import com.fleetsync.core.telemetry.GeoPoint;
import com.fleetsync.core.telemetry.NormalizedPosition;
import com.fleetsync.core.trip.DistanceMethod;
import com.fleetsync.core.trip.Trip;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.fleetsync.core.db.Pg.instant;
import static com.fleetsync.core.db.Pg.ts;

/** {@link TelemetryStore} поверх Postgres (см. db/migration). */
public final class PgTelemetryStore implements TelemetryStore {

    private static final int MAX_ERROR_LEN = 1000;

    private static final String POSITION_COLUMNS = """
            device_id, ts_utc, latitude, longitude, speed_kmh,
            ignition_on, ignition_confidence, ignition_method, odometer_total, moving,
            heading, altitude, battery_percent, signal_strength, overspeed, timestamp_source
            """;

    private static final String TRIP_COLUMNS = """
            device_id, trip_seq, start_time, end_time, start_lat, start_lon, end_lat, end_lon,
            distance_value, distance_method, avg_speed, max_speed, sample_count
            """;

    @Override
    public int insertPositions(List<NormalizedPosition> positions) {
        if (positions == null || positions.isEmpty()) return 0;
        final String sql = "INSERT INTO positions(" + POSITION_COLUMNS + """
                ) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT (device_id, ts_utc) DO NOTHING
                """;
        String deviceId = positions.get(0).deviceId();
        try (Connection c = Pg.get()) {
            c.setAutoCommit(false);
            int inserted = 0;
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (NormalizedPosition p : positions) {
                    ps.setString(1, p.deviceId());
                    ps.setTimestamp(2, ts(p.timestampUtc()));
                    ps.setDouble(3, p.latitude());
                    ps.setDouble(4, p.longitude());
                    ps.setDouble(5, p.speedKmh());
                    ps.setBoolean(6, p.ignitionOn());
                    ps.setDouble(7, p.ignitionConfidence());
                    ps.setString(8, p.ignitionMethod().code());
                    setDouble(ps, 9, p.odometerTotal());
                    ps.setBoolean(10, p.moving());
                    setDouble(ps, 11, p.heading());
                    setDouble(ps, 12, p.altitude());
                    setInt(ps, 13, p.batteryPercent());
                    setInt(ps, 14, p.signalStrength());
                    ps.setBoolean(15, p.overspeed());
                    ps.setString(16, p.timestampSource().name());
                    ps.addBatch();
                }
                for (int r : ps.executeBatch()) {
                    if (r > 0) inserted += r;
                }
            }
            c.commit();
            return inserted;
        } catch (SQLException e) {
            throw new RuntimeException("insertPositions failed for device_id=" + deviceId + " sqlstate=" + e.getSQLState(), e);
        }
    }

    @Override
    public Optional<NormalizedPosition> latestPosition(String deviceId) {
        final String sql = "SELECT " + POSITION_COLUMNS + """
                FROM positions
                WHERE device_id = ?
                ORDER BY ts_utc DESC
                LIMIT 1
                """;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)
        ) {
            ps.setString(1, deviceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(position(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("latestPosition failed for device_id=" + deviceId, e);
        }
    }

    @Override
    public List<NormalizedPosition> positionsSince(String deviceId, Instant fromInclusive) {
        final String sql = "SELECT " + POSITION_COLUMNS + """
                FROM positions
                WHERE device_id = ? AND ts_utc >= ?
                ORDER BY ts_utc
                """;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)
        ) {
            ps.setString(1, deviceId);
            ps.setTimestamp(2, ts(fromInclusive));
            try (ResultSet rs = ps.executeQuery()) {
                List<NormalizedPosition> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(position(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new RuntimeException("positionsSince failed for device_id=" + deviceId, e);
        }
    }

    @Override
    public void upsertTrip(Trip t) {
        final String sql = "INSERT INTO trips(" + TRIP_COLUMNS + """
                ) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT (device_id, trip_seq) DO UPDATE
                  SET end_time = EXCLUDED.end_time,
                      end_lat = EXCLUDED.end_lat,
                      end_lon = EXCLUDED.end_lon,
                      distance_value = EXCLUDED.distance_value,
                      distance_method = EXCLUDED.distance_method,
                      avg_speed = EXCLUDED.avg_speed,
                      max_speed = EXCLUDED.max_speed,
                      sample_count = EXCLUDED.sample_count,
                      updated_at = now()
                """;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, t.deviceId());
            ps.setLong(2, t.sequence());
            ps.setTimestamp(3, ts(t.startTime()));
            ps.setTimestamp(4, ts(t.endTime()));
            ps.setDouble(5, t.startPoint().latitude());
            ps.setDouble(6, t.startPoint().longitude());
            setDouble(ps, 7, t.endPoint() == null ? null : t.endPoint().latitude());
            setDouble(ps, 8, t.endPoint() == null ? null : t.endPoint().longitude());
            ps.setDouble(9, t.distanceMeters());
            ps.setString(10, t.distanceMethod().code());
            ps.setDouble(11, t.avgSpeedKmh());
            ps.setDouble(12, t.maxSpeedKmh());
            ps.setInt(13, t.sampleCount());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("upsertTrip failed for device_id=" + t.deviceId()
                    + " trip_seq=" + t.sequence() + " sqlstate=" + e.getSQLState(), e);
        }
    }

    @Override
    public Optional<Trip> openTrip(String deviceId) {
        final String sql = "SELECT " + TRIP_COLUMNS + """
                FROM trips
                WHERE device_id = ? AND end_time IS NULL
                """;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)
        ) {
            ps.setString(1, deviceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(trip(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("openTrip failed for device_id=" + deviceId, e);
        }
    }

    @Override
    public Optional<Trip> lastTrip(String deviceId) {
        final String sql = "SELECT " + TRIP_COLUMNS + """
                FROM trips
                WHERE device_id = ?
                ORDER BY trip_seq DESC
                LIMIT 1
                """;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)
        ) {
            ps.setString(1, deviceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(trip(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("lastTrip failed for device_id=" + deviceId, e);
        }
    }

    @Override
    public List<Trip> tripsBetween(String deviceId, Instant from, Instant to) {
        final String sql = "SELECT " + TRIP_COLUMNS + """
                FROM trips
                WHERE device_id = ?
                  AND start_time < ?
                  AND (end_time IS NULL OR end_time >= ?)
                ORDER BY start_time, trip_seq
                """;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)
        ) {
            ps.setString(1, deviceId);
            ps.setTimestamp(2, ts(to));
            ps.setTimestamp(3, ts(from));
            try (ResultSet rs = ps.executeQuery()) {
                List<Trip> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(trip(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new RuntimeException("tripsBetween failed for device_id=" + deviceId, e);
        }
    }

    @Override
    public void markSyncSuccess(String deviceId, Instant at, Instant lastPositionAt) {
        final String sql = """
                INSERT INTO device_sync_status(device_id, state, last_success_at, last_position_at, error_count, last_error, updated_at)
                VALUES (?, 'ok', ?, ?, 0, NULL, now())
                ON CONFLICT (device_id) DO UPDATE
                  SET state = 'ok',
                      last_success_at = EXCLUDED.last_success_at,
                      last_position_at = coalesce(EXCLUDED.last_position_at, device_sync_status.last_position_at),
                      error_count = 0,
                      last_error = NULL,
                      updated_at = now()
                """;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, deviceId);
            ps.setTimestamp(2, ts(at));
            ps.setTimestamp(3, ts(lastPositionAt));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("markSyncSuccess failed for device_id=" + deviceId, e);
        }
    }

    @Override
    public void markSyncFailure(String deviceId, Instant at, String error) {
        final String sql = """
                INSERT INTO device_sync_status(device_id, state, error_count, last_error, updated_at)
                VALUES (?, 'error', 1, ?, ?)
                ON CONFLICT (device_id) DO UPDATE
                  SET state = 'error',
                      error_count = device_sync_status.error_count + 1,
                      last_error = EXCLUDED.last_error,
                      updated_at = EXCLUDED.updated_at
                """;
        String msg = error == null ? null
                : error.length() > MAX_ERROR_LEN ? error.substring(0, MAX_ERROR_LEN) : error;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, deviceId);
            ps.setString(2, msg);
            ps.setTimestamp(3, ts(at));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("markSyncFailure failed for device_id=" + deviceId, e);
        }
    }

    @Override
    public Optional<DbSyncStatus> syncStatus(String deviceId) {
        final String sql = """
                SELECT device_id, state, last_success_at, last_position_at, error_count, last_error, updated_at
                FROM device_sync_status
                WHERE device_id = ?
                """;
        try (Connection c = Pg.get();
             PreparedStatement ps = c.prepareStatement(sql)
        ) {
            ps.setString(1, deviceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new DbSyncStatus(
                        rs.getString(1),
                        rs.getString(2),
                        instant(rs.getTimestamp(3)),
                        instant(rs.getTimestamp(4)),
                        rs.getInt(5),
                        rs.getString(6),
                        instant(rs.getTimestamp(7))
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("syncStatus failed for device_id=" + deviceId, e);
        }
    }

    private static NormalizedPosition position(ResultSet rs) throws SQLException {
        return new NormalizedPosition(
                rs.getString(1),
                instant(rs.getTimestamp(2)),
                rs.getDouble(3),
                rs.getDouble(4),
                rs.getDouble(5),
                rs.getBoolean(6),
                rs.getDouble(7),
                IgnitionMethod.fromCode(rs.getString(8)),
                rs.getObject(9, Double.class),
                rs.getBoolean(10),
                rs.getObject(11, Double.class),
                rs.getObject(12, Double.class),
                rs.getObject(13, Integer.class),
                rs.getObject(14, Integer.class),
                rs.getBoolean(15),
                NormalizedPosition.TimestampSource.valueOf(rs.getString(16))
        );
    }

    private static Trip trip(ResultSet rs) throws SQLException {
        Double endLat = rs.getObject(7, Double.class);
        Double endLon = rs.getObject(8, Double.class);
        return new Trip(
                rs.getString(1),
                rs.getLong(2),
                instant(rs.getTimestamp(3)),
                instant(rs.getTimestamp(4)),
                new GeoPoint(rs.getDouble(5), rs.getDouble(6)),
                endLat == null || endLon == null ? null : new GeoPoint(endLat, endLon),
                rs.getDouble(9),
                DistanceMethod.fromCode(rs.getString(10)),
                rs.getDouble(11),
                rs.getDouble(12),
                rs.getInt(13)
        );
    }

    private static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.DOUBLE);
        else ps.setDouble(idx, v);
    }

    private static void setInt(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.INTEGER);
        else ps.setInt(idx, v);
    }
}
