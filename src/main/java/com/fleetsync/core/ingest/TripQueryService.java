package com.fleetsync.core.ingest;

import com.fleetsync.core.db.DbSyncStatus;
import com.fleetsync.core.db.TelemetryStore;
import com.fleetsync.core.telemetry.NormalizedPosition;
import com.fleetsync.core.trip.Trip;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Чтение для внешних потребителей (чат, алерты, мониторинг). Только чтение.
 */
public final class TripQueryService {

    private final TelemetryStore store;
    private final double lowConfidenceFloor;

    public TripQueryService(TelemetryStore store, double lowConfidenceFloor) {
        this.store = Objects.requireNonNull(store, "store");
        this.lowConfidenceFloor = lowConfidenceFloor;
    }

    /** Рейсы, пересекающие [from, to), включая открытый. */
    public List<Trip> tripsBetween(String deviceId, Instant from, Instant to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("to < from");
        }
        return store.tripsBetween(deviceId, from, to);
    }

    public Optional<Trip> openTrip(String deviceId) {
        return store.openTrip(deviceId);
    }

    public Optional<NormalizedPosition> latestPosition(String deviceId) {
        return store.latestPosition(deviceId);
    }

    public Optional<DbSyncStatus> syncStatus(String deviceId) {
        return store.syncStatus(deviceId);
    }

    /** Дистанция по GPS: показывать как "примерно". */
    public boolean isApproximate(Trip trip) {
        return trip.isApproximate();
    }

    /** Решения, зависящие от зажигания, ниже порога не принимать. */
    public boolean isLowConfidence(NormalizedPosition p) {
        return p.ignitionConfidence() < lowConfidenceFloor;
    }
}
