package com.fleetsync.core.db;

import com.fleetsync.core.telemetry.NormalizedPosition;
import com.fleetsync.core.trip.Trip;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище позиций, рейсов и статуса синхронизации.
 * Записи одного устройства приходят из одного воркера по порядку.
 */
public interface TelemetryStore {

    /** Вставка с пропуском уже известных (device_id, ts_utc). Возвращает число новых строк. */
    int insertPositions(List<NormalizedPosition> positions);

    Optional<NormalizedPosition> latestPosition(String deviceId);

    /** Позиции с {@code fromInclusive} по возрастанию времени. */
    List<NormalizedPosition> positionsSince(String deviceId, Instant fromInclusive);

    /** Вставка или обновление по (device_id, trip_seq). */
    void upsertTrip(Trip trip);

    Optional<Trip> openTrip(String deviceId);

    /** Рейс с максимальным номером, открытый или закрытый. */
    Optional<Trip> lastTrip(String deviceId);

    /** Рейсы, пересекающие [from, to), по времени старта. */
    List<Trip> tripsBetween(String deviceId, Instant from, Instant to);

    void markSyncSuccess(String deviceId, Instant at, Instant lastPositionAt);

    void markSyncFailure(String deviceId, Instant at, String error);

    Optional<DbSyncStatus> syncStatus(String deviceId);
}
