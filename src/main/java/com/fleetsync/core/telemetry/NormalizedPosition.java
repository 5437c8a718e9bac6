package com.fleetsync.core.telemetry;

import com.fleetsync.core.ignition.IgnitionMethod;

import java.time.Instant;
import java.util.Objects;

/**
 * Нормализованная позиция: одна на (deviceId, timestampUtc).
 * Создаётся из ровно одной {@link RawTelemetryRecord}, дальше не меняется.
 */
public record NormalizedPosition(
        String deviceId,
        Instant timestampUtc,
        double latitude,
        double longitude,
        double speedKmh,
        boolean ignitionOn,
        double ignitionConfidence,
        IgnitionMethod ignitionMethod,
        Double odometerTotal,     // метры, null если нет
        boolean moving,
        Double heading,
        Double altitude,
        Integer batteryPercent,
        Integer signalStrength,
        boolean overspeed,
        TimestampSource timestampSource
) {

    public enum TimestampSource { GPS, SERVER }

    public NormalizedPosition {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(timestampUtc, "timestampUtc");
        Objects.requireNonNull(ignitionMethod, "ignitionMethod");
        Objects.requireNonNull(timestampSource, "timestampSource");
        if (ignitionConfidence < 0.0 || ignitionConfidence > 1.0) {
            throw new IllegalArgumentException("ignitionConfidence must be within [0,1]: " + ignitionConfidence);
        }
        if (ignitionMethod == IgnitionMethod.UNKNOWN && ignitionConfidence != 0.0) {
            throw new IllegalArgumentException("unknown ignition method implies confidence 0.0");
        }
        if (speedKmh < 0) {
            throw new IllegalArgumentException("speedKmh < 0");
        }
    }

    public GeoPoint point() {
        return new GeoPoint(latitude, longitude);
    }

    /** Показание одометра пригодно для расчёта (не null и не 0). */
    public boolean hasOdometer() {
        return odometerTotal != null && odometerTotal > 0;
    }
}
