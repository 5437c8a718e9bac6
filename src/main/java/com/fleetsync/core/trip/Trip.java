package com.fleetsync.core.trip;

import com.fleetsync.core.telemetry.GeoPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Один рейс устройства: от включения зажигания (или возобновления движения после простоя)
 * до выключения зажигания или таймаута простоя.
 */
public record Trip(
        String deviceId,
        long sequence,          // монотонный номер рейса в пределах устройства
        Instant startTime,
        Instant endTime,        // null пока рейс открыт
        GeoPoint startPoint,
        GeoPoint endPoint,      // последняя точка (у открытого рейса текущая)
        double distanceMeters,
        DistanceMethod distanceMethod,
        double avgSpeedKmh,
        double maxSpeedKmh,
        int sampleCount
) {

    public Trip {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(startPoint, "startPoint");
        Objects.requireNonNull(distanceMethod, "distanceMethod");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1: " + sequence);
        }
        if (endTime != null && endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime < startTime");
        }
        if (distanceMeters < 0 || Double.isNaN(distanceMeters)) {
            throw new IllegalArgumentException("distanceMeters < 0");
        }
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1");
        }
    }

    public boolean isOpen() {
        return endTime == null;
    }

    /** Дистанция посчитана по GPS, а не по одометру: показывать как "примерно". */
    public boolean isApproximate() {
        return distanceMethod == DistanceMethod.GEODESIC;
    }

    public Duration duration() {
        return endTime == null ? Duration.ZERO : Duration.between(startTime, endTime);
    }
}
