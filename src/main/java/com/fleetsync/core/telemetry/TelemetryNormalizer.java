package com.fleetsync.core.telemetry;

import com.fleetsync.core.ignition.IgnitionResolver;
import com.fleetsync.core.ignition.IgnitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Сырые записи провайдера → {@link NormalizedPosition}.
 * Записи без валидного времени или координат отбрасываются (warn), остальное приводится к км/ч, % и т.д.
 */
public final class TelemetryNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TelemetryNormalizer.class);

    // ниже порога дрейф GPS, считаем стоянкой
    static final double STATIONARY_KMH = 3.0;
    static final double MAX_KMH = 300.0;
    // выше порога это м/ч, а не км/ч
    static final double METERS_PER_HOUR_THRESHOLD = 200.0;

    // 12V свинцово-кислотная
    private static final double LEAD_ACID_MIN_V = 11.0;
    private static final double LEAD_ACID_MAX_V = 12.8;

    private final IgnitionResolver ignition;
    private final ProviderTime time;
    private final double lowConfidenceFloor;

    public TelemetryNormalizer(IgnitionResolver ignition, ProviderTime time, double lowConfidenceFloor) {
        this.ignition = Objects.requireNonNull(ignition, "ignition");
        this.time = Objects.requireNonNull(time, "time");
        this.lowConfidenceFloor = lowConfidenceFloor;
    }

    public Optional<NormalizedPosition> normalize(RawTelemetryRecord raw) {
        if (raw.deviceId() == null) {
            log.warn("record without device id dropped");
            return Optional.empty();
        }
        NormalizedPosition.TimestampSource source = NormalizedPosition.TimestampSource.GPS;
        Optional<Instant> ts = time.parse(raw.gpsTime());
        if (ts.isEmpty()) {
            source = NormalizedPosition.TimestampSource.SERVER;
            ts = time.parse(raw.serverTime());
        }
        if (ts.isEmpty()) {
            log.warn("device {}: record without usable timestamp dropped (gps={}, server={})",
                    raw.deviceId(), raw.gpsTime(), raw.serverTime());
            return Optional.empty();
        }
        if (!validCoordinates(raw.latitude(), raw.longitude())) {
            log.warn("device {}: invalid coordinates {},{} at {} dropped",
                    raw.deviceId(), raw.latitude(), raw.longitude(), ts.get());
            return Optional.empty();
        }

        double speedKmh = normalizeSpeed(raw.speed());
        IgnitionResult ign = ignition.resolve(raw, speedKmh);
        if (ign.confidence() < lowConfidenceFloor) {
            log.debug("device {}: low ignition confidence {} ({}) status={} text={}",
                    raw.deviceId(), ign.confidence(), ign.method().code(), raw.statusBitmask(), raw.statusText());
        }
        boolean moving = speedKmh > STATIONARY_KMH || (raw.moving() != null && raw.moving() == 1);

        return Optional.of(new NormalizedPosition(
                raw.deviceId(),
                ts.get(),
                raw.latitude(),
                raw.longitude(),
                speedKmh,
                ign.ignitionOn(),
                ign.confidence(),
                ign.method(),
                raw.odometerTotal() != null && raw.odometerTotal() > 0 ? raw.odometerTotal() : null,
                moving,
                raw.heading(),
                raw.altitude(),
                batteryPercent(raw.voltagePercent(), raw.voltage()),
                signalStrength(raw.rxLevel()),
                raw.overspeed(),
                source
        ));
    }

    /**
     * Скорость провайдера → км/ч: &gt;200 считаем м/ч, &lt;3 км/ч = 0, потолок 300, один знак после запятой.
     */
    public static double normalizeSpeed(Double raw) {
        if (raw == null || raw.isNaN() || raw <= 0) return 0.0;
        double kmh = raw > METERS_PER_HOUR_THRESHOLD ? raw / 1000.0 : raw;
        if (kmh < STATIONARY_KMH) return 0.0;
        kmh = Math.min(kmh, MAX_KMH);
        return Math.round(kmh * 10.0) / 10.0;
    }

    /** Диапазоны и "null island" (0,0). */
    public static boolean validCoordinates(Double lat, Double lon) {
        if (lat == null || lon == null || lat.isNaN() || lon.isNaN()) return false;
        if (lat < -90 || lat > 90 || lon < -180 || lon > 180) return false;
        return !(lat == 0.0 && lon == 0.0);
    }

    /** voltagepercent, иначе напряжение по кривой свинцово-кислотной 12V батареи. */
    public static Integer batteryPercent(Double percent, Double voltage) {
        if (percent != null && percent > 0) {
            return (int) Math.max(0, Math.min(100, Math.round(percent)));
        }
        if (voltage == null || voltage <= 0) return null;
        if (voltage >= LEAD_ACID_MAX_V) return 100;
        if (voltage <= LEAD_ACID_MIN_V) return 0;
        double norm = (voltage - LEAD_ACID_MIN_V) / (LEAD_ACID_MAX_V - LEAD_ACID_MIN_V);
        return (int) Math.round(Math.pow(norm, 1.5) * 100);
    }

    /** rxlevel бывает 0..31 или 0..99; приводим к 0..100. */
    public static Integer signalStrength(Integer rxLevel) {
        if (rxLevel == null) return null;
        int level = Math.max(0, rxLevel);
        if (level <= 31) return (int) Math.round(level / 31.0 * 100);
        if (level <= 99) return (int) Math.round(level / 99.0 * 100);
        return 100;
    }
}
