package com.fleetsync.core.ignition;

import com.fleetsync.core.telemetry.RawTelemetryRecord;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Стандартные сигналы зажигания в порядке убывания доверия.
 */
public final class IgnitionSignals {

    private IgnitionSignals() {
    }

    /**
     * Бит ACC в статусе JT808 (младшие 16 бит). Отрицательный статус = "нет сигнала", а не "выключено".
     */
    public static IgnitionSignal statusBit(int accBit) {
        if (accBit < 0 || accBit > 3) {
            throw new IllegalArgumentException("accBit must be within 0..3: " + accBit);
        }
        final long mask = 1L << accBit;
        return (raw, speedKmh) -> {
            Long status = raw.statusBitmask();
            if (status == null || status < 0) return Optional.empty();
            // вне диапазона → оставляем только базовый статус JT808
            long base = status & 0xFFFFL;
            boolean on = (base & mask) != 0;
            return Optional.of(new IgnitionResult(on, 1.0, IgnitionMethod.STATUS_BIT));
        };
    }

    // ACC开 / ACC关
    private static final Pattern LOCALIZED = Pattern.compile("ACC\\s*([开关])", Pattern.CASE_INSENSITIVE);
    // ACC ON, ACC:ON, ACC_ON, ACC=ON, ACCON, IGNITION OFF ...
    private static final Pattern ASCII = Pattern.compile(
            "(?<![A-Z])(?:ACC|IGN(?:ITION)?)\\s*[:_=]?\\s*(ON|OFF)(?![A-Z])", Pattern.CASE_INSENSITIVE);

    /** Явные маркеры в тексте статуса. OFF имеет приоритет, если встречаются оба. */
    public static IgnitionSignal statusText() {
        return (raw, speedKmh) -> {
            String text = raw.statusText();
            if (text == null || text.isBlank()) return Optional.empty();
            Boolean on = parseStatusText(text);
            if (on == null) return Optional.empty();
            return Optional.of(new IgnitionResult(on, 0.9, IgnitionMethod.STRING_PARSE));
        };
    }

    static Boolean parseStatusText(String text) {
        boolean sawOn = false;
        boolean sawOff = false;
        Matcher m = LOCALIZED.matcher(text);
        while (m.find()) {
            if ("关".equals(m.group(1))) sawOff = true; else sawOn = true;
        }
        m = ASCII.matcher(text);
        while (m.find()) {
            if ("OFF".equalsIgnoreCase(m.group(1))) sawOff = true; else sawOn = true;
        }
        if (sawOff) return Boolean.FALSE;
        if (sawOn) return Boolean.TRUE;
        return null;
    }

    /** Скорость выше порога и флаг движения одновременно. */
    public static IgnitionSignal multiSignal(double speedThresholdKmh) {
        return (raw, speedKmh) -> {
            boolean fast = speedKmh > speedThresholdKmh;
            boolean movingFlag = raw.moving() != null && raw.moving() == 1;
            if (fast && movingFlag) {
                return Optional.of(new IgnitionResult(true, 0.7, IgnitionMethod.MULTI_SIGNAL));
            }
            return Optional.empty();
        };
    }

    /** Только скорость: слабый сигнал. */
    public static IgnitionSignal speedOnly(double speedThresholdKmh) {
        return (raw, speedKmh) -> speedKmh > speedThresholdKmh
                ? Optional.of(new IgnitionResult(true, 0.3, IgnitionMethod.SPEED_INFERENCE))
                : Optional.empty();
    }
}
