package com.fleetsync.core.ignition;

import com.fleetsync.core.telemetry.RawTelemetryRecord;
import com.fleetsync.core.telemetry.TelemetryNormalizer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Определение зажигания по одной сырой записи.
 * Цепочка сигналов, первый определённый результат выигрывает; иначе {@link IgnitionResult#UNKNOWN}.
 */
public final class IgnitionResolver {

    private final List<IgnitionSignal> chain;

    public IgnitionResolver(List<IgnitionSignal> chain) {
        this.chain = List.copyOf(Objects.requireNonNull(chain, "chain"));
    }

    /** status bit → текст статуса → скорость+флаг движения → только скорость. */
    public static IgnitionResolver standard(int accBit, double speedThresholdKmh) {
        return new IgnitionResolver(List.of(
                IgnitionSignals.statusBit(accBit),
                IgnitionSignals.statusText(),
                IgnitionSignals.multiSignal(speedThresholdKmh),
                IgnitionSignals.speedOnly(speedThresholdKmh)
        ));
    }

    public IgnitionResult resolve(RawTelemetryRecord raw) {
        return resolve(raw, TelemetryNormalizer.normalizeSpeed(raw.speed()));
    }

    public IgnitionResult resolve(RawTelemetryRecord raw, double speedKmh) {
        for (IgnitionSignal s : chain) {
            Optional<IgnitionResult> r = s.evaluate(raw, speedKmh);
            if (r.isPresent()) return r.get();
        }
        return IgnitionResult.UNKNOWN;
    }
}
