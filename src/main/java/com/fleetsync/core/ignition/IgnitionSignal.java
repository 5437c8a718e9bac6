package com.fleetsync.core.ignition;

import com.fleetsync.core.telemetry.RawTelemetryRecord;

import java.util.Optional;

/** Один источник сигнала зажигания. Без побочных эффектов. */
@FunctionalInterface
public interface IgnitionSignal {

    /**
     * @param speedKmh уже нормализованная скорость
     * @return пусто, если сигнал ничего не говорит о зажигании
     */
    Optional<IgnitionResult> evaluate(RawTelemetryRecord raw, double speedKmh);
}
