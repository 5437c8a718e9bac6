package com.fleetsync.core.ignition;

import java.util.Objects;

/**
 * Итог одного сигнала зажигания. "Не определено" выражается пустым Optional у {@link IgnitionSignal}.
 */
public record IgnitionResult(boolean ignitionOn, double confidence, IgnitionMethod method) {

    public static final IgnitionResult UNKNOWN = new IgnitionResult(false, 0.0, IgnitionMethod.UNKNOWN);

    public IgnitionResult {
        Objects.requireNonNull(method, "method");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        if (method == IgnitionMethod.UNKNOWN && (confidence != 0.0 || ignitionOn)) {
            throw new IllegalArgumentException("unknown method implies ignition off with confidence 0.0");
        }
    }
}
