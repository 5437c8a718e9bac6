package com.fleetsync.core.trip;

public enum DistanceMethod {
    /** Разница показаний одометра: основной способ. */
    ODOMETER("odometer"),
    /** Сумма haversine между соседними точками: приблизительно. */
    GEODESIC("geodesic");

    private final String code;

    DistanceMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static DistanceMethod fromCode(String code) {
        for (DistanceMethod m : values()) {
            if (m.code.equals(code)) return m;
        }
        throw new IllegalArgumentException("Unknown distance method: " + code);
    }
}
