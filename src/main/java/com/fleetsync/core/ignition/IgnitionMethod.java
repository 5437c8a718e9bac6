package com.fleetsync.core.ignition;

public enum IgnitionMethod {
    STATUS_BIT("status_bit"),
    STRING_PARSE("string_parse"),
    MULTI_SIGNAL("multi_signal"),
    SPEED_INFERENCE("speed_inference"),
    UNKNOWN("unknown");

    private final String code;

    IgnitionMethod(String code) {
        this.code = code;
    }

    /** Значение для колонки ignition_method. */
    public String code() {
        return code;
    }

    public static IgnitionMethod fromCode(String code) {
        for (IgnitionMethod m : values()) {
            if (m.code.equals(code)) return m;
        }
        throw new IllegalArgumentException("Unknown ignition method: " + code);
    }
}
