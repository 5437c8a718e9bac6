package com.fleetsync.core.trip;

public enum SegmentState {
    /** Рейса нет, зажигание выключено (или рейс только что закрыт по простою). */
    IDLE_OFF,
    /** Рейс открыт, движемся. */
    ACTIVE,
    /** Рейс открыт, зажигание включено, но скорость 0: копим простой. */
    IDLE_ON
}
