package com.fleetsync.core.provider;

import java.time.Instant;

/**
 * Снимок общего состояния канала к провайдеру (для мониторинга и тестов).
 *
 * @param backoffUntilMs epoch ms, 0 если backoff не установлен
 * @param tokenExpiresAt null, если токена нет
 */
public record RateLimiterState(
        int callsInWindow,
        long windowStartMs,
        long backoffUntilMs,
        String token,
        Instant tokenExpiresAt
) {}
