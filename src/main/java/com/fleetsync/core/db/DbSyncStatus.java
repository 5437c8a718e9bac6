package com.fleetsync.core.db;

import java.time.Instant;

/**
 * Состояние синхронизации устройства для мониторинга.
 *
 * @param state          "ok" или "error"
 * @param lastPositionAt курсор: время последней сохранённой позиции
 * @param errorCount     подряд идущие ошибки, сбрасывается успехом
 */
public record DbSyncStatus(
        String deviceId,
        String state,
        Instant lastSuccessAt,
        Instant lastPositionAt,
        int errorCount,
        String lastError,
        Instant updatedAt
) {
    public static final String OK = "ok";
    public static final String ERROR = "error";

    public boolean isOk() {
        return OK.equals(state);
    }
}
