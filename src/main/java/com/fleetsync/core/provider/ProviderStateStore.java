package com.fleetsync.core.provider;

import java.util.Optional;

/**
 * Где живут токен и общий backoff. Несколько процессов на одном аккаунте провайдера
 * видят одно и то же состояние, если хранилище общее (см. PgProviderStateStore).
 */
public interface ProviderStateStore {

    Optional<TokenLease> loadToken();

    void saveToken(TokenLease lease);

    void clearToken();

    /** epoch ms, 0 если backoff не установлен. */
    long backoffUntil();

    /** Сдвигает backoff вперёд; более ранний момент не перезаписывает уже установленный. */
    void extendBackoff(long untilMs);
}
