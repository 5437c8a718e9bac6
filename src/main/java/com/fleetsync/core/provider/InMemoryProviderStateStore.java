package com.fleetsync.core.provider;

import java.util.Optional;

/** Состояние в памяти одного процесса. */
public final class InMemoryProviderStateStore implements ProviderStateStore {

    private TokenLease lease;
    private long backoffUntil;

    @Override
    public synchronized Optional<TokenLease> loadToken() {
        return Optional.ofNullable(lease);
    }

    @Override
    public synchronized void saveToken(TokenLease lease) {
        this.lease = lease;
    }

    @Override
    public synchronized void clearToken() {
        this.lease = null;
    }

    @Override
    public synchronized long backoffUntil() {
        return backoffUntil;
    }

    @Override
    public synchronized void extendBackoff(long untilMs) {
        backoffUntil = Math.max(backoffUntil, untilMs);
    }
}
