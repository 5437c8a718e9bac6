package com.fleetsync.core.provider;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Токен провайдера и до какого момента он действует. */
public record TokenLease(String token, String serverId, Instant expiresAt) {

    public TokenLease {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    /** Годен, пока до истечения больше, чем buffer. */
    public boolean isUsable(Instant now, Duration buffer) {
        return now.isBefore(expiresAt.minus(buffer));
    }
}
