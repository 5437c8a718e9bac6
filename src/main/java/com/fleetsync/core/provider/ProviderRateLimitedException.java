package com.fleetsync.core.provider;

/** Лимит вызовов так и не отпустил после всех повторов. */
public class ProviderRateLimitedException extends ProviderException {

    public ProviderRateLimitedException(int code, String message) {
        super(code, message);
    }
}
