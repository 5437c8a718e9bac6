package com.fleetsync.core.provider;

/** Истёк дедлайн вызова (ожидание лимитера, backoff или повторы). */
public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(String message) {
        super(0, message);
    }
}
