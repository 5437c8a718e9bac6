package com.fleetsync.core.provider;

/** Токен протух и повторный логин не помог. */
public class ProviderTokenExpiredException extends ProviderException {

    public ProviderTokenExpiredException(int code, String message) {
        super(code, message);
    }
}
