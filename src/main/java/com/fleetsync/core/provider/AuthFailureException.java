package com.fleetsync.core.provider;

/** Не удалось получить токен. Цикл для устройства пропускается, повтор на следующем запуске. */
public class AuthFailureException extends ProviderException {

    public AuthFailureException(int code, String message) {
        super(code, message);
    }

    public AuthFailureException(int code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
