package com.fleetsync.core.provider;

/**
 * Ошибка провайдера телеметрии. {@code code}: статус из ответа (0, если до ответа не дошли).
 */
public class ProviderException extends Exception {

    private final int code;

    public ProviderException(int code, String message) {
        super(message);
        this.code = code;
    }

    public ProviderException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
