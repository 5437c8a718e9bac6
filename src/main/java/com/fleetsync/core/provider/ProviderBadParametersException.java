package com.fleetsync.core.provider;

/** Провайдер отверг параметры запроса: ошибка в нашем коде, не повторяется. */
public class ProviderBadParametersException extends ProviderException {

    public ProviderBadParametersException(int code, String message) {
        super(code, message);
    }
}
