package com.fleetsync.core.provider;

/** Сеть, не-2xx HTTP или нечитаемый ответ. */
public class ProviderTransportException extends ProviderException {

    public ProviderTransportException(String message) {
        super(0, message);
    }

    public ProviderTransportException(String message, Throwable cause) {
        super(0, message, cause);
    }
}
