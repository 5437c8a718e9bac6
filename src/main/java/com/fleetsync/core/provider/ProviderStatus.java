package com.fleetsync.core.provider;

/**
 * Коды статуса в теле ответа провайдера. 0 = успех.
 * У GPS51: 8902 лимит по IP, 9903 токен истёк, 9904 ошибка параметров.
 */
public record ProviderStatus(int rateLimited, int tokenExpired, int badParameters) {

    public enum Kind { OK, RATE_LIMITED, TOKEN_EXPIRED, BAD_PARAMETERS, ERROR }

    public Kind classify(int status) {
        if (status == 0) return Kind.OK;
        if (status == rateLimited) return Kind.RATE_LIMITED;
        if (status == tokenExpired) return Kind.TOKEN_EXPIRED;
        if (status == badParameters) return Kind.BAD_PARAMETERS;
        return Kind.ERROR;
    }
}
