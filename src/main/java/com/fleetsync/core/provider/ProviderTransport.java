package com.fleetsync.core.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Один HTTP-обмен с провайдером без лимитов и повторов (это забота {@link ProviderClient}).
 */
public interface ProviderTransport {

    /**
     * @param query параметры строки запроса ({@code action}, {@code token}, {@code serverid})
     * @param body  JSON тело запроса, может быть null
     */
    ProviderResponse post(Map<String, String> query, JsonNode body) throws ProviderTransportException;
}
