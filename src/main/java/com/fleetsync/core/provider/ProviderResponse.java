package com.fleetsync.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ответ провайдера: {@code {status, cause?, records?, ...}}.
 */
public record ProviderResponse(int status, String cause, JsonNode body) {

    public ProviderResponse {
        body = Objects.requireNonNullElse(body, MissingNode.getInstance());
    }

    public static ProviderResponse of(JsonNode body) {
        JsonNode root = body == null ? MissingNode.getInstance() : body;
        int status = root.path("status").asInt(0);
        String cause = root.hasNonNull("cause") ? root.get("cause").asText() : null;
        return new ProviderResponse(status, cause, root);
    }

    public boolean isOk() {
        return status == 0;
    }

    /** Записи лежат либо в {@code records}, либо в {@code data.records}. */
    public List<JsonNode> records() {
        JsonNode arr = body.path("records");
        if (!arr.isArray()) {
            arr = body.path("data").path("records");
        }
        if (!arr.isArray()) return List.of();
        List<JsonNode> out = new ArrayList<>(arr.size());
        arr.forEach(out::add);
        return out;
    }

    /** Текстовое поле верхнего уровня или null. */
    public String text(String field) {
        JsonNode n = body.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }
}
