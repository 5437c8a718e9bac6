package com.fleetsync.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * POST JSON на openapi-эндпоинт провайдера, параметры в query string.
 */
public final class HttpProviderTransport implements ProviderTransport {
    private static final Logger log = LoggerFactory.getLogger(HttpProviderTransport.class);

    private final String baseUrl;
    private final ObjectMapper mapper;
    private final int timeoutMs;

    public HttpProviderTransport(String baseUrl, ObjectMapper mapper, long timeoutMs) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeoutMs));
    }

    @Override
    public ProviderResponse post(Map<String, String> query, JsonNode body) throws ProviderTransportException {
        String url = url(query);
        String action = query.get("action");
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) URI.create(url).toURL().openConnection();
            conn.setRequestMethod("POST");
            conn.setConnectTimeout(timeoutMs);
            conn.setReadTimeout(timeoutMs);
            conn.setRequestProperty("Content-Type", "application/json");
            conn.setRequestProperty("Accept", "application/json");
            conn.setDoOutput(true);

            try (OutputStream os = conn.getOutputStream()) {
                byte[] input = mapper.writeValueAsBytes(body == null ? mapper.createObjectNode() : body);
                os.write(input, 0, input.length);
            }

            int code = conn.getResponseCode();
            if (code / 100 != 2) {
                String err = readQuietly(conn.getErrorStream());
                log.warn("provider {} HTTP {}: {}", action, code, abbreviate(err));
                throw new ProviderTransportException("provider " + action + " HTTP " + code);
            }
            JsonNode json;
            try (InputStream in = conn.getInputStream()) {
                json = mapper.readTree(in);
            }
            if (json == null || !json.isObject()) {
                throw new ProviderTransportException("provider " + action + " returned a non-object body");
            }
            return ProviderResponse.of(json);
        } catch (IOException e) {
            throw new ProviderTransportException("provider " + action + " I/O failed: " + e.getMessage(), e);
        } finally {
            if (conn != null) conn.disconnect();
        }
    }

    String url(Map<String, String> query) {
        StringBuilder sb = new StringBuilder(baseUrl.replaceAll("/$", ""));
        char sep = baseUrl.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> e : query.entrySet()) {
            if (e.getValue() == null) continue;
            sb.append(sep)
                    .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
            sep = '&';
        }
        return sb.toString();
    }

    private static String readQuietly(InputStream in) {
        if (in == null) return "";
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable: " + e.getMessage() + ">";
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
