package com.fleetsync.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpProviderTransportTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastMethod = new AtomicReference<>();

    private HttpServer server;
    private volatile int replyCode = 200;
    private volatile String replyBody = "{\"status\":0}";
    private HttpProviderTransport transport;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/openapi", this::handle);
        server.start();
        transport = new HttpProviderTransport(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/openapi", mapper, 5_000);
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private void handle(HttpExchange ex) throws IOException {
        lastMethod.set(ex.getRequestMethod());
        lastQuery.set(ex.getRequestURI().getRawQuery());
        lastBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        byte[] bytes = replyBody.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(replyCode, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void postsJsonBodyWithActionInQuery() throws Exception {
        replyBody = "{\"status\":0,\"records\":[{\"speed\":12}]}";
        Map<String, String> query = new LinkedHashMap<>();
        query.put("action", "querytrack");
        query.put("token", "a b");
        JsonNode body = mapper.readTree("{\"deviceid\":\"D-1\"}");

        ProviderResponse resp = transport.post(query, body);

        assertTrue(resp.isOk());
        assertEquals(1, resp.records().size());
        assertEquals("POST", lastMethod.get());
        assertEquals("action=querytrack&token=a+b", lastQuery.get());
        assertEquals("D-1", mapper.readTree(lastBody.get()).get("deviceid").asText());
    }

    @Test
    void providerStatusIsPassedThrough() throws Exception {
        replyBody = "{\"status\":8902,\"cause\":\"too fast\"}";
        ProviderResponse resp = transport.post(Map.of("action", "querytrack"), null);
        assertEquals(8902, resp.status());
        assertEquals("too fast", resp.cause());
        assertEquals("{}", lastBody.get());
    }

    @Test
    void httpErrorIsTransportFailure() {
        replyCode = 500;
        replyBody = "boom";
        assertThrows(ProviderTransportException.class,
                () -> transport.post(Map.of("action", "querytrack"), mapper.createObjectNode()));
    }

    @Test
    void nonJsonBodyIsTransportFailure() {
        replyBody = "<html>maintenance</html>";
        assertThrows(ProviderTransportException.class,
                () -> transport.post(Map.of("action", "querytrack"), mapper.createObjectNode()));
    }

    @Test
    void arrayBodyIsTransportFailure() {
        replyBody = "[1,2]";
        assertThrows(ProviderTransportException.class,
                () -> transport.post(Map.of("action", "querytrack"), mapper.createObjectNode()));
    }

    @Test
    void unreachableHostIsTransportFailure() throws IOException {
        int port;
        try (ServerSocket free = new ServerSocket(0)) {
            port = free.getLocalPort();
        }
        HttpProviderTransport dead = new HttpProviderTransport("http://127.0.0.1:" + port + "/openapi", mapper, 1_000);
        assertThrows(ProviderTransportException.class,
                () -> dead.post(Map.of("action", "login"), mapper.createObjectNode()));
    }

    @Test
    void urlKeepsExistingQueryString() {
        HttpProviderTransport t = new HttpProviderTransport("http://h/openapi?lang=en", mapper, 1_000);
        Map<String, String> q = new LinkedHashMap<>();
        q.put("action", "login");
        q.put("serverid", null);
        assertEquals("http://h/openapi?lang=en&action=login", t.url(q));
    }
}
