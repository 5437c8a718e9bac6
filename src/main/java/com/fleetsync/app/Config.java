package com.fleetsync.app;

import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.List;
import java.util.Map;


public record Config(Db db, ProviderConf provider, IgnitionConf ignition,
                     SegmenterConf segmenter, IngestConf ingest) {
    public record Db(String url, String user, String pass, int poolSize) {}
    public record ProviderConf(String baseUrl, String username, String password, String timezone,
                               int tokenTtlHours, int tokenRefreshBufferMinutes,
                               int maxCallsPerSecond, long minSpacingMs, int rateLimitBackoffSeconds,
                               int maxRetries, long retryBaseMs, int retryFactor, long retryMaxMs,
                               long requestTimeoutMs, long callDeadlineMs,
                               int rateLimitedCode, int tokenExpiredCode, int badParametersCode) {}
    public record IgnitionConf(int accBit, double speedThresholdKmh, double lowConfidenceFloor) {}
    public record SegmenterConf(int idleTimeoutSeconds) {}
    public record IngestConf(int intervalSeconds, int workers, int lookbackHours,
                             int cycleDeadlineSeconds, List<String> devices) {}

    public static Config load() {
        try (InputStream in = Config.class.getResourceAsStream("/application.yaml")) {
            if (in == null) {
                throw new IllegalStateException("application.yaml not found on classpath");
            }
            return load(in);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load application.yaml", e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Config load(InputStream in) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(in);
        if (root == null) root = Map.of();

        Map<String, Object> db  = (Map<String, Object>) root.getOrDefault("db", Map.of());
        Map<String, Object> pr  = (Map<String, Object>) root.getOrDefault("provider", Map.of());
        Map<String, Object> ig  = (Map<String, Object>) root.getOrDefault("ignition", Map.of());
        Map<String, Object> seg = (Map<String, Object>) root.getOrDefault("segmenter", Map.of());
        Map<String, Object> ing = (Map<String, Object>) root.getOrDefault("ingest", Map.of());
        Map<String, Object> codes = (Map<String, Object>) pr.getOrDefault("codes", Map.of());

        int accBit = intOr(ig, "accBit", 0);
        if (accBit < 0 || accBit > 3) {
            throw new IllegalArgumentException("ignition.accBit must be within 0..3, got " + accBit);
        }
        int idleTimeout = intOr(seg, "idleTimeoutSeconds", 180);
        if (idleTimeout <= 0) {
            throw new IllegalArgumentException("segmenter.idleTimeoutSeconds must be > 0");
        }
        List<String> devices = (List<String>) ing.get("devices");

        return new Config(
                new Db(str(db, "url"), str(db, "user"),
                        secret("fs.db.pass", "FS_DB_PASS", str(db, "pass")),
                        intOr(db, "poolSize", 5)),
                new ProviderConf(
                        str(pr, "baseUrl"),
                        str(pr, "username"),
                        secret("fs.provider.password", "FS_PROVIDER_PASSWORD", str(pr, "password")),
                        pr.get("timezone") != null ? (String) pr.get("timezone") : "Asia/Shanghai",
                        intOr(pr, "tokenTtlHours", 24),
                        intOr(pr, "tokenRefreshBufferMinutes", 60),
                        intOr(pr, "maxCallsPerSecond", 3),
                        longOr(pr, "minSpacingMs", 350L),
                        intOr(pr, "rateLimitBackoffSeconds", 60),
                        intOr(pr, "maxRetries", 2),
                        longOr(pr, "retryBaseMs", 2000L),
                        intOr(pr, "retryFactor", 3),
                        longOr(pr, "retryMaxMs", 60_000L),
                        longOr(pr, "requestTimeoutMs", 15_000L),
                        longOr(pr, "callDeadlineMs", 180_000L),
                        intOr(codes, "rateLimited", 8902),
                        intOr(codes, "tokenExpired", 9903),
                        intOr(codes, "badParameters", 9904)),
                new IgnitionConf(accBit,
                        doubleOr(ig, "speedThresholdKmh", 5.0),
                        doubleOr(ig, "lowConfidenceFloor", 0.5)),
                new SegmenterConf(idleTimeout),
                new IngestConf(
                        intOr(ing, "intervalSeconds", 60),
                        intOr(ing, "workers", 4),
                        intOr(ing, "lookbackHours", 24),
                        intOr(ing, "cycleDeadlineSeconds", 300),
                        devices == null ? List.of() : List.copyOf(devices))
        );
    }

    private static String str(Map<String, Object> m, String key) {
        Object v = m.get(key);
        return v == null ? null : String.valueOf(v);
    }

    private static int intOr(Map<String, Object> m, String key, int def) {
        return m.get(key) != null ? ((Number) m.get(key)).intValue() : def;
    }

    private static long longOr(Map<String, Object> m, String key, long def) {
        return m.get(key) != null ? ((Number) m.get(key)).longValue() : def;
    }

    private static double doubleOr(Map<String, Object> m, String key, double def) {
        return m.get(key) != null ? ((Number) m.get(key)).doubleValue() : def;
    }

    // -D → ENV → yaml
    private static String secret(String prop, String env, String fromYaml) {
        String v = System.getProperty(prop);
        if (v != null && !v.isBlank()) return v;
        v = System.getenv(env);
        if (v != null && !v.isBlank()) return v;
        return fromYaml;
    }
}
