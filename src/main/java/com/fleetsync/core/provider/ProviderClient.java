package com.fleetsync.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetsync.app.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Единственная точка выхода к провайдеру телеметрии.
 *
 * Каждый вызов: токен (single-flight логин) → допуск лимитера → HTTP → разбор статуса.
 * <ul>
 *   <li>rate limited: общий backoff для всех, повтор после него, не больше maxRetries;</li>
 *   <li>token expired: сбросить токен, перелогиниться, один повтор;</li>
 *   <li>bad parameters: сразу наверх, без повторов;</li>
 *   <li>прочие коды: {@link ProviderException} без повторов;</li>
 *   <li>сеть/HTTP: повтор с тем же экспоненциальным шагом.</li>
 * </ul>
 * Весь вызов, включая ожидания, ограничен callDeadlineMs.
 */
public final class ProviderClient {
    private static final Logger log = LoggerFactory.getLogger(ProviderClient.class);

    private final ProviderTransport transport;
    private final RateLimiter limiter;
    private final ProviderStateStore store;
    private final Config.ProviderConf conf;
    private final ProviderStatus codes;
    private final TimeSource time;
    private final ObjectMapper mapper;

    private final Object tokenLock = new Object();
    private CompletableFuture<TokenLease> loginInFlight;

    public ProviderClient(ProviderTransport transport,
                          RateLimiter limiter,
                          ProviderStateStore store,
                          Config.ProviderConf conf,
                          TimeSource time,
                          ObjectMapper mapper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.store = Objects.requireNonNull(store, "store");
        this.conf = Objects.requireNonNull(conf, "conf");
        this.time = Objects.requireNonNull(time, "time");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.codes = new ProviderStatus(conf.rateLimitedCode(), conf.tokenExpiredCode(), conf.badParametersCode());
    }

    public TokenLease acquireToken() throws ProviderException, InterruptedException {
        return acquireToken(time.millis() + conf.callDeadlineMs());
    }

    /**
     * Кэшированный токен, если до истечения больше буфера; иначе логин.
     * Параллельные вызывающие ждут результат одного логина.
     */
    TokenLease acquireToken(long deadlineMs) throws ProviderException, InterruptedException {
        Optional<TokenLease> cached = usableToken();
        if (cached.isPresent()) return cached.get();

        CompletableFuture<TokenLease> flight;
        boolean leader = false;
        synchronized (tokenLock) {
            cached = usableToken();
            if (cached.isPresent()) return cached.get();
            if (loginInFlight == null) {
                loginInFlight = new CompletableFuture<>();
                leader = true;
            }
            flight = loginInFlight;
        }

        if (leader) {
            try {
                TokenLease lease = login(deadlineMs);
                store.saveToken(lease);
                flight.complete(lease);
                return lease;
            } catch (ProviderException | InterruptedException | RuntimeException e) {
                flight.completeExceptionally(e);
                throw e;
            } finally {
                synchronized (tokenLock) {
                    if (loginInFlight == flight) loginInFlight = null;
                }
            }
        }

        try {
            return flight.get();
        } catch (ExecutionException e) {
            Throwable c = e.getCause();
            int code = c instanceof ProviderException pe ? pe.code() : 0;
            throw new AuthFailureException(code, "login failed in a concurrent caller: " + c.getMessage(), c);
        }
    }

    /** Сбрасывает токен, если он всё ещё тот же (другой поток мог уже перелогиниться). */
    public void invalidateToken(TokenLease stale) {
        synchronized (tokenLock) {
            Optional<TokenLease> current = store.loadToken();
            if (current.isPresent() && current.get().token().equals(stale.token())) {
                store.clearToken();
                log.info("provider token invalidated");
            }
        }
    }

    /**
     * Вызов действия провайдера.
     *
     * @param params тело запроса (JSON-объект)
     */
    public ProviderResponse call(String action, Map<String, ?> params) throws ProviderException, InterruptedException {
        Objects.requireNonNull(action, "action");
        long deadline = time.millis() + conf.callDeadlineMs();
        JsonNode body = mapper.valueToTree(params == null ? Map.of() : params);

        int retries = 0;
        boolean reauthenticated = false;
        while (true) {
            TokenLease lease = acquireToken(deadline);
            limiter.acquire(deadline);
            log.debug("provider {} (attempt {})", action, retries + 1);

            ProviderResponse resp;
            try {
                resp = transport.post(query(action, lease), body);
            } catch (ProviderTransportException e) {
                if (retries >= conf.maxRetries()) {
                    log.warn("provider {} failed after {} retries: {}", action, retries, e.getMessage());
                    throw e;
                }
                long delay = retryDelayMs(retries++);
                log.warn("provider {} transport error, retry {} in {} ms: {}", action, retries, delay, e.getMessage());
                sleepWithin(delay, deadline, action);
                continue;
            }

            switch (codes.classify(resp.status())) {
                case OK -> {
                    return resp;
                }
                case RATE_LIMITED -> {
                    if (retries >= conf.maxRetries()) {
                        log.warn("provider {} still rate limited after {} retries", action, retries);
                        throw new ProviderRateLimitedException(resp.status(),
                                "rate limited after " + retries + " retries: " + resp.cause());
                    }
                    long delay = Math.max(conf.rateLimitBackoffSeconds() * 1000L, retryDelayMs(retries++));
                    limiter.backoffUntil(time.millis() + delay);
                    log.warn("provider {} rate limited ({}), shared backoff {} ms, retry {}",
                            action, resp.status(), delay, retries);
                }
                case TOKEN_EXPIRED -> {
                    if (reauthenticated) {
                        throw new ProviderTokenExpiredException(resp.status(),
                                "token rejected again after re-login: " + resp.cause());
                    }
                    log.info("provider {}: token expired, re-login", action);
                    invalidateToken(lease);
                    reauthenticated = true;
                }
                case BAD_PARAMETERS -> {
                    log.error("provider {} rejected parameters {}: {}", action, body, resp.cause());
                    throw new ProviderBadParametersException(resp.status(), action + ": " + resp.cause());
                }
                default -> {
                    log.warn("provider {} error {}: {}", action, resp.status(), resp.cause());
                    throw new ProviderException(resp.status(), action + ": " + resp.cause());
                }
            }
        }
    }

    public RateLimiterState state() {
        RateLimiterState s = limiter.snapshot();
        Optional<TokenLease> lease = store.loadToken();
        return new RateLimiterState(s.callsInWindow(), s.windowStartMs(), s.backoffUntilMs(),
                lease.map(TokenLease::token).orElse(null),
                lease.map(TokenLease::expiresAt).orElse(null));
    }

    /** min(base * factor^n, max): 2s → 6s → 18s → ... → 60s. */
    long retryDelayMs(int attempt) {
        double d = conf.retryBaseMs() * Math.pow(conf.retryFactor(), attempt);
        return (long) Math.min(d, conf.retryMaxMs());
    }

    private Optional<TokenLease> usableToken() {
        Instant now = Instant.ofEpochMilli(time.millis());
        Duration buffer = Duration.ofMinutes(conf.tokenRefreshBufferMinutes());
        return store.loadToken().filter(l -> l.isUsable(now, buffer));
    }

    private TokenLease login(long deadlineMs) throws ProviderException, InterruptedException {
        if (conf.username() == null || conf.password() == null) {
            throw new AuthFailureException(0, "provider credentials are not configured");
        }
        limiter.acquire(deadlineMs);

        ObjectNode body = mapper.createObjectNode();
        body.put("type", "USER");
        body.put("from", "web");
        body.put("username", conf.username());
        body.put("password", md5(conf.password()));

        Map<String, String> query = new LinkedHashMap<>();
        query.put("action", "login");

        ProviderResponse resp;
        try {
            resp = transport.post(query, body);
        } catch (ProviderTransportException e) {
            throw new AuthFailureException(0, "login transport failed: " + e.getMessage(), e);
        }
        if (codes.classify(resp.status()) == ProviderStatus.Kind.RATE_LIMITED) {
            limiter.backoffUntil(time.millis() + conf.rateLimitBackoffSeconds() * 1000L);
        }
        if (!resp.isOk()) {
            throw new AuthFailureException(resp.status(), "login rejected (" + resp.status() + "): " + resp.cause());
        }
        String token = resp.text("token");
        if (token == null || token.isBlank()) {
            throw new AuthFailureException(0, "login response carries no token");
        }
        String serverId = resp.text("serverid");
        Instant expiresAt = Instant.ofEpochMilli(time.millis()).plus(Duration.ofHours(conf.tokenTtlHours()));
        log.info("provider login ok as {}, token valid until {}", conf.username(), expiresAt);
        return new TokenLease(token, serverId == null || serverId.isBlank() ? "1" : serverId, expiresAt);
    }

    private Map<String, String> query(String action, TokenLease lease) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("action", action);
        q.put("token", lease.token());
        q.put("serverid", lease.serverId());
        return q;
    }

    private void sleepWithin(long delay, long deadline, String action) throws ProviderTimeoutException, InterruptedException {
        if (time.millis() + delay > deadline) {
            throw new ProviderTimeoutException("provider " + action + ": retry would pass the call deadline");
        }
        time.sleep(delay);
    }

    static String md5(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            StringBuilder sb = new StringBuilder();
            for (byte b : md.digest(s.getBytes(StandardCharsets.UTF_8))) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
