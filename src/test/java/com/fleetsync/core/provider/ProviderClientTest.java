package com.fleetsync.core.provider;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

import static com.fleetsync.core.provider.TestProviders.START_MS;
import static org.junit.jupiter.api.Assertions.*;

class ProviderClientTest {

    private final FakeTime time = new FakeTime(START_MS);
    private final InMemoryProviderStateStore store = new InMemoryProviderStateStore();
    private final ScriptedTransport transport = new ScriptedTransport();
    private final ProviderClient client = TestProviders.client(transport, store, TestProviders.conf(), time);

    @Test
    void loginSendsMd5PasswordAndTokenIsReused() throws Exception {
        client.call("querytrack", Map.of("deviceid", "D-1"));
        client.call("querytrack", Map.of("deviceid", "D-1"));

        assertEquals(1, transport.logins());
        var login = transport.requests("login").get(0);
        assertEquals("USER", login.body().get("type").asText());
        assertEquals("web", login.body().get("from").asText());
        assertEquals("fleet", login.body().get("username").asText());
        assertEquals("5ebe2294ecd0e0f08eab7690d2a6ee69", login.body().get("password").asText());

        var call = transport.requests("querytrack").get(1);
        assertEquals("tok-1", call.query().get("token"));
        assertEquals("7", call.query().get("serverid"));
        assertEquals("D-1", call.body().get("deviceid").asText());
    }

    @Test
    void tokenIsRefreshedOnceInsideTheBufferWindow() throws Exception {
        TokenLease first = client.acquireToken();
        assertEquals(Instant.ofEpochMilli(START_MS).plus(Duration.ofHours(24)), first.expiresAt());

        time.advance(Duration.ofHours(22).toMillis());
        assertSame(first, client.acquireToken());

        // меньше часа до истечения
        time.advance(Duration.ofMinutes(61).toMillis());
        TokenLease second = client.acquireToken();
        assertEquals("tok-2", second.token());
        assertEquals(2, transport.logins());
    }

    @Test
    void concurrentCallersShareOneLogin() throws Exception {
        transport.loginDelayMs(200);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<TokenLease>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return client.acquireToken();
                }));
            }
            go.countDown();
            Set<String> tokens = ConcurrentHashMap.newKeySet();
            for (Future<TokenLease> f : futures) {
                tokens.add(f.get(10, TimeUnit.SECONDS).token());
            }
            assertEquals(Set.of("tok-1"), tokens);
            assertEquals(1, transport.logins());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void loginRejectionIsAuthFailure() {
        transport.loginStatus(1);
        AuthFailureException e = assertThrows(AuthFailureException.class,
                () -> client.call("querytrack", Map.of()));
        assertEquals(1, e.code());
        assertTrue(transport.requests("querytrack").isEmpty());
    }

    @Test
    void rateLimitSetsSharedBackoffAndRetriesAfterIt() throws Exception {
        transport.thenStatus(8902);
        ProviderResponse resp = client.call("querytrack", Map.of());

        assertTrue(resp.isOk());
        assertEquals(2, transport.requests("querytrack").size());
        // login в START, вызов через 350 мс, backoff 60 с
        assertEquals(START_MS + 350 + 60_000, store.backoffUntil());
        assertEquals(START_MS + 350 + 60_000, time.millis());
    }

    @Test
    void rateLimitGivesUpAfterRetryCeiling() {
        transport.thenStatus(8902).thenStatus(8902).thenStatus(8902);
        ProviderRateLimitedException e = assertThrows(ProviderRateLimitedException.class,
                () -> client.call("querytrack", Map.of()));
        assertEquals(8902, e.code());
        assertEquals(3, transport.requests("querytrack").size());
    }

    @Test
    void backoffPastTheDeadlineTimesOut() {
        ProviderClient shortDeadline = TestProviders.client(transport, store, TestProviders.conf(30_000L), time);
        transport.thenStatus(8902);
        assertThrows(ProviderTimeoutException.class, () -> shortDeadline.call("querytrack", Map.of()));
        assertEquals(1, transport.requests("querytrack").size());
    }

    @Test
    void expiredTokenTriggersOneReloginAndRetry() throws Exception {
        transport.thenStatus(9903);
        assertTrue(client.call("querytrack", Map.of()).isOk());

        assertEquals(2, transport.logins());
        var calls = transport.requests("querytrack");
        assertEquals("tok-1", calls.get(0).query().get("token"));
        assertEquals("tok-2", calls.get(1).query().get("token"));
    }

    @Test
    void tokenRejectedTwiceSurfaces() {
        transport.thenStatus(9903).thenStatus(9903);
        assertThrows(ProviderTokenExpiredException.class, () -> client.call("querytrack", Map.of()));
        assertEquals(2, transport.logins());
    }

    @Test
    void badParametersAreNotRetried() {
        transport.thenStatus(9904);
        ProviderBadParametersException e = assertThrows(ProviderBadParametersException.class,
                () -> client.call("querytrack", Map.of("deviceid", "")));
        assertEquals(9904, e.code());
        assertEquals(1, transport.requests("querytrack").size());
        assertEquals(0L, store.backoffUntil());
    }

    @Test
    void otherStatusCodesSurfaceAsGenericError() {
        transport.thenStatus(1234);
        ProviderException e = assertThrows(ProviderException.class, () -> client.call("querytrack", Map.of()));
        assertEquals(ProviderException.class, e.getClass());
        assertEquals(1234, e.code());
        assertEquals(1, transport.requests("querytrack").size());
    }

    @Test
    void transportErrorsAreRetriedWithExponentialSpacing() throws Exception {
        transport.thenFail().thenFail();
        assertTrue(client.call("querytrack", Map.of()).isOk());

        assertEquals(3, transport.requests("querytrack").size());
        assertTrue(time.sleeps().contains(2_000L));
        assertTrue(time.sleeps().contains(6_000L));
    }

    @Test
    void transportErrorsExhaustRetries() {
        transport.thenFail().thenFail().thenFail();
        assertThrows(ProviderTransportException.class, () -> client.call("querytrack", Map.of()));
        assertEquals(3, transport.requests("querytrack").size());
    }

    @Test
    void retrySpacingIsCapped() {
        assertEquals(2_000L, client.retryDelayMs(0));
        assertEquals(6_000L, client.retryDelayMs(1));
        assertEquals(18_000L, client.retryDelayMs(2));
        assertEquals(54_000L, client.retryDelayMs(3));
        assertEquals(60_000L, client.retryDelayMs(4));
    }

    @Test
    void invalidateKeepsNewerToken() throws Exception {
        TokenLease lease = client.acquireToken();
        client.invalidateToken(new TokenLease("stale", "7", lease.expiresAt()));
        assertEquals("tok-1", store.loadToken().orElseThrow().token());

        client.invalidateToken(lease);
        assertTrue(store.loadToken().isEmpty());
    }

    @Test
    void stateReportsTokenAndWindow() throws Exception {
        client.call("querytrack", Map.of());
        RateLimiterState s = client.state();
        assertEquals("tok-1", s.token());
        assertEquals(2, s.callsInWindow());
        assertEquals(0L, s.backoffUntilMs());
        assertNotNull(s.tokenExpiresAt());
    }
}
