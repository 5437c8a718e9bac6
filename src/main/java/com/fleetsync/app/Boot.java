package com.fleetsync.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetsync.core.db.Pg;
import com.fleetsync.core.db.PgProviderStateStore;
import com.fleetsync.core.db.PgTelemetryStore;
import com.fleetsync.core.ignition.IgnitionResolver;
import com.fleetsync.core.ingest.IngestionOrchestrator;
import com.fleetsync.core.provider.HttpProviderTransport;
import com.fleetsync.core.provider.ProviderApi;
import com.fleetsync.core.provider.ProviderClient;
import com.fleetsync.core.provider.ProviderStateStore;
import com.fleetsync.core.provider.RateLimiter;
import com.fleetsync.core.provider.TimeSource;
import com.fleetsync.core.telemetry.ProviderTime;
import com.fleetsync.core.telemetry.TelemetryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;

// точка входа: конфиг → БД → клиент провайдера → циклы ingest
public final class Boot {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    private Boot() {}

    public static void main(String[] args) throws InterruptedException {
        Config cfg = Config.load();
        Config.ProviderConf pc = cfg.provider();

        // Инициализация БД и миграций заранее
        Pg.init(cfg.db());

        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = new ObjectMapper();
        ProviderStateStore state = new PgProviderStateStore();
        RateLimiter limiter = new RateLimiter(pc.maxCallsPerSecond(), pc.minSpacingMs(), state, TimeSource.SYSTEM);
        ProviderClient client = new ProviderClient(
                new HttpProviderTransport(pc.baseUrl(), mapper, pc.requestTimeoutMs()),
                limiter, state, pc, TimeSource.SYSTEM, mapper);
        ProviderTime providerTime = new ProviderTime(ZoneId.of(pc.timezone()), clock);

        TelemetryNormalizer normalizer = new TelemetryNormalizer(
                IgnitionResolver.standard(cfg.ignition().accBit(), cfg.ignition().speedThresholdKmh()),
                providerTime,
                cfg.ignition().lowConfidenceFloor());

        IngestionOrchestrator orchestrator = new IngestionOrchestrator(
                new ProviderApi(client, providerTime, pc.username()),
                normalizer,
                new PgTelemetryStore(),
                cfg.ingest(),
                Duration.ofSeconds(cfg.segmenter().idleTimeoutSeconds()),
                clock);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            try {
                orchestrator.close();
            } finally {
                Pg.close();
                stopped.countDown();
            }
        }, "fs-shutdown"));

        orchestrator.start();
        log.info("fleetsync started: provider={} devices={} idleTimeout={}s",
                pc.baseUrl(),
                cfg.ingest().devices().isEmpty() ? "auto" : cfg.ingest().devices().size(),
                cfg.segmenter().idleTimeoutSeconds());
        stopped.await();
    }
}
