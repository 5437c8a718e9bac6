package com.fleetsync.core.ingest;

import com.fleetsync.app.Config;
import com.fleetsync.core.db.DbSyncStatus;
import com.fleetsync.core.db.TelemetryStore;
import com.fleetsync.core.provider.ProviderApi;
import com.fleetsync.core.provider.ProviderBadParametersException;
import com.fleetsync.core.provider.ProviderException;
import com.fleetsync.core.telemetry.NormalizedPosition;
import com.fleetsync.core.telemetry.TelemetryNormalizer;
import com.fleetsync.core.trip.Trip;
import com.fleetsync.core.trip.TripEvent;
import com.fleetsync.core.trip.TripSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Циклы синхронизации: список устройств → по воркеру на устройство → отчёт.
 *
 * Устройства независимы, ошибка одного не останавливает остальные: она пишется
 * в device_sync_status, а кэш сегментера устройства сбрасывается (следующий цикл
 * восстановит его из БД и доразберёт вставленные, но не сегментированные позиции). Устройство, которое ещё обрабатывается прошлым циклом,
 * в новом цикле пропускается.
 */
public final class IngestionOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);

    /** Итог одного цикла. */
    public record CycleReport(Instant startedAt, int devices, int succeeded, int failed, int skipped,
                              int positionsInserted, int tripsOpened, int tripsClosed, Duration elapsed) {}

    private final ProviderApi api;
    private final TelemetryNormalizer normalizer;
    private final TelemetryStore store;
    private final Config.IngestConf conf;
    private final Duration idleTimeout;
    private final Clock clock;

    private final Map<String, TripSegmenter> segmenters = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "fs-ingest-scheduler");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean started = new AtomicBoolean(false);

    public IngestionOrchestrator(ProviderApi api,
                                 TelemetryNormalizer normalizer,
                                 TelemetryStore store,
                                 Config.IngestConf conf,
                                 Duration idleTimeout,
                                 Clock clock) {
        this.api = Objects.requireNonNull(api, "api");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.store = Objects.requireNonNull(store, "store");
        this.conf = Objects.requireNonNull(conf, "conf");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, conf.workers()), r -> {
            Thread t = new Thread(r, "fs-ingest-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Периодический запуск циклов. Повторный вызов игнорируется. */
    public void start() {
        if (!started.compareAndSet(false, true)) return;
        long interval = Math.max(1, conf.intervalSeconds());
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                runCycle();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("ingest cycle failed", e);
            }
        }, 0, interval, TimeUnit.SECONDS);
        log.info("ingest scheduled every {} s with {} workers", interval, Math.max(1, conf.workers()));
    }

    /** Один цикл по всем устройствам; блокирует до завершения или дедлайна цикла. */
    public CycleReport runCycle() throws InterruptedException {
        Instant startedAt = clock.instant();
        List<String> devices;
        try {
            devices = devices();
        } catch (ProviderException e) {
            log.warn("device list unavailable, cycle skipped: {}", e.getMessage());
            return new CycleReport(startedAt, 0, 0, 0, 0, 0, 0, 0, Duration.between(startedAt, clock.instant()));
        }

        Map<String, Future<DeviceSyncTask.Result>> futures = new LinkedHashMap<>();
        Map<String, AtomicBoolean> claims = new LinkedHashMap<>();
        int skipped = 0;
        for (String deviceId : devices) {
            if (!inFlight.add(deviceId)) {
                log.info("device {} still in flight from a previous cycle, skipped", deviceId);
                skipped++;
                continue;
            }
            AtomicBoolean claimed = new AtomicBoolean(false);
            claims.put(deviceId, claimed);
            futures.put(deviceId, workers.submit(() -> {
                if (!claimed.compareAndSet(false, true)) return null;
                try {
                    return syncDevice(deviceId);
                } finally {
                    inFlight.remove(deviceId);
                }
            }));
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(Math.max(1, conf.cycleDeadlineSeconds()));
        int ok = 0, failed = 0, inserted = 0, opened = 0, closed = 0;
        for (Map.Entry<String, Future<DeviceSyncTask.Result>> e : futures.entrySet()) {
            String deviceId = e.getKey();
            try {
                DeviceSyncTask.Result r = e.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                if (r == null) {
                    failed++;
                } else {
                    ok++;
                    inserted += r.inserted();
                    opened += r.tripsOpened();
                    closed += r.tripsClosed();
                }
            } catch (TimeoutException te) {
                failed++;
                e.getValue().cancel(true);
                if (claims.get(deviceId).compareAndSet(false, true)) {
                    inFlight.remove(deviceId);
                }
                segmenters.remove(deviceId);
                log.warn("device {}: cycle deadline exceeded, cancelled", deviceId);
                recordFailure(deviceId, "cycle deadline exceeded");
            } catch (ExecutionException ee) {
                // syncDevice сам ловит свои ошибки; сюда попадает только неожиданное
                failed++;
                segmenters.remove(deviceId);
                log.error("device {}: worker crashed", deviceId, ee.getCause());
                recordFailure(deviceId, String.valueOf(ee.getCause()));
            }
        }

        Duration elapsed = Duration.between(startedAt, clock.instant());
        CycleReport report = new CycleReport(startedAt, devices.size(), ok, failed, skipped, inserted, opened, closed, elapsed);
        log.info("ingest cycle: {} devices, {} ok, {} failed, {} skipped, {} new positions, trips +{}/-{} in {} ms",
                report.devices(), ok, failed, skipped, inserted, opened, closed, elapsed.toMillis());
        return report;
    }

    /** Кэшированный сегментер устройства (после хотя бы одного цикла). */
    public Optional<TripSegmenter> segmenter(String deviceId) {
        return Optional.ofNullable(segmenters.get(deviceId));
    }

    private List<String> devices() throws ProviderException, InterruptedException {
        if (conf.devices() != null && !conf.devices().isEmpty()) {
            return conf.devices();
        }
        return api.listDevices();
    }

    // null → устройство упало, ошибка уже записана
    private DeviceSyncTask.Result syncDevice(String deviceId) throws InterruptedException {
        try {
            List<TripEvent> replayed = new ArrayList<>();
            TripSegmenter segmenter = segmenterFor(deviceId, replayed);
            DeviceSyncTask task = new DeviceSyncTask(deviceId, segmenter, api, normalizer, store,
                    Duration.ofHours(Math.max(1, conf.lookbackHours())));
            DeviceSyncTask.Result r = task.run(clock.instant()).withReplayed(replayed);
            store.markSyncSuccess(deviceId, clock.instant(), r.cursor());
            return r;
        } catch (InterruptedException ie) {
            segmenters.remove(deviceId);
            throw ie;
        } catch (ProviderBadParametersException e) {
            segmenters.remove(deviceId);
            log.error("device {}: provider rejected request parameters: {}", deviceId, e.getMessage());
            recordFailure(deviceId, "bad parameters: " + e.getMessage());
            return null;
        } catch (ProviderException e) {
            segmenters.remove(deviceId);
            log.warn("device {}: provider error {}: {}", deviceId, e.getClass().getSimpleName(), e.getMessage());
            recordFailure(deviceId, e.getClass().getSimpleName() + ": " + e.getMessage());
            return null;
        } catch (RuntimeException e) {
            segmenters.remove(deviceId);
            log.error("device {}: sync failed", deviceId, e);
            recordFailure(deviceId, e.getClass().getSimpleName() + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Сегментер из кэша или восстановленный из БД.
     *
     * Открытый рейс проигрывается с его старта. Без открытого рейса проигрываются позиции
     * после курсора device_sync_status (пишется только после сегментации) или конца
     * последнего рейса: они могли быть вставлены проходом, который упал до разбора на рейсы.
     * События проигрывания сразу пишутся в БД и добавляются в {@code replayed}.
     */
    private TripSegmenter segmenterFor(String deviceId, List<TripEvent> replayed) {
        TripSegmenter cached = segmenters.get(deviceId);
        if (cached != null) return cached;

        TripSegmenter seg = new TripSegmenter(deviceId, idleTimeout);
        Optional<Trip> open = store.openTrip(deviceId);
        if (open.isPresent()) {
            replayed.addAll(seg.resume(open.get().sequence(),
                    store.latestPosition(deviceId).orElse(null),
                    store.positionsSince(deviceId, open.get().startTime())));
        } else {
            Optional<Trip> last = store.lastTrip(deviceId);
            long seq = last.map(Trip::sequence).orElse(0L);
            Instant from = replayFrom(deviceId, last.orElse(null));
            List<NormalizedPosition> tail = store.positionsSince(deviceId, from == null ? Instant.EPOCH : from);
            int next = 0;
            NormalizedPosition segmented = null;
            if (from != null && !tail.isEmpty() && tail.get(0).timestampUtc().equals(from)) {
                segmented = tail.get(0);
                next = 1;
            }
            replayed.addAll(seg.resume(seq, segmented, List.of()));
            for (int i = next; i < tail.size(); i++) {
                replayed.addAll(seg.process(tail.get(i)));
            }
            if (tail.size() > next) {
                log.info("device {}: replayed {} stored positions not yet segmented", deviceId, tail.size() - next);
            }
        }
        for (TripEvent e : replayed) {
            store.upsertTrip(e.trip());
        }
        segmenters.put(deviceId, seg);
        return seg;
    }

    // позже из курсора и конца последнего рейса; null → ни того ни другого
    private Instant replayFrom(String deviceId, Trip last) {
        Instant cursor = store.syncStatus(deviceId).map(DbSyncStatus::lastPositionAt).orElse(null);
        Instant lastEnd = last == null ? null : last.endTime();
        if (cursor == null) return lastEnd;
        if (lastEnd == null) return cursor;
        return cursor.isAfter(lastEnd) ? cursor : lastEnd;
    }

    private void recordFailure(String deviceId, String message) {
        try {
            store.markSyncFailure(deviceId, clock.instant(), message);
        } catch (RuntimeException e) {
            log.error("device {}: could not record sync failure", deviceId, e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("ingest workers did not stop in 10 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
