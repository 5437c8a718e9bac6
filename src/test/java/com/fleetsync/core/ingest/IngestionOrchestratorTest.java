package com.fleetsync.core.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetsync.app.Config;
import com.fleetsync.core.db.DbSyncStatus;
import com.fleetsync.core.db.InMemoryTelemetryStore;
import com.fleetsync.core.ignition.IgnitionMethod;
import com.fleetsync.core.ignition.IgnitionResolver;
import com.fleetsync.core.provider.FakeTime;
import com.fleetsync.core.provider.InMemoryProviderStateStore;
import com.fleetsync.core.provider.ProviderApi;
import com.fleetsync.core.provider.ProviderResponse;
import com.fleetsync.core.provider.ProviderTransportException;
import com.fleetsync.core.provider.ScriptedTransport;
import com.fleetsync.core.provider.TestProviders;
import com.fleetsync.core.telemetry.ProviderTime;
import com.fleetsync.core.telemetry.TelemetryNormalizer;
import com.fleetsync.core.trip.DistanceMethod;
import com.fleetsync.core.trip.Trip;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IngestionOrchestratorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2026-01-14T06:00:00Z");
    private static final Instant T0 = Instant.parse("2026-01-14T05:00:00Z");
    private static final Instant T3 = T0.plusSeconds(180);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ScriptedTransport transport = new ScriptedTransport();
    private final InMemoryTelemetryStore store = new InMemoryTelemetryStore();
    private final Map<String, List<JsonNode>> tracks = new ConcurrentHashMap<>();
    private final Map<String, Integer> failingStatus = new ConcurrentHashMap<>();
    private final List<String> monitorList = new CopyOnWriteArrayList<>();
    private final List<IngestionOrchestrator> opened = new ArrayList<>();
    private final ProviderApi api;
    private final TelemetryNormalizer normalizer;

    IngestionOrchestratorTest() {
        ProviderTime providerTime = new ProviderTime(ZoneId.of("Asia/Shanghai"), clock);
        api = new ProviderApi(
                TestProviders.client(transport, new InMemoryProviderStateStore(), TestProviders.conf(),
                        new FakeTime(TestProviders.START_MS)),
                providerTime, "fleet");
        normalizer = new TelemetryNormalizer(IgnitionResolver.standard(0, 5.0), providerTime, 0.5);
        transport.otherwise((q, b) -> {
            if ("querymonitorlist".equals(q.get("action"))) return monitorList();
            String device = b.path("deviceid").asText();
            Integer status = failingStatus.get(device);
            if (status != null) return ScriptedTransport.status(status);
            return track(tracks.getOrDefault(device, List.of()));
        });
    }

    @AfterEach
    void closeAll() {
        opened.forEach(IngestionOrchestrator::close);
    }

    private IngestionOrchestrator orchestrator(List<String> devices, int cycleDeadlineSeconds) {
        IngestionOrchestrator o = new IngestionOrchestrator(api, normalizer, store,
                new Config.IngestConf(60, 2, 24, cycleDeadlineSeconds, devices),
                Duration.ofSeconds(180), clock);
        opened.add(o);
        return o;
    }

    private IngestionOrchestrator orchestrator(String... devices) {
        return orchestrator(List.of(devices), 30);
    }

    private static ObjectNode row(Instant t, double speed, String statusText, Double odometer) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("gpstime", t.toEpochMilli());
        n.put("callat", 6.5 + (t.getEpochSecond() - T0.getEpochSecond()) * 0.0001);
        n.put("callon", 3.3);
        n.put("speed", speed);
        n.put("status", -1);
        if (statusText != null) n.put("strstatus", statusText);
        if (odometer != null) n.put("totaldistance", odometer);
        return n;
    }

    // статус -1 (сигнала нет), потом ACC ON, езда, стоянка 200 с, снова движение
    private static List<JsonNode> scenario() {
        List<JsonNode> rows = new ArrayList<>();
        rows.add(row(T0, 0, null, null));
        rows.add(row(T0.plusSeconds(60), 0, "ACC ON", null));
        rows.add(row(T0.plusSeconds(120), 40, null, 1000.0));
        rows.add(row(T3, 0, null, 1500.0));
        rows.add(row(T3.plusSeconds(200), 0, null, 1500.0));
        rows.add(row(T3.plusSeconds(205), 30, null, 1500.0));
        return rows;
    }

    private static ProviderResponse track(List<JsonNode> rows) {
        ObjectNode resp = MAPPER.createObjectNode();
        resp.put("status", 0);
        ArrayNode arr = resp.putArray("records");
        for (JsonNode r : rows) arr.add(r);
        return ProviderResponse.of(resp);
    }

    private ProviderResponse monitorList() {
        ObjectNode resp = MAPPER.createObjectNode();
        resp.put("status", 0);
        ArrayNode devices = resp.putArray("groups").addObject().putArray("devices");
        for (String id : monitorList) devices.addObject().put("deviceid", id);
        return ProviderResponse.of(resp);
    }

    @Test
    void idleStopSplitsScenarioIntoTwoTrips() throws Exception {
        tracks.put("D-1", scenario());

        IngestionOrchestrator.CycleReport report = orchestrator("D-1").runCycle();

        assertEquals(1, report.devices());
        assertEquals(1, report.succeeded());
        assertEquals(6, report.positionsInserted());
        assertEquals(2, report.tripsOpened());
        assertEquals(1, report.tripsClosed());

        List<Trip> trips = store.trips("D-1");
        assertEquals(2, trips.size());
        Trip first = trips.get(0);
        assertEquals(1, first.sequence());
        assertEquals(T0.plusSeconds(60), first.startTime());
        assertEquals(T3, first.endTime());
        assertEquals(DistanceMethod.ODOMETER, first.distanceMethod());
        assertEquals(500.0, first.distanceMeters(), 1e-9);

        Trip second = trips.get(1);
        assertEquals(2, second.sequence());
        assertTrue(second.isOpen());
        assertEquals(T3.plusSeconds(205), second.startTime());

        var positions = store.positions("D-1");
        assertEquals(IgnitionMethod.UNKNOWN, positions.get(0).ignitionMethod());
        assertEquals(IgnitionMethod.STRING_PARSE, positions.get(1).ignitionMethod());
        assertEquals(0.9, positions.get(1).ignitionConfidence());
        assertEquals(IgnitionMethod.SPEED_INFERENCE, positions.get(2).ignitionMethod());
        DbSyncStatus status = store.syncStatus("D-1").orElseThrow();
        assertTrue(status.isOk());
        assertEquals(T3.plusSeconds(205), status.lastPositionAt());
    }

    @Test
    void reingestingTheSameTrackChangesNothing() throws Exception {
        tracks.put("D-1", scenario());
        IngestionOrchestrator o = orchestrator("D-1");
        o.runCycle();
        List<Trip> before = store.trips("D-1");

        IngestionOrchestrator.CycleReport again = o.runCycle();

        assertEquals(0, again.positionsInserted());
        assertEquals(0, again.tripsOpened());
        assertEquals(0, again.tripsClosed());
        assertEquals(6, store.positions("D-1").size());
        assertEquals(before, store.trips("D-1"));
    }

    @Test
    void restartResumesOpenTripFromStore() throws Exception {
        tracks.put("D-1", scenario());
        orchestrator("D-1").runCycle();

        List<JsonNode> more = new ArrayList<>(scenario());
        more.add(row(T3.plusSeconds(265), 30, "ACC ON", 1800.0));
        more.add(row(T3.plusSeconds(325), 0, "ACC OFF", 2100.0));
        tracks.put("D-1", more);

        // новый процесс: сегментер восстанавливается из БД
        IngestionOrchestrator restarted = orchestrator("D-1");
        IngestionOrchestrator.CycleReport report = restarted.runCycle();

        assertEquals(2, report.positionsInserted());
        assertEquals(0, report.tripsOpened());
        assertEquals(1, report.tripsClosed());

        List<Trip> trips = store.trips("D-1");
        assertEquals(2, trips.size());
        Trip second = trips.get(1);
        assertEquals(2, second.sequence());
        assertEquals(T3.plusSeconds(205), second.startTime());
        assertEquals(T3.plusSeconds(325), second.endTime());
        assertEquals(3, second.sampleCount());
        assertEquals(600.0, second.distanceMeters(), 1e-9);
        assertTrue(store.openTrip("D-1").isEmpty());
        assertTrue(restarted.segmenter("D-1").isPresent());
    }

    @Test
    void failingDeviceDoesNotStopOthers() throws Exception {
        tracks.put("D-1", scenario());
        failingStatus.put("D-2", 9904);
        store.failInserts("D-3", new IllegalStateException("disk full"));
        tracks.put("D-3", scenario());

        IngestionOrchestrator o = orchestrator("D-1", "D-2", "D-3");
        IngestionOrchestrator.CycleReport report = o.runCycle();

        assertEquals(3, report.devices());
        assertEquals(1, report.succeeded());
        assertEquals(2, report.failed());
        assertEquals(2, store.trips("D-1").size());

        DbSyncStatus d2 = store.syncStatus("D-2").orElseThrow();
        assertFalse(d2.isOk());
        assertEquals(1, d2.errorCount());
        assertTrue(d2.lastError().contains("bad parameters"));

        DbSyncStatus d3 = store.syncStatus("D-3").orElseThrow();
        assertFalse(d3.isOk());
        assertTrue(d3.lastError().contains("disk full"));
        assertTrue(o.segmenter("D-3").isEmpty());

        // после устранения ошибки устройство догоняет
        store.failInserts("D-3", null);
        o.runCycle();
        DbSyncStatus recovered = store.syncStatus("D-3").orElseThrow();
        assertTrue(recovered.isOk());
        assertEquals(0, recovered.errorCount());
        assertEquals(2, store.trips("D-3").size());
        assertEquals(2, store.syncStatus("D-2").orElseThrow().errorCount());
    }

    // ACC ON в движении, потом ACC OFF
    private static List<JsonNode> shortTrip(Instant start) {
        return List.of(
                row(start, 40, "ACC ON", null),
                row(start.plusSeconds(60), 40, "ACC ON", null),
                row(start.plusSeconds(120), 0, "ACC OFF", null));
    }

    @Test
    void tripWriteFailureIsRecoveredFromStoredPositions() throws Exception {
        tracks.put("D-1", shortTrip(T0));
        store.failNextTripWrite("D-1", new IllegalStateException("connection reset"));
        IngestionOrchestrator o = orchestrator("D-1");

        IngestionOrchestrator.CycleReport failed = o.runCycle();
        assertEquals(1, failed.failed());
        assertEquals(3, store.positions("D-1").size());
        assertTrue(store.trips("D-1").isEmpty());

        // позиции уже в БД, провайдер ничего нового не отдаёт
        IngestionOrchestrator.CycleReport recovered = o.runCycle();
        assertEquals(1, recovered.succeeded());
        assertEquals(0, recovered.positionsInserted());
        assertEquals(1, recovered.tripsOpened());
        assertEquals(1, recovered.tripsClosed());

        List<Trip> trips = store.trips("D-1");
        assertEquals(1, trips.size());
        assertEquals(1, trips.get(0).sequence());
        assertEquals(T0, trips.get(0).startTime());
        assertEquals(T0.plusSeconds(120), trips.get(0).endTime());
        assertEquals(3, trips.get(0).sampleCount());
        assertEquals(T0.plusSeconds(120), store.syncStatus("D-1").orElseThrow().lastPositionAt());
    }

    @Test
    void replayAfterFailureStartsAtSegmentedCursor() throws Exception {
        tracks.put("D-1", shortTrip(T0));
        IngestionOrchestrator o = orchestrator("D-1");
        o.runCycle();
        assertEquals(1, store.trips("D-1").size());

        List<JsonNode> more = new ArrayList<>(shortTrip(T0));
        more.addAll(shortTrip(T0.plusSeconds(600)));
        tracks.put("D-1", more);
        store.failNextTripWrite("D-1", new IllegalStateException("connection reset"));
        assertEquals(1, o.runCycle().failed());
        assertEquals(6, store.positions("D-1").size());
        assertEquals(T0.plusSeconds(120), store.syncStatus("D-1").orElseThrow().lastPositionAt());

        IngestionOrchestrator.CycleReport recovered = o.runCycle();
        assertEquals(1, recovered.tripsOpened());
        assertEquals(1, recovered.tripsClosed());

        List<Trip> trips = store.trips("D-1");
        assertEquals(2, trips.size());
        assertEquals(T0.plusSeconds(120), trips.get(0).endTime());
        Trip second = trips.get(1);
        assertEquals(2, second.sequence());
        assertEquals(T0.plusSeconds(600), second.startTime());
        assertEquals(T0.plusSeconds(720), second.endTime());
        assertTrue(store.openTrip("D-1").isEmpty());
    }

    @Test
    void devicesComeFromProviderWhenNotConfigured() throws Exception {
        monitorList.addAll(List.of("D-1", "D-2"));
        tracks.put("D-1", scenario());

        IngestionOrchestrator.CycleReport report = orchestrator(List.of(), 30).runCycle();

        assertEquals(2, report.devices());
        assertEquals(2, report.succeeded());
        assertEquals(2, store.trips("D-1").size());
        assertTrue(store.syncStatus("D-2").orElseThrow().isOk());
        assertNull(store.syncStatus("D-2").orElseThrow().lastPositionAt());
    }

    @Test
    void unavailableDeviceListSkipsCycle() throws Exception {
        transport.otherwise((q, b) -> ScriptedTransport.status(1234));

        IngestionOrchestrator.CycleReport report = orchestrator(List.of(), 30).runCycle();

        assertEquals(0, report.devices());
        assertEquals(0, report.succeeded());
        assertTrue(transport.requests("querytrack").isEmpty());
    }

    @Test
    void deviceStillInFlightIsSkippedByNextCycle() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        transport.otherwise((q, b) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderTransportException("interrupted");
            }
            return track(scenario());
        });
        IngestionOrchestrator o = orchestrator("D-1");

        ExecutorService bg = Executors.newSingleThreadExecutor();
        try {
            Future<IngestionOrchestrator.CycleReport> first = bg.submit(o::runCycle);
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            IngestionOrchestrator.CycleReport second = o.runCycle();
            assertEquals(1, second.skipped());
            assertEquals(0, second.succeeded());

            release.countDown();
            assertEquals(1, first.get(10, TimeUnit.SECONDS).succeeded());
        } finally {
            release.countDown();
            bg.shutdownNow();
        }
    }

    @Test
    void deviceOverCycleDeadlineIsRecordedAsFailure() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        transport.otherwise((q, b) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderTransportException("interrupted");
            }
            return track(List.of());
        });
        try {
            IngestionOrchestrator o = orchestrator(List.of("D-1"), 1);
            IngestionOrchestrator.CycleReport report = o.runCycle();

            assertEquals(1, report.failed());
            DbSyncStatus status = store.syncStatus("D-1").orElseThrow();
            assertFalse(status.isOk());
            assertTrue(status.lastError().contains("deadline"));
            assertTrue(o.segmenter("D-1").isEmpty());
        } finally {
            release.countDown();
        }
    }
}
