package com.fleetsync.core.ingest;

import com.fleetsync.core.db.TelemetryStore;
import com.fleetsync.core.provider.ProviderApi;
import com.fleetsync.core.provider.ProviderException;
import com.fleetsync.core.telemetry.NormalizedPosition;
import com.fleetsync.core.telemetry.RawTelemetryRecord;
import com.fleetsync.core.telemetry.TelemetryNormalizer;
import com.fleetsync.core.trip.TripEvent;
import com.fleetsync.core.trip.TripSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Один проход по одному устройству: трек с курсора → позиции → рейсы → статус.
 * Порядок записи: позиции, затем события рейсов, затем снимок открытого рейса.
 */
final class DeviceSyncTask {
    private static final Logger log = LoggerFactory.getLogger(DeviceSyncTask.class);

    /** Итог прохода по устройству. */
    record Result(String deviceId, int fetched, int normalized, int inserted,
                  int tripsOpened, int tripsClosed, Instant cursor) {

        /** Плюс события, полученные при восстановлении сегментера. */
        Result withReplayed(List<TripEvent> replayed) {
            int o = 0;
            for (TripEvent e : replayed) {
                if (e.type() == TripEvent.Type.OPENED) o++;
            }
            return new Result(deviceId, fetched, normalized, inserted,
                    tripsOpened + o, tripsClosed + replayed.size() - o, cursor);
        }
    }

    private final String deviceId;
    private final TripSegmenter segmenter;
    private final ProviderApi api;
    private final TelemetryNormalizer normalizer;
    private final TelemetryStore store;
    private final Duration lookback;

    DeviceSyncTask(String deviceId, TripSegmenter segmenter, ProviderApi api,
                   TelemetryNormalizer normalizer, TelemetryStore store, Duration lookback) {
        this.deviceId = deviceId;
        this.segmenter = segmenter;
        this.api = api;
        this.normalizer = normalizer;
        this.store = store;
        this.lookback = lookback;
    }

    Result run(Instant now) throws ProviderException, InterruptedException {
        Instant from = window(now);
        List<RawTelemetryRecord> raw = api.queryTrack(deviceId, from, now);

        List<NormalizedPosition> positions = new ArrayList<>(raw.size());
        for (RawTelemetryRecord r : raw) {
            if (r.deviceId() != null && !deviceId.equals(r.deviceId())) {
                log.warn("device {}: track contains a record of {}, dropped", deviceId, r.deviceId());
                continue;
            }
            normalizer.normalize(r).ifPresent(positions::add);
        }
        positions.sort(Comparator.comparing(NormalizedPosition::timestampUtc));

        int inserted = store.insertPositions(positions);

        int opened = 0;
        int closed = 0;
        for (NormalizedPosition p : positions) {
            for (TripEvent e : segmenter.process(p)) {
                store.upsertTrip(e.trip());
                if (e.type() == TripEvent.Type.OPENED) opened++;
                else closed++;
            }
        }
        segmenter.openTrip().ifPresent(store::upsertTrip);

        Instant cursor = Optional.ofNullable(segmenter.snapshot().lastPosition())
                .map(NormalizedPosition::timestampUtc)
                .orElse(null);
        log.info("device {}: {} records, {} positions ({} new), trips +{} opened / {} closed, cursor={}",
                deviceId, raw.size(), positions.size(), inserted, opened, closed, cursor);
        return new Result(deviceId, raw.size(), positions.size(), inserted, opened, closed, cursor);
    }

    // с последней известной точки, но не глубже lookback
    private Instant window(Instant now) {
        Instant floor = now.minus(lookback);
        NormalizedPosition last = segmenter.snapshot().lastPosition();
        if (last == null || last.timestampUtc().isBefore(floor)) {
            return floor;
        }
        return last.timestampUtc().isAfter(now) ? now : last.timestampUtc();
    }
}
