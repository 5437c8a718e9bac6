package com.fleetsync.core.trip;

import com.fleetsync.core.ignition.IgnitionMethod;
import com.fleetsync.core.telemetry.NormalizedPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Сегментация потока позиций одного устройства в рейсы.
 *
 * Состояния: IDLE_OFF (рейса нет) → ACTIVE (рейс открыт) → IDLE_ON (рейс открыт,
 * зажигание включено, стоим после движения). Выключение зажигания закрывает рейс на текущей точке.
 * Простой дольше idleTimeout закрывает рейс на первой точке с нулевой скоростью после движения
 * (якорь), следующее движение под тем же зажиганием открывает новый рейс. Прогрев на месте
 * до первого движения простоем не считается.
 *
 * Таймер простоя логический: срабатывает только при обработке новой точки.
 * Точки должны приходить по возрастанию времени; дубликаты и точки "из прошлого" отбрасываются.
 * Экземпляр не потокобезопасен: одним устройством владеет один воркер.
 */
public final class TripSegmenter {
    private static final Logger log = LoggerFactory.getLogger(TripSegmenter.class);

    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(180);

    private final String deviceId;
    private final Duration idleTimeout;
    private final DeviceSegmentationState st = new DeviceSegmentationState();

    public TripSegmenter(String deviceId, Duration idleTimeout) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be > 0");
        }
    }

    public TripSegmenter(String deviceId) {
        this(deviceId, DEFAULT_IDLE_TIMEOUT);
    }

    public String deviceId() {
        return deviceId;
    }

    public SegmentState state() {
        return st.state;
    }

    public DeviceSegmentationState snapshot() {
        return st;
    }

    /** Текущий открытый рейс (endTime = null) с накопленной на данный момент дистанцией. */
    public Optional<Trip> openTrip() {
        return st.openTrip == null ? Optional.empty() : Optional.of(st.openTrip.toTrip(false));
    }

    /**
     * Восстановление после рестарта из последних сохранённых строк.
     *
     * @param lastSequence    номер последнего рейса устройства (у открытого рейса его номер), 0 если рейсов не было
     * @param lastPosition    последняя сохранённая позиция, может быть null
     * @param openTripSamples позиции открытого рейса начиная с его старта; пусто, если открытого рейса нет
     * @return события, возникшие при повторном проигрывании (обычно пусто)
     */
    public List<TripEvent> resume(long lastSequence,
                                  NormalizedPosition lastPosition,
                                  List<NormalizedPosition> openTripSamples) {
        if (st.lastPosition != null) {
            throw new IllegalStateException("segmenter for " + deviceId + " already has state");
        }
        List<TripEvent> events = new ArrayList<>();
        st.lastSequence = Math.max(0, lastSequence);

        if (openTripSamples != null && !openTripSamples.isEmpty()) {
            NormalizedPosition first = openTripSamples.get(0);
            long seq = Math.max(1, lastSequence);
            st.lastSequence = seq;
            st.openTrip = new TripAccumulator(seq, first);
            enterActive();
            st.lastIgnition = true;
            st.lastPosition = first;
            for (int i = 1; i < openTripSamples.size(); i++) {
                events.addAll(process(openTripSamples.get(i)));
            }
            log.info("device {}: resumed open trip #{} from {} samples, state={}",
                    deviceId, seq, openTripSamples.size(), st.state);
        }

        if (lastPosition != null
                && (st.lastPosition == null || lastPosition.timestampUtc().isAfter(st.lastPosition.timestampUtc()))) {
            if (st.openTrip == null) {
                st.lastIgnition = lastPosition.ignitionMethod() != IgnitionMethod.UNKNOWN && lastPosition.ignitionOn();
            }
            st.lastPosition = lastPosition;
        }
        return events;
    }

    /**
     * Обработать одну точку.
     *
     * @return открытые/закрытые рейсы в порядке возникновения (закрытие раньше открытия)
     */
    public List<TripEvent> process(NormalizedPosition p) {
        Objects.requireNonNull(p, "position");
        if (!deviceId.equals(p.deviceId())) {
            throw new IllegalArgumentException("position of " + p.deviceId() + " fed to segmenter of " + deviceId);
        }
        NormalizedPosition prev = st.lastPosition;
        if (prev != null && !p.timestampUtc().isAfter(prev.timestampUtc())) {
            if (p.timestampUtc().equals(prev.timestampUtc())) {
                log.debug("device {}: duplicate sample {} ignored", deviceId, p.timestampUtc());
            } else {
                log.warn("device {}: out-of-order sample {} (last {}) dropped", deviceId, p.timestampUtc(), prev.timestampUtc());
            }
            return List.of();
        }

        // unknown не считаем "выключено": тянем последнее известное состояние
        boolean ignition = p.ignitionMethod() == IgnitionMethod.UNKNOWN ? st.lastIgnition : p.ignitionOn();
        boolean moving = p.speedKmh() > 0;
        List<TripEvent> events = new ArrayList<>(2);

        switch (st.state) {
            case IDLE_OFF -> {
                if (ignition && (!st.lastIgnition || moving)) {
                    events.add(open(p));
                }
            }
            case ACTIVE -> {
                st.openTrip.add(p);
                if (!ignition) {
                    events.add(close(st.openTrip, "ignition off"));
                } else if (!moving && st.openTrip.hasMoved()) {
                    st.state = SegmentState.IDLE_ON;
                    st.idleAnchor = p;
                    st.anchorSnapshot = st.openTrip.copy();
                }
            }
            case IDLE_ON -> {
                Duration idle = Duration.between(st.idleAnchor.timestampUtc(), p.timestampUtc());
                if (!ignition) {
                    st.openTrip.add(p);
                    events.add(close(st.openTrip, "ignition off"));
                } else if (idle.compareTo(idleTimeout) >= 0) {
                    events.add(close(st.anchorSnapshot, "idle " + idle.toSeconds() + "s"));
                    if (moving) {
                        events.add(open(p));
                    }
                } else if (moving) {
                    st.openTrip.add(p);
                    enterActive();
                } else {
                    st.openTrip.add(p);
                }
            }
        }

        st.lastIgnition = ignition;
        st.lastPosition = p;
        return events;
    }

    private TripEvent open(NormalizedPosition p) {
        long seq = ++st.lastSequence;
        st.openTrip = new TripAccumulator(seq, p);
        enterActive();
        Trip trip = st.openTrip.toTrip(false);
        log.info("device {}: trip #{} opened at {} ({}, confidence {})",
                deviceId, seq, p.timestampUtc(), p.ignitionMethod().code(), p.ignitionConfidence());
        return TripEvent.opened(trip);
    }

    private void enterActive() {
        st.state = SegmentState.ACTIVE;
        st.idleAnchor = null;
        st.anchorSnapshot = null;
    }

    private TripEvent close(TripAccumulator acc, String reason) {
        if (acc.distance().odometerRolledBack()) {
            log.warn("device {}: odometer rolled back inside trip #{}, distance falls back to geodesic",
                    deviceId, acc.sequence());
        }
        Trip trip = acc.toTrip(true);
        st.openTrip = null;
        st.idleAnchor = null;
        st.anchorSnapshot = null;
        st.state = SegmentState.IDLE_OFF;
        log.info("device {}: trip #{} closed at {} ({}): {} m {}, {} samples",
                deviceId, trip.sequence(), trip.endTime(), reason,
                Math.round(trip.distanceMeters()), trip.distanceMethod().code(), trip.sampleCount());
        return TripEvent.closed(trip);
    }
}
