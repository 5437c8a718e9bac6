package com.fleetsync.core.trip;

import com.fleetsync.core.telemetry.NormalizedPosition;

/**
 * Состояние сегментации одного устройства. Принадлежит только его {@link TripSegmenter}.
 */
public final class DeviceSegmentationState {

    SegmentState state = SegmentState.IDLE_OFF;
    NormalizedPosition lastPosition;
    // холодный старт: считаем, что зажигание было выключено
    boolean lastIgnition = false;
    long lastSequence;
    TripAccumulator openTrip;
    // первая точка с нулевой скоростью и снимок рейса на ней
    NormalizedPosition idleAnchor;
    TripAccumulator anchorSnapshot;

    DeviceSegmentationState() {
    }

    public SegmentState state() {
        return state;
    }

    public NormalizedPosition lastPosition() {
        return lastPosition;
    }

    public boolean lastIgnition() {
        return lastIgnition;
    }

    public long lastSequence() {
        return lastSequence;
    }

    public NormalizedPosition idleAnchor() {
        return idleAnchor;
    }

    public boolean hasOpenTrip() {
        return openTrip != null;
    }
}
