package com.fleetsync.core.trip;

import com.fleetsync.core.telemetry.NormalizedPosition;

/**
 * Открытый рейс в памяти: копит точки, пока state machine не закроет его.
 */
final class TripAccumulator {

    private final String deviceId;
    private final long sequence;
    private final NormalizedPosition first;
    private NormalizedPosition last;
    private int count;
    private double speedSum;
    private double maxSpeed;
    private final DistanceAccumulator distance;

    TripAccumulator(long sequence, NormalizedPosition first) {
        this.deviceId = first.deviceId();
        this.sequence = sequence;
        this.first = first;
        this.distance = new DistanceAccumulator();
        add(first);
    }

    private TripAccumulator(TripAccumulator o) {
        this.deviceId = o.deviceId;
        this.sequence = o.sequence;
        this.first = o.first;
        this.last = o.last;
        this.count = o.count;
        this.speedSum = o.speedSum;
        this.maxSpeed = o.maxSpeed;
        this.distance = o.distance.copy();
    }

    void add(NormalizedPosition p) {
        last = p;
        count++;
        speedSum += p.speedKmh();
        maxSpeed = Math.max(maxSpeed, p.speedKmh());
        distance.add(p);
    }

    TripAccumulator copy() {
        return new TripAccumulator(this);
    }

    /** Была ли в рейсе хоть одна точка с ненулевой скоростью. */
    boolean hasMoved() {
        return maxSpeed > 0;
    }

    long sequence() {
        return sequence;
    }

    NormalizedPosition last() {
        return last;
    }

    DistanceAccumulator distance() {
        return distance;
    }

    /** @param closed true → endTime = время последней точки */
    Trip toTrip(boolean closed) {
        DistanceAccumulator.Result d = distance.result();
        return new Trip(
                deviceId,
                sequence,
                first.timestampUtc(),
                closed ? last.timestampUtc() : null,
                first.point(),
                last.point(),
                d.meters(),
                d.method(),
                Math.round(speedSum / count * 10.0) / 10.0,
                maxSpeed,
                count
        );
    }
}
