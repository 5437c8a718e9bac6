package com.fleetsync.core.trip;

import com.fleetsync.core.telemetry.GeoPoint;
import com.fleetsync.core.telemetry.NormalizedPosition;

import java.util.List;

/**
 * Инкрементальный расчёт дистанции рейса.
 *
 * Одометр: разница между первым и последним показанием, если показаний минимум два
 * и они не убывают. Иначе сумма haversine между соседними точками (приблизительно).
 * Откат счётчика (показание меньше предыдущего) выключает одометр для всего рейса.
 */
public final class DistanceAccumulator {

    public record Result(double meters, DistanceMethod method) {}

    private GeoPoint prevPoint;
    private double geodesicMeters;
    private Double firstOdometer;
    private Double lastOdometer;
    private int odometerReadings;
    private boolean rolledBack;

    public DistanceAccumulator() {
    }

    private DistanceAccumulator(DistanceAccumulator o) {
        this.prevPoint = o.prevPoint;
        this.geodesicMeters = o.geodesicMeters;
        this.firstOdometer = o.firstOdometer;
        this.lastOdometer = o.lastOdometer;
        this.odometerReadings = o.odometerReadings;
        this.rolledBack = o.rolledBack;
    }

    public static Result measure(List<NormalizedPosition> samples) {
        DistanceAccumulator acc = new DistanceAccumulator();
        for (NormalizedPosition p : samples) acc.add(p);
        return acc.result();
    }

    public void add(NormalizedPosition p) {
        GeoPoint point = p.point();
        if (prevPoint != null) {
            geodesicMeters += prevPoint.distanceMeters(point);
        }
        prevPoint = point;

        if (p.hasOdometer()) {
            double odo = p.odometerTotal();
            if (firstOdometer == null) {
                firstOdometer = odo;
            } else if (odo < lastOdometer) {
                rolledBack = true;
            }
            lastOdometer = odo;
            odometerReadings++;
        }
    }

    public DistanceAccumulator copy() {
        return new DistanceAccumulator(this);
    }

    /** Счётчик одометра откатился назад внутри рейса. */
    public boolean odometerRolledBack() {
        return rolledBack;
    }

    public double geodesicMeters() {
        return geodesicMeters;
    }

    public Result result() {
        if (!rolledBack && odometerReadings >= 2 && lastOdometer >= firstOdometer) {
            return new Result(lastOdometer - firstOdometer, DistanceMethod.ODOMETER);
        }
        return new Result(geodesicMeters, DistanceMethod.GEODESIC);
    }
}
