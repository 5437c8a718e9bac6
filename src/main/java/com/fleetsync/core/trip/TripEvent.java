package com.fleetsync.core.trip;

import java.util.Objects;

public record TripEvent(Type type, Trip trip) {
    public enum Type { OPENED, CLOSED }

    public TripEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(trip, "trip");
    }

    public static TripEvent opened(Trip trip) {
        return new TripEvent(Type.OPENED, trip);
    }

    public static TripEvent closed(Trip trip) {
        return new TripEvent(Type.CLOSED, trip);
    }
}
