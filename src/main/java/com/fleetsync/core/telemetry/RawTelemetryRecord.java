package com.fleetsync.core.telemetry;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Одна запись провайдера как есть (read-only).
 * Поля провайдера называются по-разному в разных action (callat/lat/latitude и т.п.),
 * поэтому разбор собран в {@link #fromJson(JsonNode, String)}.
 */
public record RawTelemetryRecord(
        String deviceId,
        String gpsTime,        // gpstime/devicetime: epoch (ms или s) либо "yyyy-MM-dd HH:mm:ss"
        String serverTime,     // updatetime/time
        Double latitude,
        Double longitude,
        Double speed,          // единицы провайдера (км/ч или м/ч)
        Long statusBitmask,    // null если нет; отрицательное = сигнал недоступен
        String statusText,
        Double odometerTotal,  // totaldistance, метры; 0/null = нет данных
        Integer moving,        // 0/1
        Double heading,
        Double altitude,
        Double voltagePercent,
        Double voltage,
        Integer rxLevel,
        boolean overspeed
) {

    /**
     * @param fallbackDeviceId id устройства, если в записи его нет (querytrack отдаёт записи без deviceid)
     */
    public static RawTelemetryRecord fromJson(JsonNode n, String fallbackDeviceId) {
        String deviceId = text(n, "deviceid");
        if (deviceId == null) deviceId = fallbackDeviceId;
        String statusText = text(n, "strstatus");
        if (statusText == null) statusText = text(n, "strstatusen");
        return new RawTelemetryRecord(
                deviceId,
                firstText(n, "gpstime", "devicetime"),
                firstText(n, "updatetime", "time"),
                firstNumber(n, "callat", "lat", "latitude"),
                firstNumber(n, "callon", "lon", "lng", "longitude"),
                number(n, "speed"),
                longValue(n, "status"),
                statusText,
                number(n, "totaldistance"),
                intValue(n, "moving"),
                firstNumber(n, "heading", "direction", "course"),
                number(n, "altitude"),
                number(n, "voltagepercent"),
                number(n, "voltagev"),
                intValue(n, "rxlevel"),
                Integer.valueOf(1).equals(intValue(n, "currentoverspeedstate"))
        );
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static String firstText(JsonNode n, String... fields) {
        for (String f : fields) {
            String s = text(n, f);
            // 0 у провайдера значит "нет времени"
            if (s != null && !"0".equals(s)) return s;
        }
        return null;
    }

    private static Double number(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return v.asDouble();
        String s = v.asText().trim();
        if (s.isEmpty()) return null;
        try {
            double d = Double.parseDouble(s);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double firstNumber(JsonNode n, String... fields) {
        for (String f : fields) {
            Double d = number(n, f);
            if (d != null) return d;
        }
        return null;
    }

    private static Long longValue(JsonNode n, String field) {
        Double d = number(n, field);
        return d == null ? null : d.longValue();
    }

    private static Integer intValue(JsonNode n, String field) {
        Double d = number(n, field);
        return d == null ? null : d.intValue();
    }
}
