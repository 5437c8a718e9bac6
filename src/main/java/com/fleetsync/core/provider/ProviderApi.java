package com.fleetsync.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetsync.core.telemetry.ProviderTime;
import com.fleetsync.core.telemetry.RawTelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Действия провайдера, которые нужны движку: список устройств и трек за окно.
 */
public final class ProviderApi {
    private static final Logger log = LoggerFactory.getLogger(ProviderApi.class);

    private final ProviderClient client;
    private final ProviderTime time;
    private final String username;

    public ProviderApi(ProviderClient client, ProviderTime time, String username) {
        this.client = Objects.requireNonNull(client, "client");
        this.time = Objects.requireNonNull(time, "time");
        this.username = username;
    }

    /** querymonitorlist: groups[].devices[].deviceid, без повторов, в порядке ответа. */
    public List<String> listDevices() throws ProviderException, InterruptedException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("username", username);
        ProviderResponse resp = client.call("querymonitorlist", params);

        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode group : resp.body().path("groups")) {
            for (JsonNode device : group.path("devices")) {
                String id = device.path("deviceid").asText(null);
                if (id != null && !id.isBlank()) ids.add(id.trim());
            }
        }
        log.info("provider lists {} devices", ids.size());
        return List.copyOf(ids);
    }

    /**
     * querytrack за [from, to]. Время окна уходит строкой в часовом поясе провайдера.
     */
    public List<RawTelemetryRecord> queryTrack(String deviceId, Instant from, Instant to)
            throws ProviderException, InterruptedException {
        Objects.requireNonNull(deviceId, "deviceId");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("to < from: " + from + " .. " + to);
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("deviceid", deviceId);
        params.put("starttime", time.format(from));
        params.put("endtime", time.format(to));
        params.put("coordsys", "wgs84");
        ProviderResponse resp = client.call("querytrack", params);

        List<JsonNode> rows = resp.records();
        List<RawTelemetryRecord> out = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            out.add(RawTelemetryRecord.fromJson(row, deviceId));
        }
        log.debug("device {}: querytrack {} .. {} → {} records", deviceId, from, to, out.size());
        return out;
    }
}
