package com.fleetsync.core.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Перевод меток времени провайдера в UTC и обратно.
 * Числа: epoch ms (или секунды, если меньше порога 2000-01-01 в ms).
 * Строки "yyyy-MM-dd HH:mm:ss" в локальном поясе провайдера.
 */
public final class ProviderTime {
    private static final Logger log = LoggerFactory.getLogger(ProviderTime.class);

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final long YEAR_2000_MS = Instant.parse("2000-01-01T00:00:00Z").toEpochMilli();
    private static final long FUTURE_TOLERANCE_MS = 5 * 60_000L;

    private final ZoneId zone;
    private final Clock clock;

    public ProviderTime(ZoneId zone, Clock clock) {
        this.zone = zone;
        this.clock = clock;
    }

    public ZoneId zone() {
        return zone;
    }

    /** Пусто, если значение не разбирается или вне [2000-01-01, now + 5 мин]. */
    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String s = raw.trim();
        Instant result;
        if (s.indexOf('-') > 0) {
            try {
                // допускаем и "yyyy-MM-dd HH:mm", и без времени вовсе
                String norm = s.replace('T', ' ');
                if (norm.length() == 10) norm = norm + " 00:00:00";
                else if (norm.length() == 16) norm = norm + ":00";
                else if (norm.length() > 19) norm = norm.substring(0, 19);
                result = LocalDateTime.parse(norm, FORMAT).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                log.warn("unparseable provider timestamp '{}'", raw);
                return Optional.empty();
            }
        } else {
            long num;
            try {
                num = (long) Double.parseDouble(s);
            } catch (NumberFormatException e) {
                log.warn("unparseable provider timestamp '{}'", raw);
                return Optional.empty();
            }
            long ms = num < YEAR_2000_MS ? num * 1000L : num;
            result = Instant.ofEpochMilli(ms);
        }
        long ms = result.toEpochMilli();
        if (ms < YEAR_2000_MS || ms > clock.millis() + FUTURE_TOLERANCE_MS) {
            log.warn("provider timestamp out of range: '{}' -> {}", raw, result);
            return Optional.empty();
        }
        return Optional.of(result);
    }

    /** Формат для параметров запросов (starttime/endtime). */
    public String format(Instant t) {
        return FORMAT.format(t.atZone(zone));
    }
}
