package com.williamcallahan.skillcatalog.service.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.store.FlagStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-period run counters for pipeline stages.
 *
 * <p>Counters are accumulated as a JSON object under {@code metrics:{stage}:{period}} in the
 * flag store, and mirrored to Micrometer as {@code skillcatalog.{stage}.{counter}}.</p>
 */
@Component
public class PipelineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PipelineMetrics.class);
    private static final TypeReference<LinkedHashMap<String, Long>> COUNTERS = new TypeReference<>() {};

    public static final Duration CLASSIFICATION_TTL = Duration.ofDays(7);
    public static final Duration TIER_REFRESH_TTL = Duration.ofDays(30);
    public static final Duration ARCHIVE_TTL = Duration.ofDays(365);
    public static final Duration RESURRECTION_TTL = Duration.ofDays(365);

    private final FlagStore flagStore;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public PipelineMetrics(FlagStore flagStore, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.flagStore = flagStore;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Adds counter deltas to a stage's period bucket.
     *
     * @param stage stage name, e.g. {@code tier-refresh}
     * @param period period key, see the static period helpers
     * @param ttl lifetime of the bucket
     * @param deltas counter increments
     */
    public synchronized void record(String stage, String period, Duration ttl, Map<String, Long> deltas) {
        String key = key(stage, period);
        Map<String, Long> counters = read(stage, period).orElseGet(LinkedHashMap::new);
        deltas.forEach((counter, delta) -> {
            counters.merge(counter, delta, Long::sum);
            if (delta > 0) {
                meterRegistry.counter("skillcatalog." + stage + "." + counter).increment(delta);
            }
        });
        try {
            flagStore.put(key, objectMapper.writeValueAsString(counters), ttl);
        } catch (JsonProcessingException serializationFailure) {
            log.warn("Could not serialize metrics for {}: {}", key, serializationFailure.getMessage());
        }
    }

    /**
     * Reads the counters of one bucket.
     */
    public Optional<Map<String, Long>> read(String stage, String period) {
        String key = key(stage, period);
        return flagStore.get(key).flatMap(json -> {
            try {
                Map<String, Long> counters = objectMapper.readValue(json, COUNTERS);
                return Optional.of(counters);
            } catch (JsonProcessingException corrupt) {
                log.warn("Discarding unreadable metrics bucket {}: {}", key, corrupt.getMessage());
                return Optional.empty();
            }
        });
    }

    /** {@code yyyy-MM-ddTHH} in UTC. */
    public static String hourly(Instant now) {
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        return String.format("%s-%02d-%02dT%02d",
                utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth(), utc.getHour());
    }

    /** {@code yyyy-MM-dd} in UTC. */
    public static String daily(Instant now) {
        return now.atZone(ZoneOffset.UTC).toLocalDate().toString();
    }

    /** {@code yyyy-MM} in UTC. */
    public static String monthly(Instant now) {
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        return String.format("%04d-%02d", utc.getYear(), utc.getMonthValue());
    }

    /** {@code yyyy-Qn} in UTC. */
    public static String quarterly(Instant now) {
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        return utc.getYear() + "-Q" + ((utc.getMonthValue() - 1) / 3 + 1);
    }

    private static String key(String stage, String period) {
        return "metrics:" + stage + ":" + period;
    }
}
