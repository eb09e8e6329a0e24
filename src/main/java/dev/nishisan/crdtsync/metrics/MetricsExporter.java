/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.crdtsync.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.nishisan.crdtsync.conflict.ConflictRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the collector histories of a time window as the JSON document
 * consumed by external dashboards.
 */
public final class MetricsExporter {

    private static final Logger logger = LoggerFactory.getLogger(MetricsExporter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final ObjectWriter WRITER = MAPPER.writer(
            new DefaultPrettyPrinter().withArrayIndenter(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE));

    private final MetricsCollector collector;

    public MetricsExporter(MetricsCollector collector) {
        this.collector = Objects.requireNonNull(collector, "collector");
    }

    /**
     * @param windowHours window length in hours
     * @return the export document as indented JSON
     */
    public String export(int windowHours) {
        Map<String, Object> document = buildExport(windowHours);
        try {
            return WRITER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render metrics export", e);
        }
    }

    Map<String, Object> buildExport(int windowHours) {
        Instant now = collector.clock().instant();
        Instant since = collector.windowStart(windowHours);
        List<HealthSample> health = collector.healthSamplesSince(since);
        List<SyncAttempt> syncs = collector.syncAttemptsSince(since);
        List<ConflictRecord> conflicts = collector.conflictsSince(since);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_health_records", health.size());
        summary.put("total_sync_records", syncs.size());
        summary.put("total_conflict_records", conflicts.size());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("export_timestamp", now);
        document.put("time_range_hours", windowHours);
        document.put("health_metrics", health);
        document.put("sync_metrics", syncs);
        document.put("conflict_metrics", conflicts);
        document.put("summary", summary);
        logger.debug("Exporting {} health, {} sync and {} conflict records over {}h",
                health.size(), syncs.size(), conflicts.size(), windowHours);
        return document;
    }
}
