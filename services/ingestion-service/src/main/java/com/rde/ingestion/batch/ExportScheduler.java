package com.rde.ingestion.batch;

import com.rde.ingestion.client.ExportStorage;
import com.rde.ingestion.config.EngineProperties;
import com.rde.ingestion.service.MonitorStoppedEvent;
import com.rde.ingestion.service.QueryService;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Writes the full export document periodically and once more when the monitor stops.
 */
@Component
public class ExportScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExportScheduler.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
        .withZone(ZoneOffset.UTC);

    private final EngineProperties properties;
    private final QueryService queryService;
    private final ExportStorage exportStorage;
    private final Clock clock;

    public ExportScheduler(
        EngineProperties properties,
        QueryService queryService,
        ExportStorage exportStorage,
        Clock clock
    ) {
        this.properties = properties;
        this.queryService = queryService;
        this.exportStorage = exportStorage;
        this.clock = clock;
    }

    @Scheduled(
        fixedDelayString = "${engine.export.interval-ms:300000}",
        initialDelayString = "${engine.export.interval-ms:300000}"
    )
    public void runScheduledExport() {
        if (!properties.getExport().isEnabled()) {
            return;
        }
        writeExport();
    }

    @EventListener
    public void onMonitorStopped(MonitorStoppedEvent event) {
        if (!properties.getExport().isEnabled()) {
            return;
        }
        LOGGER.info("Writing final export after monitor stop at {}", event.stoppedAt());
        writeExport();
    }

    Optional<String> writeExport() {
        String name = "reddit_data_" + FILE_STAMP.format(clock.instant()) + ".json";
        try {
            String location = exportStorage.store(name, queryService.fullExport());
            LOGGER.info("Export written to {}", location);
            return Optional.of(location);
        } catch (RuntimeException ex) {
            LOGGER.error("Export {} failed", name, ex);
            return Optional.empty();
        }
    }
}
