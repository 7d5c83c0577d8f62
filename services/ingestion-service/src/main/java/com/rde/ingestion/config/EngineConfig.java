package com.rde.ingestion.config;

import com.rde.ingestion.client.ExportStorage;
import com.rde.ingestion.client.LocalExportStorage;
import com.rde.ingestion.service.Aggregator;
import com.rde.ingestion.service.ItemAnalyzer;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ItemAnalyzer itemAnalyzer(EngineProperties properties) {
        return new ItemAnalyzer(properties.getAnalyzer());
    }

    @Bean
    Aggregator aggregator(EngineProperties properties, Clock clock) {
        Aggregator aggregator = new Aggregator(
            properties.retention(),
            properties.getPriorityBufferSize(),
            properties.isLazyEviction(),
            clock
        );
        aggregator.registerSources(properties.getSources().stream()
            .map(EngineProperties.Source::getName)
            .toList());
        return aggregator;
    }

    @Bean
    ExportStorage exportStorage(EngineProperties properties) {
        return new LocalExportStorage(Path.of(properties.getExport().getDirectory()));
    }
}
