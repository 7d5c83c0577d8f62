package com.rde.ingestion.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rde.ingestion.domain.ExportDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

public class LocalExportStorage implements ExportStorage {

    static final String LATEST_FILE_NAME = "latest.json";

    private final Path basePath;
    private final ObjectMapper objectMapper;

    public LocalExportStorage(Path basePath) {
        this.basePath = basePath;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String store(String name, ExportDocument document) {
        try {
            Files.createDirectories(basePath);
            String safeFileName = name.replace("/", "_").replace("\\", "_");
            if (!safeFileName.endsWith(".json")) {
                safeFileName = safeFileName + ".json";
            }
            Path target = basePath.resolve(safeFileName);
            byte[] bytes = objectMapper.writeValueAsBytes(document);
            Files.write(target, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            Files.copy(target, basePath.resolve(LATEST_FILE_NAME), StandardCopyOption.REPLACE_EXISTING);
            return target.toAbsolutePath().toString();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to store export document " + name, e);
        }
    }
}
