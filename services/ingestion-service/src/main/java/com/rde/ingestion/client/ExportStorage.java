package com.rde.ingestion.client;

import com.rde.ingestion.domain.ExportDocument;

public interface ExportStorage {

    String store(String name, ExportDocument document);
}
